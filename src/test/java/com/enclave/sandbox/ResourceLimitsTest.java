package com.enclave.sandbox;

import com.enclave.core.error.SandboxErrorKind;
import com.enclave.core.error.SandboxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ResourceLimitsTest {

    @ParameterizedTest
    @CsvSource({
            "256m, 268435456",
            "512M, 536870912",
            "1g, 1073741824",
            "64k, 65536",
            "1048576, 1048576",
            "100b, 100"
    })
    void parsesMemoryStrings(String input, long expected) {
        assertEquals(expected, ResourceLimits.parseMemory(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "lots", "1.5g", "-1m", "10t", "99999999999999999999g", "9999999999999g"})
    void rejectsUnparsableMemory(String input) {
        var e = assertThrows(SandboxException.class, () -> ResourceLimits.parseMemory(input));
        assertEquals(SandboxErrorKind.RESOURCE_LIMIT, e.kind());
    }

    @Test
    void nullMemoryIsRejected() {
        assertThrows(SandboxException.class, () -> ResourceLimits.parseMemory(null));
    }

    @Test
    void limitsAreNeverUnlimited() {
        assertEquals(SandboxErrorKind.RESOURCE_LIMIT,
                assertThrows(SandboxException.class, () -> new ResourceLimits(0, 1024)).kind());
        assertEquals(SandboxErrorKind.RESOURCE_LIMIT,
                assertThrows(SandboxException.class, () -> new ResourceLimits(-1, 1024)).kind());
        assertEquals(SandboxErrorKind.RESOURCE_LIMIT,
                assertThrows(SandboxException.class, () -> new ResourceLimits(Double.NaN, 1024)).kind());
        assertEquals(SandboxErrorKind.RESOURCE_LIMIT,
                assertThrows(SandboxException.class, () -> new ResourceLimits(1, 0)).kind());
        assertEquals(SandboxErrorKind.RESOURCE_LIMIT,
                assertThrows(SandboxException.class, () -> ResourceLimits.of(1, "0m")).kind());
    }

    @ParameterizedTest
    @ValueSource(doubles = {1e-10, 0.000_000_000_4, 0.005, 0.0099})
    void quotasTooSmallForDockerAreRejected(double cpus) {
        var e = assertThrows(SandboxException.class, () -> ResourceLimits.of(cpus, "256m"));
        assertEquals(SandboxErrorKind.RESOURCE_LIMIT, e.kind());
    }

    @Test
    void smallestAcceptedQuotaStillSetsNanoCpus() {
        assertEquals(10_000_000L, ResourceLimits.of(ResourceLimits.MIN_CPUS, "256m").nanoCpus());
    }

    @Test
    void nanoCpusConvertsFractionalQuota() {
        assertEquals(500_000_000L, ResourceLimits.of(0.5, "256m").nanoCpus());
        assertEquals(2_000_000_000L, ResourceLimits.of(2, "1g").nanoCpus());
    }
}
