package com.enclave.sandbox;

import com.enclave.core.error.SandboxErrorKind;
import com.enclave.core.error.SandboxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SandboxPropertiesTest {

    @Test
    void defaultsAreIsolatedAndBounded() {
        var props = new SandboxProperties();
        assertEquals("ubuntu:latest", props.getBaseImage());
        assertEquals("none", props.getDefaultNetworkMode());
        assertEquals("1000:1000", props.getContainerUser());
        assertEquals("/workspace", props.getContainerWorkdir());
        assertEquals(256, props.getPidsLimit());
        assertEquals(30_000, props.getCommandTimeoutMs());
        assertTrue(props.isCleanupOnShutdown());
        assertTrue(props.getBlockedFileExtensions().contains(".exe"));
    }

    @Test
    void defaultLimitsResolveToHalfCpuAnd256MiB() {
        var limits = new SandboxProperties().resolveDefaultLimits();
        assertEquals(0.5, limits.cpus());
        assertEquals(256L * 1024 * 1024, limits.memoryBytes());
    }

    @Test
    void repositoryDefaults() {
        var repo = new SandboxProperties().getRepository();
        assertEquals("alpine/git:latest", repo.getGitImage());
        assertEquals("bridge", repo.getNetworkMode());
        assertEquals("/repo", repo.getCloneRoot());
        assertEquals(120_000, repo.getCloneTimeoutMs());
    }

    @Test
    void unusableConfiguredLimitsFailWithResourceLimit() {
        var props = new SandboxProperties();
        props.getDefaultResourceLimits().setMemory("lots");
        var e = assertThrows(SandboxException.class, props::resolveDefaultLimits);
        assertEquals(SandboxErrorKind.RESOURCE_LIMIT, e.kind());
    }

    @Test
    void nestedSettersAreVisibleThroughDelegates() {
        var props = new SandboxProperties();
        props.getSandbox().setBaseImage("python:3.12-slim");
        props.getSandbox().setAllowedFileExtensions(List.of(".py"));
        assertEquals("python:3.12-slim", props.getBaseImage());
        assertEquals(List.of(".py"), props.getAllowedFileExtensions());
    }

    @ParameterizedTest
    @ValueSource(strings = {"root", "0", "00", "0:0", "root:root", "1000:0", "1000:root", "0:1000", " ", ""})
    void rootOrBlankContainerUserIsRejected(String user) {
        var sandbox = new SandboxProperties.Sandbox();
        var e = assertThrows(SandboxException.class, () -> sandbox.setContainerUser(user));
        assertEquals(SandboxErrorKind.SECURITY_VIOLATION, e.kind());
        assertEquals("1000:1000", sandbox.getContainerUser());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1000:1000", "1000", "nobody", "65534:65534", "10:100"})
    void unprivilegedContainerUserIsAccepted(String user) {
        var sandbox = new SandboxProperties.Sandbox();
        sandbox.setContainerUser(user);
        assertEquals(user, sandbox.getContainerUser());
    }
}
