package com.enclave.sandbox;

import com.enclave.core.error.SandboxErrorKind;
import com.enclave.core.error.SandboxException;
import com.enclave.core.metrics.EnclaveMetrics;
import com.enclave.core.security.FileInputPolicy;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.RemoveContainerCmd;
import com.github.dockerjava.api.command.StopContainerCmd;
import com.github.dockerjava.api.exception.NotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SandboxCleanerTest {

    @TempDir
    Path tempDir;

    private DockerClient dockerClient;
    private ContainerLifecycleManager lifecycle;
    private HostFileBridge fileBridge;
    private RepositoryOperations repositories;
    private SandboxProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private SandboxCleaner cleaner;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        properties = new SandboxProperties();
        meterRegistry = new SimpleMeterRegistry();
        var metrics = new EnclaveMetrics(meterRegistry);
        lifecycle = new ContainerLifecycleManager(dockerClient, properties, metrics);
        fileBridge = new HostFileBridge(tempDir.resolve("sandbox"), "/workspace",
                new FileInputPolicy(List.of(), List.of(), 0, 0), 0, metrics);
        repositories = mock(RepositoryOperations.class);
        cleaner = new SandboxCleaner(lifecycle, fileBridge, repositories, properties, metrics);

        when(dockerClient.stopContainerCmd(anyString())).thenAnswer(inv -> mock(StopContainerCmd.class, RETURNS_SELF));
        when(dockerClient.removeContainerCmd(anyString())).thenAnswer(inv -> mock(RemoveContainerCmd.class, RETURNS_SELF));
    }

    @Test
    void cleanupContainerStopsRemovesAndUntracks() {
        track("c-1");

        assertTrue(cleaner.cleanupContainer("c-1"));

        verify(dockerClient).stopContainerCmd("c-1");
        verify(dockerClient).removeContainerCmd("c-1");
        verify(repositories).forget("c-1");
        assertFalse(lifecycle.registry().contains("c-1"));
    }

    @Test
    void secondCleanupIsANoOpThatDoesNotThrow() {
        track("c-1");
        cleaner.cleanupContainer("c-1");

        var removeCmd = mock(RemoveContainerCmd.class, RETURNS_SELF);
        when(removeCmd.exec()).thenThrow(new NotFoundException("No such container: c-1"));
        when(dockerClient.removeContainerCmd("c-1")).thenReturn(removeCmd);
        var stopCmd = mock(StopContainerCmd.class, RETURNS_SELF);
        when(stopCmd.exec()).thenThrow(new NotFoundException("No such container: c-1"));
        when(dockerClient.stopContainerCmd("c-1")).thenReturn(stopCmd);

        assertDoesNotThrow(() -> cleaner.cleanupContainer("c-1"));
        assertEquals(0, lifecycle.registry().size());
    }

    @Test
    void concurrentCleanupsReduceRegistryByExactlyTwo() throws Exception {
        track("c-1");
        track("c-2");
        track("c-3");
        var start = new CountDownLatch(1);
        var pool = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> first = pool.submit(() -> { start.await(); return cleaner.cleanupContainer("c-1"); });
            Future<Boolean> second = pool.submit(() -> { start.await(); return cleaner.cleanupContainer("c-2"); });
            start.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS));
            assertTrue(second.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(List.of("c-3"), lifecycle.registry().ids());
    }

    @Test
    void removalFailureIsLoggedCountedAndStillUntracked() {
        track("c-busy");
        var removeCmd = mock(RemoveContainerCmd.class, RETURNS_SELF);
        when(removeCmd.exec()).thenThrow(new RuntimeException("device or resource busy"));
        when(dockerClient.removeContainerCmd("c-busy")).thenReturn(removeCmd);

        assertFalse(cleaner.cleanupContainer("c-busy"));

        assertFalse(lifecycle.registry().contains("c-busy"));
        assertEquals(1.0, meterRegistry.find("enclave.cleanup.failures")
                .tag("resource", "container").counter().count());
    }

    @Test
    void cleanupAllContinuesPastFailures() throws Exception {
        track("c-ok");
        track("c-busy");
        var removeCmd = mock(RemoveContainerCmd.class, RETURNS_SELF);
        when(removeCmd.exec()).thenThrow(new RuntimeException("busy"));
        when(dockerClient.removeContainerCmd("c-busy")).thenReturn(removeCmd);
        Path s1 = fileBridge.createSessionDir("session-");
        Path s2 = fileBridge.createSessionDir("session-");
        Files.writeString(s2.resolve("main.py"), "print(1)");

        int failures = cleaner.cleanupAll();

        assertEquals(1, failures);
        assertEquals(0, lifecycle.registry().size());
        assertFalse(Files.exists(s1));
        assertFalse(Files.exists(s2));
        assertTrue(fileBridge.activeSessions().isEmpty());
    }

    @Test
    void cleanupAllWithNothingTrackedDoesNothing() {
        assertEquals(0, cleaner.cleanupAll());
        verifyNoInteractions(dockerClient);
    }

    @Test
    void sessionOutsideRootIsRefused() {
        var e = assertThrows(SandboxException.class, () -> cleaner.cleanupSessionDir(tempDir));
        assertEquals(SandboxErrorKind.SECURITY_VIOLATION, e.kind());
        assertTrue(Files.isDirectory(tempDir));
    }

    @Test
    void shutdownHookHonoursConfiguration() {
        track("c-1");
        properties.getSandbox().setCleanupOnShutdown(false);
        cleaner.cleanupOnShutdown();
        assertTrue(lifecycle.registry().contains("c-1"));

        properties.getSandbox().setCleanupOnShutdown(true);
        cleaner.cleanupOnShutdown();
        assertFalse(lifecycle.registry().contains("c-1"));
    }

    private void track(String id) {
        lifecycle.registry().register(new ContainerHandle(id, "ubuntu:latest", ResourceLimits.of(0.5, "256m"),
                "none", "1000:1000", List.of(), ContainerStatus.RUNNING));
    }
}
