package com.enclave.sandbox;

import com.enclave.core.error.SandboxErrorKind;
import com.enclave.core.error.SandboxException;
import com.enclave.core.metrics.EnclaveMetrics;
import com.enclave.sandbox.tools.PytestRunner;
import com.enclave.sandbox.tools.ToolRegistry;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.ExecCreateCmd;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.command.ExecStartCmd;
import com.github.dockerjava.api.command.InspectContainerCmd;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.InspectExecCmd;
import com.github.dockerjava.api.command.InspectExecResponse;
import com.github.dockerjava.api.command.InspectImageCmd;
import com.github.dockerjava.api.command.InspectImageResponse;
import com.github.dockerjava.api.command.RemoveContainerCmd;
import com.github.dockerjava.api.command.StartContainerCmd;
import com.github.dockerjava.api.command.StopContainerCmd;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Drives the asynchronous facade over real engine components, with only the Docker
 * client mocked.
 */
class SandboxManagerTest {

    private static final String CONTAINER = "c-python";

    @TempDir
    Path tempDir;

    private DockerClient dockerClient;
    private ContainerLifecycleManager lifecycle;
    private SandboxManager manager;
    private ExecCreateCmd execCreate;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        var properties = new SandboxProperties();
        properties.getSandbox().setTempHostDir(tempDir.resolve("sandbox").toString());
        var metrics = new EnclaveMetrics(new SimpleMeterRegistry());

        lifecycle = new ContainerLifecycleManager(dockerClient, properties, metrics);
        var fileBridge = new HostFileBridge(properties, metrics);
        var executor = new CommandExecutor(dockerClient, lifecycle, properties, metrics);
        var repositories = new RepositoryOperations(lifecycle, executor, fileBridge, properties, metrics);
        var cleaner = new SandboxCleaner(lifecycle, fileBridge, repositories, properties, metrics);
        var tools = new ToolRegistry(List.of(new PytestRunner(executor)));
        manager = new SandboxManager(fileBridge, lifecycle, executor, repositories, cleaner, tools, properties);

        mockContainerRuntime();
        execCreate = mockExecCreate("exec-1");
        when(dockerClient.execCreateCmd(CONTAINER)).thenReturn(execCreate);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void pythonScriptRunsAgainstMountedFile() throws Exception {
        mockExecStart("exec-1", new Frame(StreamType.STDOUT, "ok\n".getBytes(StandardCharsets.UTF_8)));
        mockExitCode("exec-1", 0L);

        Path session = await(manager.createSession());
        var mounts = await(manager.prepareFiles(session, Map.of("main.py", "print('ok')")));
        String containerId = await(manager.createAndStartContainer(
                ContainerRequest.withMounts("python:3.12-slim", mounts)));
        var result = await(manager.executeCommand(new ExecutionRequest(
                containerId, List.of("python", "main.py"), Map.of(), null, "/workspace")));

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("ok"));
        assertEquals("/workspace/main.py", mounts.get(0).containerPath());
        assertTrue(mounts.get(0).readOnly());
        verify(dockerClient).createContainerCmd("python:3.12-slim");

        assertTrue(await(manager.cleanupContainer(containerId)));
        assertTrue(await(manager.cleanupSessionDir(session)));
        assertEquals(0, manager.activeContainerCount());
        assertFalse(Files.exists(session));
    }

    @Test
    void timedOutCommandLeavesContainerTrackedAndCleanable() throws Exception {
        var killCreate = mockExecCreate("exec-kill");
        when(dockerClient.execCreateCmd(CONTAINER)).thenReturn(execCreate, killCreate);
        var hanging = mock(ExecStartCmd.class, RETURNS_SELF);
        when(dockerClient.execStartCmd("exec-1")).thenReturn(hanging);
        doAnswer(inv -> inv.getArgument(0)).when(hanging).exec(any());
        mockExecStart("exec-kill");

        String containerId = await(manager.createAndStartContainer(ContainerRequest.defaults()));
        var failure = failure(manager.executeCommand(
                ExecutionRequest.of(containerId, "sleep", "5").withTimeoutMs(100)));

        assertEquals(SandboxErrorKind.COMMAND_TIMEOUT, failure.kind());
        assertEquals(1, manager.activeContainerCount());
        assertTrue(lifecycle.registry().contains(containerId));

        assertTrue(await(manager.cleanupContainer(containerId)));
        assertEquals(0, manager.activeContainerCount());
    }

    @Test
    void repositoryFailuresSurfaceTheirKind() throws Exception {
        var failure = failure(manager.readRepositoryFile("not-a-repo", "/repo/../secret"));
        assertEquals(SandboxErrorKind.COMMAND_EXECUTION, failure.kind());

        var insecure = failure(manager.cloneRepository("http://example.com/repo.git", CloneOptions.defaults()));
        assertEquals(SandboxErrorKind.SECURITY_VIOLATION, insecure.kind());
        verify(dockerClient, never()).execCreateCmd(anyString());
    }

    @Test
    void unknownToolFailsWithCommandExecution() throws Exception {
        var failure = failure(manager.runTool("rubocop", CONTAINER, "/workspace"));
        assertEquals(SandboxErrorKind.COMMAND_EXECUTION, failure.kind());
    }

    @Test
    void failuresCompleteWithTheSandboxExceptionItself() {
        var future = manager.prepareFiles(tempDir, Map.of("a.txt", "a"));
        var e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(SandboxException.class, e.getCause());
    }

    @Test
    void cleaningADirectoryOutsideTheTempRootIsASecurityViolation() throws Exception {
        var failure = failure(manager.cleanupSessionDir(tempDir));
        assertEquals(SandboxErrorKind.SECURITY_VIOLATION, failure.kind());
        assertTrue(Files.isDirectory(tempDir));
    }

    @Test
    void operationsAfterShutdownFailFast() throws Exception {
        manager.shutdown();
        var failure = failure(manager.createSession());
        assertEquals(SandboxErrorKind.COMMAND_EXECUTION, failure.kind());
    }

    // ── helpers ────────────────────────────────────────────────────────

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static SandboxException failure(CompletableFuture<?> future) throws Exception {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return assertInstanceOf(SandboxException.class, e.getCause());
        }
        return fail("Expected the operation to fail");
    }

    private void mockContainerRuntime() {
        var inspectImage = mock(InspectImageCmd.class);
        when(dockerClient.inspectImageCmd(anyString())).thenReturn(inspectImage);
        when(inspectImage.exec()).thenReturn(mock(InspectImageResponse.class));

        var createCmd = mock(CreateContainerCmd.class, RETURNS_SELF);
        when(dockerClient.createContainerCmd(anyString())).thenReturn(createCmd);
        var created = mock(CreateContainerResponse.class);
        when(created.getId()).thenReturn(CONTAINER);
        when(createCmd.exec()).thenReturn(created);
        when(dockerClient.startContainerCmd(CONTAINER)).thenReturn(mock(StartContainerCmd.class));

        var inspect = mock(InspectContainerCmd.class);
        var response = mock(InspectContainerResponse.class);
        var state = mock(InspectContainerResponse.ContainerState.class);
        when(dockerClient.inspectContainerCmd(CONTAINER)).thenReturn(inspect);
        when(inspect.exec()).thenReturn(response);
        when(response.getState()).thenReturn(state);
        when(state.getRunning()).thenReturn(true);

        when(dockerClient.stopContainerCmd(CONTAINER)).thenReturn(mock(StopContainerCmd.class, RETURNS_SELF));
        when(dockerClient.removeContainerCmd(CONTAINER)).thenReturn(mock(RemoveContainerCmd.class, RETURNS_SELF));
    }

    private ExecCreateCmd mockExecCreate(String execId) {
        var cmd = mock(ExecCreateCmd.class, RETURNS_SELF);
        var response = mock(ExecCreateCmdResponse.class);
        when(response.getId()).thenReturn(execId);
        when(cmd.exec()).thenReturn(response);
        return cmd;
    }

    @SuppressWarnings("unchecked")
    private void mockExecStart(String execId, Frame... frames) {
        var startCmd = mock(ExecStartCmd.class, RETURNS_SELF);
        when(dockerClient.execStartCmd(execId)).thenReturn(startCmd);
        doAnswer(invocation -> {
            var callback = (ResultCallback<Frame>) invocation.getArgument(0);
            for (Frame frame : frames) {
                callback.onNext(frame);
            }
            callback.onComplete();
            return callback;
        }).when(startCmd).exec(any());
    }

    private void mockExitCode(String execId, Long exitCode) {
        var inspectCmd = mock(InspectExecCmd.class);
        var response = mock(InspectExecResponse.class);
        when(dockerClient.inspectExecCmd(execId)).thenReturn(inspectCmd);
        when(inspectCmd.exec()).thenReturn(response);
        when(response.getExitCodeLong()).thenReturn(exitCode);
        when(response.isRunning()).thenReturn(false);
    }
}
