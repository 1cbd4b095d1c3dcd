package com.enclave.sandbox;

import com.enclave.core.error.SandboxErrorKind;
import com.enclave.core.error.SandboxException;
import com.enclave.core.metrics.EnclaveMetrics;
import com.enclave.core.security.ContainerPaths;
import com.enclave.core.security.FileInputPolicy;
import com.enclave.core.security.HostPathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Host side of the sandbox: per-session scratch directories under one configured
 * root, and the files staged in them for mounting.
 *
 * <p>Every path a caller supplies is validated against its session directory before
 * any I/O happens, and session directories themselves must live under the temp root.
 * Output directories are container-writable, so paths through an existing symbolic
 * link are refused as well.
 * Staged inputs are mounted read-only; only directories requested through
 * {@link #prepareOutputDirectory} are writable from inside the container.
 */
@Service
public class HostFileBridge {

    private static final Logger log = LoggerFactory.getLogger(HostFileBridge.class);

    private final Path tempRoot;
    private final String containerWorkdir;
    private final FileInputPolicy inputPolicy;
    private final long maxCollectBytes;
    private final EnclaveMetrics metrics;

    /** Session directories created by this bridge and not yet cleaned up. */
    private final Set<Path> activeSessions = ConcurrentHashMap.newKeySet();

    @Autowired
    public HostFileBridge(SandboxProperties properties, @Autowired(required = false) EnclaveMetrics metrics) {
        this(properties.getTempHostDir(), properties.getContainerWorkdir(),
                new FileInputPolicy(properties.getAllowedFileExtensions(), properties.getBlockedFileExtensions(),
                        properties.getMaxFileSizeBytes(), properties.getMaxFileCount()),
                properties.getMaxFileSizeBytes(), metrics);
    }

    HostFileBridge(Path tempRoot, String containerWorkdir, FileInputPolicy inputPolicy,
                   long maxCollectBytes, EnclaveMetrics metrics) {
        this.tempRoot = tempRoot.toAbsolutePath().normalize();
        this.containerWorkdir = containerWorkdir;
        this.inputPolicy = inputPolicy;
        this.maxCollectBytes = maxCollectBytes;
        this.metrics = metrics;
    }

    public Path tempRoot() {
        return tempRoot;
    }

    public String containerWorkdir() {
        return containerWorkdir;
    }

    /**
     * Allocates a uniquely named directory under the temp root.
     *
     * @param prefix name prefix, e.g. {@code "session-"}; only letters, digits, '-' and '_' are kept
     * @return absolute path of the new directory
     * @throws SandboxException FILE_SYSTEM when the directory cannot be created
     */
    public Path createSessionDir(String prefix) {
        String safePrefix = prefix == null ? "" : prefix.replaceAll("[^A-Za-z0-9_-]", "");
        String name = safePrefix + System.currentTimeMillis() + "-" + UUID.randomUUID().toString().substring(0, 8);
        Path sessionDir = tempRoot.resolve(name);
        try {
            Files.createDirectories(tempRoot);
            Files.createDirectory(sessionDir);
        } catch (FileAlreadyExistsException e) {
            throw SandboxException.fileSystem("Session directory already exists: " + sessionDir,
                    Map.of("path", sessionDir.toString()), e);
        } catch (IOException | SecurityException e) {
            throw SandboxException.fileSystem("Failed to create session directory under " + tempRoot,
                    Map.of("path", sessionDir.toString()), e);
        }
        activeSessions.add(sessionDir);
        log.info("Created session directory {}", sessionDir);
        return sessionDir;
    }

    /**
     * Writes the given files into the session directory and returns one read-only
     * mount per file, targeting the same relative path under the container workdir.
     *
     * <p>All paths and policy limits are checked first; if any entry is rejected no
     * file is written.
     *
     * @param sessionDir a directory returned by {@link #createSessionDir}
     * @param files      relative path to UTF-8 content
     * @throws SandboxException SECURITY_VIOLATION for traversal or blocked extensions,
     *                          RESOURCE_LIMIT for size/count, FILE_SYSTEM for write failures
     */
    public List<MountSpec> prepareFilesForMount(Path sessionDir, Map<String, String> files) {
        Path session = requireSession(sessionDir);
        Map<String, String> safeFiles = files != null ? files : Map.of();

        var targets = new LinkedHashMap<Path, String>();
        var containerPaths = new LinkedHashMap<Path, String>();
        for (var entry : safeFiles.entrySet()) {
            String relative = entry.getKey();
            Path target = guard(() -> HostPathGuard.resolveWithin(session, relative), "path_traversal");
            guard(() -> { HostPathGuard.requireNoSymlinks(session, target); return null; }, "symlink");
            targets.put(target, entry.getValue() != null ? entry.getValue() : "");
            String portable = session.relativize(target).toString().replace('\\', '/');
            containerPaths.put(target, ContainerPaths.join(containerWorkdir, portable));
        }
        guard(() -> { inputPolicy.check(safeFiles); return null; }, "file_policy");

        var mounts = new ArrayList<MountSpec>();
        for (var entry : targets.entrySet()) {
            Path target = entry.getKey();
            try {
                Files.createDirectories(target.getParent());
                Files.writeString(target, entry.getValue(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE, LinkOption.NOFOLLOW_LINKS);
            } catch (IOException e) {
                throw SandboxException.fileSystem("Failed to stage file " + session.relativize(target),
                        Map.of("path", target.toString()), e);
            }
            mounts.add(MountSpec.readOnly(target, containerPaths.get(target)));
        }
        log.debug("Staged {} files in {}", mounts.size(), session);
        return mounts;
    }

    /**
     * Creates a writable directory inside the session for container output.
     *
     * @param relativeDir   directory under the session, e.g. {@code "output"}
     * @param containerPath absolute container path, or null for {@code <workdir>/<relativeDir>}
     */
    public MountSpec prepareOutputDirectory(Path sessionDir, String relativeDir, String containerPath) {
        Path session = requireSession(sessionDir);
        Path dir = guard(() -> HostPathGuard.resolveWithin(session, relativeDir), "path_traversal");
        guard(() -> { HostPathGuard.requireNoSymlinks(session, dir); return null; }, "symlink");
        try {
            Files.createDirectories(dir);
            makeWorldWritable(dir);
        } catch (IOException e) {
            throw SandboxException.fileSystem("Failed to create output directory " + relativeDir,
                    Map.of("path", dir.toString()), e);
        }
        String target = containerPath != null
                ? ContainerPaths.normalize("/", containerPath)
                : ContainerPaths.join(containerWorkdir, session.relativize(dir).toString().replace('\\', '/'));
        return MountSpec.writable(dir, target);
    }

    /**
     * Reads back every regular file produced under an output directory.
     * Symbolic links are skipped so a container cannot point the host at other files.
     *
     * @return relative path (to {@code relativeDir}) to UTF-8 content
     */
    public Map<String, String> collectOutputFiles(Path sessionDir, String relativeDir) {
        Path session = requireSession(sessionDir);
        Path dir = guard(() -> HostPathGuard.resolveWithin(session, relativeDir), "path_traversal");
        guard(() -> { HostPathGuard.requireNoSymlinks(session, dir); return null; }, "symlink");
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            throw SandboxException.fileSystem("Output directory does not exist: " + relativeDir,
                    Map.of("path", dir.toString()), null);
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            var files = walk
                    .filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                    .sorted()
                    .collect(Collectors.toList());
            var result = new LinkedHashMap<String, String>();
            for (Path file : files) {
                long size = Files.size(file);
                if (maxCollectBytes > 0 && size > maxCollectBytes) {
                    throw SandboxException.resourceLimit(
                            "Output file too large: %s is %d bytes".formatted(dir.relativize(file), size),
                            Map.of("path", file.toString(), "size", String.valueOf(size)));
                }
                result.put(dir.relativize(file).toString().replace('\\', '/'),
                        Files.readString(file, StandardCharsets.UTF_8));
            }
            return result;
        } catch (IOException e) {
            throw SandboxException.fileSystem("Failed to read output directory " + relativeDir,
                    Map.of("path", dir.toString()), e);
        }
    }

    /**
     * Recursively removes a session directory. Already-absent directories are fine.
     *
     * @throws SandboxException SECURITY_VIOLATION when the path is not below the temp root,
     *                          FILE_SYSTEM when deletion fails
     */
    public void cleanupSessionDir(Path hostPath) {
        Path session = requireSession(hostPath);
        activeSessions.remove(session);
        if (!Files.exists(session, LinkOption.NOFOLLOW_LINKS)) {
            log.debug("Session directory {} already absent", session);
            return;
        }
        try (Stream<Path> walk = Files.walk(session)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(p);
            }
        } catch (NoSuchFileException e) {
            log.debug("Session directory {} vanished during cleanup", session);
        } catch (IOException e) {
            throw SandboxException.fileSystem("Failed to remove session directory " + session,
                    Map.of("path", session.toString()), e);
        }
        log.info("Removed session directory {}", session);
    }

    public List<Path> activeSessions() {
        return List.copyOf(activeSessions);
    }

    public boolean isActive(Path sessionDir) {
        return activeSessions.contains(sessionDir.toAbsolutePath().normalize());
    }

    private Path requireSession(Path sessionDir) {
        if (sessionDir == null || !HostPathGuard.isStrictDescendant(tempRoot, sessionDir)) {
            recordViolation("outside_temp_root");
            throw SandboxException.securityViolation("Path is outside the sandbox temp root: " + sessionDir,
                    Map.of("path", String.valueOf(sessionDir), "root", tempRoot.toString()));
        }
        return sessionDir.toAbsolutePath().normalize();
    }

    private <T> T guard(Supplier<T> check, String reason) {
        try {
            return check.get();
        } catch (SandboxException e) {
            if (e.kind() == SandboxErrorKind.SECURITY_VIOLATION) {
                recordViolation(reason);
            }
            throw e;
        }
    }

    private void recordViolation(String reason) {
        if (metrics != null) {
            metrics.recordSecurityViolation(reason);
        }
    }

    private static void makeWorldWritable(Path dir) {
        try {
            Files.setPosixFilePermissions(dir, PosixFilePermissions.fromString("rwxrwxrwx"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Could not relax permissions on {}: {}", dir, e.getMessage());
        }
    }
}
