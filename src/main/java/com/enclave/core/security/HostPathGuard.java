package com.enclave.core.security;

import com.enclave.core.error.SandboxException;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Map;

/**
 * Confines host-side path operations to a root directory.
 *
 * <p>{@link #resolveWithin} is purely lexical ({@link Path#normalize()}), so it is safe
 * to run before anything exists on disk. {@link #requireNoSymlinks} additionally refuses
 * paths that pass through a symbolic link, since directories under a session can be
 * written by a container. Both run before the caller's own I/O.
 */
public final class HostPathGuard {

    private HostPathGuard() {}

    /**
     * Resolves {@code relativePath} against {@code root}, rejecting absolute paths,
     * empty paths and anything that normalizes to the root itself or outside it.
     *
     * @return the normalized absolute path, strictly below {@code root}
     * @throws SandboxException SECURITY_VIOLATION when the path escapes the root
     */
    public static Path resolveWithin(Path root, String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw SandboxException.securityViolation("Empty path is not allowed",
                    Map.of("root", String.valueOf(root)));
        }
        Path relative;
        try {
            relative = Path.of(relativePath);
        } catch (InvalidPathException e) {
            throw SandboxException.securityViolation("Invalid path: " + relativePath,
                    Map.of("root", root.toString(), "path", relativePath));
        }
        if (relative.isAbsolute() || relativePath.startsWith("/") || relativePath.startsWith("\\")) {
            throw SandboxException.securityViolation("Absolute path is not allowed: " + relativePath,
                    Map.of("root", root.toString(), "path", relativePath));
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path resolved = normalizedRoot.resolve(relative).normalize();
        if (!isStrictDescendant(normalizedRoot, resolved)) {
            throw SandboxException.securityViolation("Path escapes its root: " + relativePath,
                    Map.of("root", normalizedRoot.toString(), "path", relativePath));
        }
        return resolved;
    }

    /**
     * Rejects {@code path} when any of its existing components below {@code root},
     * including the last one, is a symbolic link. Components that do not exist yet are
     * fine; nothing below a missing component can be a link.
     *
     * @throws SandboxException SECURITY_VIOLATION naming the offending link
     */
    public static void requireNoSymlinks(Path root, Path path) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalizedPath = path.toAbsolutePath().normalize();
        if (!normalizedPath.startsWith(normalizedRoot)) {
            throw SandboxException.securityViolation("Path escapes its root: " + path,
                    Map.of("root", normalizedRoot.toString(), "path", normalizedPath.toString()));
        }
        Path current = normalizedRoot;
        for (Path part : normalizedRoot.relativize(normalizedPath)) {
            current = current.resolve(part);
            if (Files.isSymbolicLink(current)) {
                throw SandboxException.securityViolation("Path passes through a symbolic link: " + current,
                        Map.of("root", normalizedRoot.toString(), "path", normalizedPath.toString(),
                                "link", current.toString()));
            }
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                return;
            }
        }
    }

    /**
     * Returns true when {@code candidate} normalizes to a path strictly below {@code root}.
     */
    public static boolean isStrictDescendant(Path root, Path candidate) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalizedCandidate = candidate.toAbsolutePath().normalize();
        return normalizedCandidate.startsWith(normalizedRoot) && !normalizedCandidate.equals(normalizedRoot);
    }
}
