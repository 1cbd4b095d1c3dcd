package com.enclave.core.security;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * POSIX path handling for paths that live inside a container.
 *
 * <p>Container paths are always '/'-separated regardless of the host OS, so these
 * helpers work on strings instead of {@link java.nio.file.Path}.
 */
public final class ContainerPaths {

    private ContainerPaths() {}

    /**
     * Normalizes a container path: collapses duplicate separators, drops "." segments
     * and resolves ".." lexically. A ".." above the filesystem root stays at the root.
     * Relative input is resolved against {@code base}.
     */
    public static String normalize(String base, String path) {
        String joined = path.startsWith("/") ? path : base + "/" + path;
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : joined.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) continue;
            if (segment.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        return "/" + String.join("/", segments);
    }

    /**
     * Returns true when {@code path} (normalized) equals {@code root} or lies below it.
     */
    public static boolean isWithin(String root, String path) {
        String normalizedRoot = normalize("/", root);
        String normalizedPath = normalize(normalizedRoot, path);
        if (normalizedPath.equals(normalizedRoot)) return true;
        String prefix = normalizedRoot.endsWith("/") ? normalizedRoot : normalizedRoot + "/";
        return normalizedPath.startsWith(prefix);
    }

    public static String join(String parent, String child) {
        return normalize(parent, child);
    }
}
