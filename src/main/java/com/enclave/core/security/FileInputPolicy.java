package com.enclave.core.security;

import com.enclave.core.error.SandboxException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Limits on the files a caller may stage into a session: extension allow/block
 * lists, per-file size and total file count.
 */
public class FileInputPolicy {

    private final Set<String> allowedExtensions;
    private final Set<String> blockedExtensions;
    private final long maxFileSizeBytes;
    private final int maxFileCount;

    public FileInputPolicy(List<String> allowedExtensions, List<String> blockedExtensions,
                           long maxFileSizeBytes, int maxFileCount) {
        this.allowedExtensions = normalize(allowedExtensions);
        this.blockedExtensions = normalize(blockedExtensions);
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.maxFileCount = maxFileCount;
    }

    /**
     * Checks a whole file set. Nothing is written by this method; callers run it
     * before touching the filesystem.
     *
     * @throws SandboxException RESOURCE_LIMIT for count/size, SECURITY_VIOLATION for extensions
     */
    public void check(Map<String, String> files) {
        if (maxFileCount > 0 && files.size() > maxFileCount) {
            throw SandboxException.resourceLimit(
                    "Too many files: %d (max %d)".formatted(files.size(), maxFileCount),
                    Map.of("fileCount", String.valueOf(files.size())));
        }
        for (var entry : files.entrySet()) {
            checkExtension(entry.getKey());
            String content = entry.getValue() != null ? entry.getValue() : "";
            long size = content.getBytes(StandardCharsets.UTF_8).length;
            if (maxFileSizeBytes > 0 && size > maxFileSizeBytes) {
                throw SandboxException.resourceLimit(
                        "File too large: %s is %d bytes (max %d)".formatted(entry.getKey(), size, maxFileSizeBytes),
                        Map.of("path", entry.getKey(), "size", String.valueOf(size)));
            }
        }
    }

    void checkExtension(String relativePath) {
        String extension = extensionOf(relativePath);
        if (blockedExtensions.contains(extension)) {
            throw SandboxException.securityViolation("Blocked file extension: " + relativePath,
                    Map.of("path", relativePath, "extension", extension));
        }
        if (!allowedExtensions.isEmpty() && !allowedExtensions.contains(extension)) {
            throw SandboxException.securityViolation("File extension not allowed: " + relativePath,
                    Map.of("path", relativePath, "extension", extension));
        }
    }

    static String extensionOf(String relativePath) {
        String name = relativePath.substring(Math.max(relativePath.lastIndexOf('/'), relativePath.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static Set<String> normalize(List<String> extensions) {
        if (extensions == null) return Set.of();
        return extensions.stream()
                .filter(e -> e != null && !e.isBlank())
                .map(e -> e.startsWith(".") ? e : "." + e)
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
