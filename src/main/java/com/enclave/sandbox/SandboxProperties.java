package com.enclave.sandbox;

import com.enclave.core.error.SandboxException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "enclave")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public String getBaseImage() { return sandbox.baseImage; }
    public Path getTempHostDir() { return Path.of(sandbox.tempHostDir); }
    public String getSessionPrefix() { return sandbox.sessionPrefix; }
    public String getDefaultNetworkMode() { return sandbox.defaultNetworkMode; }
    public String getContainerUser() { return sandbox.containerUser; }
    public String getContainerWorkdir() { return sandbox.containerWorkdir; }
    public long getPidsLimit() { return sandbox.pidsLimit; }
    public long getCommandTimeoutMs() { return sandbox.commandTimeoutMs; }
    public long getMaxOutputBytes() { return sandbox.maxOutputBytes; }
    public List<String> getAllowedFileExtensions() { return sandbox.allowedFileExtensions; }
    public List<String> getBlockedFileExtensions() { return sandbox.blockedFileExtensions; }
    public long getMaxFileSizeBytes() { return sandbox.maxFileSizeBytes; }
    public int getMaxFileCount() { return sandbox.maxFileCount; }
    public boolean isPullMissingImages() { return sandbox.pullMissingImages; }
    public int getImagePullTimeoutSeconds() { return sandbox.imagePullTimeoutSeconds; }
    public boolean isCleanupOnShutdown() { return sandbox.cleanupOnShutdown; }
    public int getAsyncPoolSize() { return sandbox.asyncPoolSize; }
    public Limits getDefaultResourceLimits() { return sandbox.defaultResourceLimits; }
    public Repository getRepository() { return sandbox.repository; }

    /**
     * Default limits parsed into bytes / CPU fraction.
     * Fails with RESOURCE_LIMIT when the configured values are unusable.
     */
    public ResourceLimits resolveDefaultLimits() {
        return ResourceLimits.of(sandbox.defaultResourceLimits.cpus, sandbox.defaultResourceLimits.memory);
    }

    /**
     * Rejects a blank user and any user or group that maps to root, by name or by id.
     * Called while binding, so a root user stops the application from starting.
     */
    static String requireNonRootUser(String user) {
        if (user == null || user.isBlank()) {
            throw SandboxException.securityViolation("Container user must be set",
                    Map.of("containerUser", String.valueOf(user)));
        }
        String trimmed = user.strip();
        for (String part : trimmed.split(":", -1)) {
            if (isRoot(part)) {
                throw SandboxException.securityViolation("Container user must not be root: " + trimmed,
                        Map.of("containerUser", trimmed));
            }
        }
        return trimmed;
    }

    private static boolean isRoot(String part) {
        // "0", "00" and so on are all uid/gid 0
        return part.equals("root") || (!part.isEmpty() && part.chars().allMatch(c -> c == '0'));
    }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    public static class Sandbox {
        private String baseImage = "ubuntu:latest";
        private String tempHostDir = Path.of(System.getProperty("java.io.tmpdir"), "enclave-sandbox").toString();
        private String sessionPrefix = "session-";
        private String defaultNetworkMode = "none";
        private String containerUser = "1000:1000";
        private String containerWorkdir = "/workspace";
        private long pidsLimit = 256;
        private long commandTimeoutMs = 30_000;
        private long maxOutputBytes = 1024 * 1024;
        private List<String> allowedFileExtensions = new ArrayList<>();
        private List<String> blockedFileExtensions = new ArrayList<>(List.of(".exe", ".dll", ".so", ".dylib", ".bin"));
        private long maxFileSizeBytes = 1024 * 1024;
        private int maxFileCount = 200;
        private boolean pullMissingImages = true;
        private int imagePullTimeoutSeconds = 300;
        private boolean cleanupOnShutdown = true;
        private int asyncPoolSize = 8;
        private Limits defaultResourceLimits = new Limits();
        private Repository repository = new Repository();

        public String getBaseImage() { return baseImage; }
        public void setBaseImage(String baseImage) { this.baseImage = baseImage; }
        public String getTempHostDir() { return tempHostDir; }
        public void setTempHostDir(String tempHostDir) { this.tempHostDir = tempHostDir; }
        public String getSessionPrefix() { return sessionPrefix; }
        public void setSessionPrefix(String sessionPrefix) { this.sessionPrefix = sessionPrefix; }
        public String getDefaultNetworkMode() { return defaultNetworkMode; }
        public void setDefaultNetworkMode(String defaultNetworkMode) { this.defaultNetworkMode = defaultNetworkMode; }
        public String getContainerUser() { return containerUser; }
        public void setContainerUser(String containerUser) { this.containerUser = requireNonRootUser(containerUser); }
        public String getContainerWorkdir() { return containerWorkdir; }
        public void setContainerWorkdir(String containerWorkdir) { this.containerWorkdir = containerWorkdir; }
        public long getPidsLimit() { return pidsLimit; }
        public void setPidsLimit(long pidsLimit) { this.pidsLimit = pidsLimit; }
        public long getCommandTimeoutMs() { return commandTimeoutMs; }
        public void setCommandTimeoutMs(long commandTimeoutMs) { this.commandTimeoutMs = commandTimeoutMs; }
        public long getMaxOutputBytes() { return maxOutputBytes; }
        public void setMaxOutputBytes(long maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }
        public List<String> getAllowedFileExtensions() { return allowedFileExtensions; }
        public void setAllowedFileExtensions(List<String> allowedFileExtensions) { this.allowedFileExtensions = allowedFileExtensions; }
        public List<String> getBlockedFileExtensions() { return blockedFileExtensions; }
        public void setBlockedFileExtensions(List<String> blockedFileExtensions) { this.blockedFileExtensions = blockedFileExtensions; }
        public long getMaxFileSizeBytes() { return maxFileSizeBytes; }
        public void setMaxFileSizeBytes(long maxFileSizeBytes) { this.maxFileSizeBytes = maxFileSizeBytes; }
        public int getMaxFileCount() { return maxFileCount; }
        public void setMaxFileCount(int maxFileCount) { this.maxFileCount = maxFileCount; }
        public boolean isPullMissingImages() { return pullMissingImages; }
        public void setPullMissingImages(boolean pullMissingImages) { this.pullMissingImages = pullMissingImages; }
        public int getImagePullTimeoutSeconds() { return imagePullTimeoutSeconds; }
        public void setImagePullTimeoutSeconds(int imagePullTimeoutSeconds) { this.imagePullTimeoutSeconds = imagePullTimeoutSeconds; }
        public boolean isCleanupOnShutdown() { return cleanupOnShutdown; }
        public void setCleanupOnShutdown(boolean cleanupOnShutdown) { this.cleanupOnShutdown = cleanupOnShutdown; }
        public int getAsyncPoolSize() { return asyncPoolSize; }
        public void setAsyncPoolSize(int asyncPoolSize) { this.asyncPoolSize = asyncPoolSize; }
        public Limits getDefaultResourceLimits() { return defaultResourceLimits; }
        public void setDefaultResourceLimits(Limits defaultResourceLimits) { this.defaultResourceLimits = defaultResourceLimits; }
        public Repository getRepository() { return repository; }
        public void setRepository(Repository repository) { this.repository = repository; }
    }

    public static class Limits {
        private double cpus = 0.5;
        private String memory = "256m";

        public double getCpus() { return cpus; }
        public void setCpus(double cpus) { this.cpus = cpus; }
        public String getMemory() { return memory; }
        public void setMemory(String memory) { this.memory = memory; }
    }

    public static class Repository {
        private String gitImage = "alpine/git:latest";
        private String networkMode = "bridge";
        private String cloneRoot = "/repo";
        private long cloneTimeoutMs = 120_000;
        private long maxReadBytes = 1024 * 1024;

        public String getGitImage() { return gitImage; }
        public void setGitImage(String gitImage) { this.gitImage = gitImage; }
        public String getNetworkMode() { return networkMode; }
        public void setNetworkMode(String networkMode) { this.networkMode = networkMode; }
        public String getCloneRoot() { return cloneRoot; }
        public void setCloneRoot(String cloneRoot) { this.cloneRoot = cloneRoot; }
        public long getCloneTimeoutMs() { return cloneTimeoutMs; }
        public void setCloneTimeoutMs(long cloneTimeoutMs) { this.cloneTimeoutMs = cloneTimeoutMs; }
        public long getMaxReadBytes() { return maxReadBytes; }
        public void setMaxReadBytes(long maxReadBytes) { this.maxReadBytes = maxReadBytes; }
    }
}
