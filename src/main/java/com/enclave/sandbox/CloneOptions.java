package com.enclave.sandbox;

/**
 * @param branch    branch or tag to check out, or null for the remote default
 * @param timeoutMs clone timeout, or null for the configured default
 */
public record CloneOptions(String branch, Long timeoutMs) {

    public static CloneOptions defaults() {
        return new CloneOptions(null, null);
    }

    public static CloneOptions branch(String branch) {
        return new CloneOptions(branch, null);
    }
}
