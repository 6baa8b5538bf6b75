package com.autodev.coordinator.service;

/**
 * Builds lock keys. File paths are scoped to their repository so that two
 * repositories with the same relative path never contend.
 */
public final class ResourceKeys {

    private ResourceKeys() {}

    /** "repo:&lt;ref&gt;:&lt;path&gt;" with the path normalised to forward slashes and no leading "./" or "/". */
    public static String file(String repoRef, String path) {
        if (repoRef == null || repoRef.isBlank()) {
            throw new IllegalArgumentException("repoRef is required");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        String p = path.replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        return "repo:" + repoRef + ":" + p;
    }

    /** Whole-repository key, e.g. for a merge. */
    public static String repository(String repoRef) {
        if (repoRef == null || repoRef.isBlank()) {
            throw new IllegalArgumentException("repoRef is required");
        }
        return "repo:" + repoRef;
    }
}
