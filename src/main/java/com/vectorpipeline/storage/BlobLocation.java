package com.vectorpipeline.storage;

/**
 * Bucket plus object path, written as {@code gs://bucket/path}.
 */
public record BlobLocation(String bucket, String path) {
    private static final String SCHEME = "gs://";

    public BlobLocation {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Blob bucket must not be blank");
        }
        path = path == null ? "" : path;
    }

    public static BlobLocation parse(String uri) {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Storage prefix must start with gs://, got " + uri);
        }
        String remainder = uri.substring(SCHEME.length());
        int slash = remainder.indexOf('/');
        if (slash < 0) {
            return new BlobLocation(remainder, "");
        }
        return new BlobLocation(remainder.substring(0, slash), remainder.substring(slash + 1));
    }

    /**
     * Path with exactly one trailing slash, or empty for the bucket root.
     */
    public String directoryPath() {
        String trimmed = path;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? "" : trimmed + "/";
    }

    public BlobLocation child(String name) {
        return new BlobLocation(bucket, directoryPath() + name);
    }

    public String uri() {
        return SCHEME + bucket + "/" + path;
    }

    @Override
    public String toString() {
        return uri();
    }
}
