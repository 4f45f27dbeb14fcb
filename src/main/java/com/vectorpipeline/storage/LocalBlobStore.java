package com.vectorpipeline.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * {@link BlobStore} backed by a directory: {@code gs://bucket/a/b} lives at {@code root/bucket/a/b}.
 */
public class LocalBlobStore implements BlobStore {
    private final Path root;

    public LocalBlobStore(Path root) {
        this.root = root;
    }

    @Override
    public List<BlobLocation> list(BlobLocation prefix) throws IOException {
        Path bucketDir = root.resolve(prefix.bucket());
        Path directory = prefix.directoryPath().isEmpty() ? bucketDir : bucketDir.resolve(prefix.directoryPath());
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(directory)) {
            return files.filter(Files::isRegularFile)
                    .map(file -> bucketDir.relativize(file).toString().replace('\\', '/'))
                    .sorted(Comparator.naturalOrder())
                    .map(name -> new BlobLocation(prefix.bucket(), name))
                    .toList();
        }
    }

    @Override
    public String readText(BlobLocation blob) throws IOException {
        return Files.readString(resolve(blob), StandardCharsets.UTF_8);
    }

    @Override
    public void writeText(BlobLocation blob, String content) throws IOException {
        Path target = resolve(blob);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
    }

    private Path resolve(BlobLocation blob) {
        Path bucketDir = root.resolve(blob.bucket()).normalize();
        Path resolved = bucketDir.resolve(blob.path()).normalize();
        if (!resolved.startsWith(bucketDir)) {
            throw new IllegalArgumentException("Blob path escapes its bucket: " + blob);
        }
        return resolved;
    }
}
