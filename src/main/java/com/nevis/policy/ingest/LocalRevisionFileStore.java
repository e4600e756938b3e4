package com.nevis.policy.ingest;

import com.nevis.policy.config.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

@Slf4j
@Component
public class LocalRevisionFileStore implements RevisionFileStore {

    private final Path root;

    public LocalRevisionFileStore(StorageProperties properties) {
        this.root = Path.of(properties.root()).toAbsolutePath().normalize();
    }

    @Override
    public String store(String source, String revisionKey, String originalFilename, byte[] content) {
        String filename = sanitize(originalFilename == null || originalFilename.isBlank() ? "document.pdf" : originalFilename);
        Path target = resolve(source + "/" + revisionKey + "/" + UUID.randomUUID() + "_" + filename);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store file for " + source, e);
        }
        String reference = root.relativize(target).toString().replace('\\', '/');
        log.info("Stored {} bytes for {} at {}", content.length, source, reference);
        return reference;
    }

    @Override
    public byte[] read(String fileReference) {
        try {
            return Files.readAllBytes(resolve(fileReference));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + fileReference, e);
        }
    }

    @Override
    public void delete(String fileReference) {
        if (fileReference == null) {
            return;
        }
        try {
            Files.deleteIfExists(resolve(fileReference));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + fileReference, e);
        }
    }

    private Path resolve(String reference) {
        Path path = root.resolve(reference).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("File reference escapes storage root: " + reference);
        }
        return path;
    }

    private static String sanitize(String filename) {
        String name = Path.of(filename).getFileName().toString();
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
