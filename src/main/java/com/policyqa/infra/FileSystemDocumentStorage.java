package com.policyqa.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Component
public class FileSystemDocumentStorage implements DocumentStorage {

    private final Path root;

    public FileSystemDocumentStorage(@Value("${app.storage.root-dir}") String rootDir) {
        this.root = Path.of(rootDir).toAbsolutePath().normalize();
    }

    @Override
    public String store(Long documentId, String filename, byte[] content) {
        String ref = documentId + "_" + sanitize(filename);
        try {
            Files.createDirectories(root);
            Files.write(resolve(ref), content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store document " + documentId, e);
        }
        log.debug("Stored {} bytes for document {} as {}", content.length, documentId, ref);
        return ref;
    }

    @Override
    public byte[] load(String storageRef) {
        try {
            return Files.readAllBytes(resolve(storageRef));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stored document " + storageRef, e);
        }
    }

    @Override
    public void delete(String storageRef) {
        try {
            Files.deleteIfExists(resolve(storageRef));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete stored document " + storageRef, e);
        }
    }

    private Path resolve(String ref) {
        Path path = root.resolve(ref).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Storage reference escapes the storage root: " + ref);
        }
        return path;
    }

    private static String sanitize(String filename) {
        if (filename == null || filename.isBlank()) {
            return "upload";
        }
        return filename.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
