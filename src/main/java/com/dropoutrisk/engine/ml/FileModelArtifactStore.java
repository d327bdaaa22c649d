package com.dropoutrisk.engine.ml;

import com.dropoutrisk.exception.ModelLifecycleException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores each artifact as {@code <version>.json} plus an {@code ACTIVE} pointer file.
 *
 * Every write goes to a temporary file first and is moved into place, so a reader of
 * the directory sees either the old or the new file, never a partial one.
 */
@Slf4j
public class FileModelArtifactStore implements ModelArtifactStore {

    private static final String ACTIVE_POINTER = "ACTIVE";
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileModelArtifactStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(ModelArtifact artifact) {
        try {
            writeAtomically(directory.resolve(artifact.version() + SUFFIX),
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(artifact));
            log.debug("Saved model artifact {} ({})", artifact.version(), artifact.state());
        } catch (IOException e) {
            throw new ModelLifecycleException("Failed to save model artifact " + artifact.version(), e);
        }
    }

    @Override
    public void saveActivePointer(String version) {
        try {
            writeAtomically(directory.resolve(ACTIVE_POINTER), version.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ModelLifecycleException("Failed to record active model " + version, e);
        }
    }

    @Override
    public List<ModelArtifact> loadAll() {
        if (!Files.isDirectory(directory)) {
            log.info("Model directory {} does not exist yet, no artifacts to load", directory);
            return List.of();
        }
        List<ModelArtifact> artifacts = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).sorted().toList()) {
                artifacts.add(objectMapper.readValue(file.toFile(), ModelArtifact.class));
            }
        } catch (IOException e) {
            throw new ModelLifecycleException("Failed to load model artifacts from " + directory, e);
        }
        log.info("Loaded {} model artifacts from {}", artifacts.size(), directory);
        return artifacts;
    }

    @Override
    public Optional<String> loadActivePointer() {
        Path pointer = directory.resolve(ACTIVE_POINTER);
        if (!Files.exists(pointer)) {
            return Optional.empty();
        }
        try {
            String version = Files.readString(pointer, StandardCharsets.UTF_8).trim();
            return version.isEmpty() ? Optional.empty() : Optional.of(version);
        } catch (IOException e) {
            throw new ModelLifecycleException("Failed to read active model pointer " + pointer, e);
        }
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
