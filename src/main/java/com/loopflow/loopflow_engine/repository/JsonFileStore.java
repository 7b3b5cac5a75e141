package com.loopflow.loopflow_engine.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.exception.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * One directory of pretty-printed JSON documents. Writes go to a temp file first and are
 * moved into place, so readers never see a half-written document.
 */
@Slf4j
abstract class JsonFileStore<T> {

    private final Path directory;
    private final Class<T> type;
    protected final ObjectMapper objectMapper;

    protected JsonFileStore(Path directory, Class<T> type, ObjectMapper objectMapper) {
        this.directory = directory;
        this.type = type;
        this.objectMapper = objectMapper;
    }

    protected Path directory() {
        return directory;
    }

    protected Path resolve(String fileName) {
        return directory.resolve(fileName);
    }

    protected void write(String fileName, T value) {
        Path target = resolve(fileName);
        try {
            Files.createDirectories(directory);
            Path tmp = target.resolveSibling(fileName + ".tmp");
            Files.write(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value));
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Could not write " + target + ": " + e.getMessage(), e);
        }
    }

    protected Optional<T> read(String fileName) {
        Path file = resolve(fileName);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new StorageException("Could not read " + file + ": " + e.getMessage(), e);
        }
    }

    protected boolean delete(String fileName) {
        Path file = resolve(fileName);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StorageException("Could not delete " + file + ": " + e.getMessage(), e);
        }
    }

    /** File names of the ".json" documents accepted by {@code filter}, unsorted. */
    protected List<String> listFileNames(Predicate<String> filter) {
        if (!Files.isDirectory(directory)) return List.of();
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(".json"))
                    .filter(filter)
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Could not list " + directory + ": " + e.getMessage(), e);
        }
    }

    /** Reads every listed document, skipping the unreadable ones with a warning. */
    protected List<T> readAll(List<String> fileNames) {
        List<T> values = new ArrayList<>();
        for (String name : fileNames) {
            try {
                read(name).ifPresent(values::add);
            } catch (StorageException e) {
                log.warn("Skipping unreadable file {}: {}", name, e.getMessage());
            }
        }
        return values;
    }
}
