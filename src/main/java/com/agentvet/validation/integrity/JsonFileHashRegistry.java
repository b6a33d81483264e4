package com.agentvet.validation.integrity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry persisted as a single pretty-printed JSON object
 * ({@code {"agents/foo.md": {"hash": ..., "version": ..., "timestamp": ...}}}).
 * Upserts are read-modify-write under one lock and replace the file through
 * a temp file, so readers never observe a partial write.
 */
public class JsonFileHashRegistry implements HashRegistry {

    private static final Logger log = LoggerFactory.getLogger(JsonFileHashRegistry.class);
    private static final TypeReference<LinkedHashMap<String, HashRegistryEntry>> REGISTRY_TYPE =
            new TypeReference<>() {};

    private final Path root;
    private final Path file;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JsonFileHashRegistry(Path root, Path file, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.file = file.isAbsolute() ? file.normalize() : this.root.resolve(file).normalize();
        this.objectMapper = objectMapper;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public String keyFor(String componentPath) {
        if (componentPath == null || componentPath.isBlank()) return "";
        Path path;
        try {
            path = Path.of(componentPath).normalize();
        } catch (InvalidPathException e) {
            return componentPath.replace('\\', '/');
        }
        if (path.isAbsolute() && path.startsWith(root)) {
            path = root.relativize(path);
        }
        return path.toString().replace('\\', '/');
    }

    @Override
    public Optional<HashRegistryEntry> find(String key) {
        return Optional.ofNullable(load().get(key));
    }

    @Override
    public void upsert(String key, HashRegistryEntry entry) {
        writeLock.lock();
        try {
            Map<String, HashRegistryEntry> registry = load();
            registry.put(key, entry);
            save(new TreeMap<>(registry));
            log.debug("Registry entry updated key={} hash={}", key, entry.hash());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int size() {
        return load().size();
    }

    private Map<String, HashRegistryEntry> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, HashRegistryEntry> registry = objectMapper.readValue(file.toFile(), REGISTRY_TYPE);
            return registry != null ? registry : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new HashRegistryException("Failed to read hash registry " + file, e);
        }
    }

    private void save(Map<String, HashRegistryEntry> registry) {
        try {
            Files.createDirectories(file.getParent());
            Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), registry);
                try {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new HashRegistryException("Failed to write hash registry " + file, e);
        }
    }
}
