package com.agentexec.engine.persistence;

import com.agentexec.core.exception.DuplicateCheckpointException;
import com.agentexec.core.exception.StorageException;
import com.agentexec.core.repository.DocumentStore;
import com.agentexec.core.repository.DocumentSummary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * DocumentStore keeping one JSON file per key under a root directory.
 *
 * <p>A key {@code checkpoints/s1/cp-1} maps to {@code <root>/checkpoints/s1/cp-1.json}.
 * Both writes go through a temp file so a reader never sees a partial document. {@link #put}
 * moves the temp file over the target; {@link #create} links it into place, so concurrent
 * creators of one key cannot both succeed.</p>
 */
public class FileSystemDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentStore.class);

    private static final String SUFFIX = ".json";

    private final Path root;
    private final ObjectMapper objectMapper;

    public FileSystemDocumentStore(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageException("Cannot create store directory " + this.root, e);
        }
        log.info("File system document store at {}", this.root);
    }

    @Override
    public Optional<JsonNode> get(String key) {
        Path file = resolve(key);
        try {
            return Optional.of(objectMapper.readTree(Files.readAllBytes(file)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read document " + key, e);
        }
    }

    @Override
    public void put(String key, JsonNode document) {
        Path file = resolve(key);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), ".doc", ".tmp");
            Files.write(tmp, objectMapper.writeValueAsBytes(document));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to write document " + key, e);
        }
    }

    @Override
    public void create(String key, JsonNode document) {
        Path file = resolve(key);
        Path tmp = null;
        try {
            Files.createDirectories(file.getParent());
            tmp = Files.createTempFile(file.getParent(), ".doc", ".tmp");
            Files.write(tmp, objectMapper.writeValueAsBytes(document));
            publish(tmp, file);
        } catch (FileAlreadyExistsException e) {
            throw new DuplicateCheckpointException(key);
        } catch (IOException e) {
            throw new StorageException("Failed to create document " + key, e);
        } finally {
            deleteTemp(tmp);
        }
    }

    /**
     * Make a fully written temp file visible under its final name, failing if the name is taken.
     * A hard link is atomic and never replaces; file systems without links fall back to a
     * non-replacing move.
     */
    private static void publish(Path tmp, Path file) throws IOException {
        try {
            Files.createLink(file, tmp);
        } catch (UnsupportedOperationException e) {
            log.debug("Hard links unsupported under {}, moving instead", file.getParent());
            Files.move(tmp, file);
        }
    }

    private static void deleteTemp(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }

    @Override
    public List<DocumentSummary> list(String prefix) {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<DocumentSummary> summaries = new ArrayList<>();
        try (Stream<Path> files = Files.walk(root)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String name = file.getFileName().toString();
                if (!Files.isRegularFile(file) || !name.endsWith(SUFFIX)) {
                    continue;
                }
                String key = keyOf(file);
                if (key.startsWith(prefix)) {
                    BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                    summaries.add(new DocumentSummary(key, attrs.size(), attrs.creationTime().toInstant()));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list documents under " + prefix, e);
        }
        summaries.sort(Comparator.comparing(DocumentSummary::createdAt).thenComparing(DocumentSummary::key));
        return summaries;
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new StorageException("Failed to delete document " + key, e);
        }
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(root) && Files.isWritable(root);
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Document key is required");
        }
        Path file = root.resolve(key + SUFFIX).normalize();
        if (!file.startsWith(root)) {
            throw new IllegalArgumentException("Document key escapes the store root: " + key);
        }
        return file;
    }

    private String keyOf(Path file) {
        String relative = root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
        return relative.substring(0, relative.length() - SUFFIX.length());
    }
}
