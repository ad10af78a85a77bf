package com.ryuqq.metacache.adapter.disk.store;

import com.ryuqq.metacache.core.exception.PersistenceUnavailableException;
import com.ryuqq.metacache.core.model.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Content-keyed file directory for one cache namespace.
 *
 * <p><strong>Layout:</strong> {@code <root>/<md5(namespace)>/<md5(key)>[.<ext>]}. The digest
 * only makes arbitrary keys safe as file names; the extension after the last {@code .} of
 * the key's last path segment is kept so stored artifacts stay recognizable.</p>
 *
 * <p><strong>Write Atomicity:</strong></p>
 * <ul>
 *   <li>Bytes are written to a temp file in the namespace directory</li>
 *   <li>The temp file is moved over the target with {@link StandardCopyOption#ATOMIC_MOVE}</li>
 *   <li>File systems that refuse atomic moves fall back to a replacing move</li>
 * </ul>
 *
 * <p>All operations are synchronous. Callers own threading.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class KeyedPersistenceDirectory {

    private static final Logger log = LoggerFactory.getLogger(KeyedPersistenceDirectory.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private final String namespace;
    private final Path directory;

    /**
     * Creates the namespace directory under {@code root} if it does not exist yet.
     *
     * @param root parent directory shared by all namespaces
     * @param namespace namespace name (hashed into the directory name)
     * @throws IllegalArgumentException if root or namespace is null/blank
     * @throws PersistenceUnavailableException if the directory cannot be created
     */
    public KeyedPersistenceDirectory(Path root, String namespace) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        this.namespace = namespace;
        this.directory = root.resolve(md5Hex(namespace));
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PersistenceUnavailableException("Cannot create cache directory " + directory, e);
        }
    }

    /**
     * Writes bytes for the key atomically, replacing any previous file.
     *
     * @throws IOException if the write or the move fails
     */
    public void save(CacheKey key, byte[] bytes) throws IOException {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        Path target = pathFor(key);
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), TEMP_SUFFIX);
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, falling back to replacing move", directory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Reads the stored bytes.
     *
     * @return file contents, empty if no file exists for the key
     * @throws IOException if the file exists but cannot be read
     */
    public Optional<byte[]> load(CacheKey key) throws IOException {
        try {
            return Optional.of(Files.readAllBytes(pathFor(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    public boolean exists(CacheKey key) {
        return Files.isRegularFile(pathFor(key));
    }

    /**
     * Deletes the file for the key.
     *
     * @return true if a file was removed
     */
    public boolean delete(CacheKey key) throws IOException {
        return Files.deleteIfExists(pathFor(key));
    }

    /**
     * Removes the whole namespace directory. A missing directory is not an error; it is
     * recreated by the next {@link #save}.
     */
    public void clear() throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
        log.debug("Cleared cache directory {} (namespace={})", directory, namespace);
    }

    /**
     * File path for the key, whether or not the file exists.
     */
    public Path pathFor(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        String value = key.getValue();
        String fileName = md5Hex(value);
        String extension = extensionOf(value);
        return directory.resolve(extension.isEmpty() ? fileName : fileName + "." + extension);
    }

    public Path directory() {
        return directory;
    }

    public String namespace() {
        return namespace;
    }

    static String extensionOf(String key) {
        int slash = Math.max(key.lastIndexOf('/'), key.lastIndexOf('\\'));
        String lastSegment = key.substring(slash + 1);
        int dot = lastSegment.lastIndexOf('.');
        if (dot < 0 || dot == lastSegment.length() - 1) {
            return "";
        }
        return lastSegment.substring(dot + 1);
    }

    static String md5Hex(String value) {
        return HexFormat.of().formatHex(md5().digest(value.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
