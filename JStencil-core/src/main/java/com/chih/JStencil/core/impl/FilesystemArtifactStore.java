package com.chih.JStencil.core.impl;

import com.chih.JStencil.core.exception.JStencilException;
import com.chih.JStencil.core.spi.ArtifactStore;
import com.chih.JStencil.core.support.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 基于文件系统的编译产物存储
 * <p>
 * 目录结构：{@code <directory>/<hash 前两位>/<hash>.json}，hash 为 identity 的 SHA-256。
 * 写入先落临时文件再原子重命名，多个进程并发写同一个 Key 时读者只会看到完整的文件。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class FilesystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FilesystemArtifactStore.class);

    private static final String EXTENSION = ".json";

    private final Path directory;

    public FilesystemArtifactStore(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("Cache directory cannot be null");
        }
        this.directory = directory.toAbsolutePath().normalize();
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public String generateKey(String name, String identity) {
        String hash = Digests.sha256Hex(identity);
        return directory.resolve(hash.substring(0, 2)).resolve(hash + EXTENSION).toString();
    }

    @Override
    public void write(String key, String content) {
        Path target = Path.of(key);
        Path dir = target.getParent();
        try {
            if (!Files.isDirectory(dir)) {
                Files.createDirectories(dir);
                log.info("Created cache directory: {}", dir);
            }

            Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try {
                Files.writeString(tmp, content, StandardCharsets.UTF_8);
                moveIntoPlace(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new JStencilException(String.format("Failed to write cache file \"%s\".", key), e);
        }
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public Optional<String> load(String key) {
        Path file = Path.of(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new JStencilException(String.format("Failed to read cache file \"%s\".", key), e);
        }
    }

    @Override
    public long getTimestamp(String key) {
        Path file = Path.of(key);
        try {
            return Files.isRegularFile(file) ? Files.getLastModifiedTime(file).toMillis() : 0L;
        } catch (IOException e) {
            log.debug("Unable to read timestamp of cache file {}", key, e);
            return 0L;
        }
    }
}
