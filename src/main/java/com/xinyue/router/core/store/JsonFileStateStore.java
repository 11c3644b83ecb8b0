package com.xinyue.router.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 以单个 JSON 文件保存状态。写入先落到同目录的临时文件，再整体替换，崩溃时不会留下半个文件。
 */
public final class JsonFileStateStore implements StateStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileStateStore(Path path) {
        this.path = path;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public StateSnapshot load() {
        if (!Files.exists(path)) {
            LOG.info("状态文件不存在，使用空状态: {}", path);
            return StateSnapshot.empty();
        }
        try {
            StateSnapshot snapshot = objectMapper.readValue(path.toFile(), StateSnapshot.class);
            LOG.info("已加载状态文件 {}（{} 个用户）", path, snapshot.users() == null ? 0 : snapshot.users().size());
            return snapshot;
        } catch (IOException e) {
            throw new StateStoreException("failed to read state from " + path, e);
        }
    }

    @Override
    public synchronized void save(StateSnapshot snapshot) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateStoreException("failed to write state to " + path, e);
        }
    }

    public Path path() {
        return path;
    }
}
