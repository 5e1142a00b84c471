package com.containerwatch.tracker.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class JsonFileRecordStore<T> implements RecordStore<T> {
    private static final Logger log = LoggerFactory.getLogger(JsonFileRecordStore.class);

    private final Path file;
    private final Class<T> type;
    private final ObjectMapper objectMapper;
    private final Object fileLock = new Object();

    public JsonFileRecordStore(Path file, Class<T> type, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath();
        this.type = type;
        this.objectMapper = objectMapper;
    }

    public Path file() {
        return file;
    }

    @Override
    public List<T> load() {
        synchronized (fileLock) {
            if (!Files.exists(file)) {
                return List.of();
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(file.toFile());
            } catch (IOException e) {
                quarantine(e);
                return List.of();
            }
            if (root == null || root.isMissingNode() || root.isNull()) {
                return List.of();
            }
            if (!root.isArray()) {
                quarantine(new IOException("expected a JSON array but found " + root.getNodeType()));
                return List.of();
            }
            List<T> records = new ArrayList<>(root.size());
            int index = 0;
            for (JsonNode node : root) {
                try {
                    records.add(objectMapper.treeToValue(node, type));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    log.warn(
                        "Skipping corrupt {} record #{} in {}: {}",
                        type.getSimpleName(),
                        index,
                        file.getFileName(),
                        e.getMessage()
                    );
                }
                index++;
            }
            return records;
        }
    }

    @Override
    public void save(Collection<T> records) {
        List<T> snapshot = records == null ? List.of() : List.copyOf(records);
        synchronized (fileLock) {
            Path directory = file.getParent();
            Path temp = null;
            try {
                Files.createDirectories(directory);
                temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
                try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                    OutputStream out = Channels.newOutputStream(channel);
                    objectMapper.writeValue(new NonClosingOutputStream(out), snapshot);
                    channel.force(true);
                }
                moveIntoPlace(temp);
                temp = null;
            } catch (IOException e) {
                throw new StoreWriteException("Failed to write " + file, e);
            } finally {
                if (temp != null) {
                    deleteQuietly(temp);
                }
            }
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void quarantine(IOException cause) {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        log.error("Store {} is unreadable ({}), moving it to {} and starting empty", file, cause.getMessage(), aside.getFileName());
        try {
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Failed to move unreadable store {} aside", file, e);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}", temp, e);
        }
    }

    private static final class NonClosingOutputStream extends OutputStream {
        private final OutputStream delegate;

        private NonClosingOutputStream(OutputStream delegate) {
            this.delegate = delegate;
        }

        @Override
        public void write(int b) throws IOException {
            delegate.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            delegate.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            delegate.flush();
        }

        @Override
        public void close() throws IOException {
            delegate.flush();
        }
    }
}
