package com.ayni.core.journal;

import com.ayni.core.registry.RegistryTransaction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * File journal with one JSON document per line.
 *
 * <p>Each append is written with {@link StandardOpenOption#DSYNC} before the transaction commits.
 * Blank lines are ignored on read; any other unparsable line is reported with its line number.
 *
 * <p>An unterminated last line is a torn write whose transaction never committed. Reads skip it
 * and the next append truncates it away.
 */
public class JsonLinesRegistryJournal implements RegistryJournal {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesRegistryJournal.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private boolean tailChecked;

    public JsonLinesRegistryJournal(Path path) {
        this(path, defaultObjectMapper());
    }

    public JsonLinesRegistryJournal(Path path, ObjectMapper objectMapper) {
        this.path = Objects.requireNonNull(path, "Journal path cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
    }

    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    @Override
    public synchronized void append(RegistryTransaction transaction) {
        Objects.requireNonNull(transaction, "Transaction cannot be null");
        try {
            String line = objectMapper.writeValueAsString(transaction) + "\n";
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!tailChecked) {
                truncateTornTail();
                tailChecked = true;
            }
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.DSYNC);
        } catch (IOException e) {
            tailChecked = false;
            throw new JournalException("Failed to append " + transaction.operationName() + " to " + path, e);
        }
    }

    @Override
    public synchronized List<RegistryTransaction> readAll() {
        if (!Files.exists(path)) {
            log.info("No journal at {}, starting empty", path);
            return List.of();
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new JournalException("Failed to read journal " + path, e);
        }

        int end = bytes.length;
        while (end > 0 && bytes[end - 1] != '\n') {
            end--;
        }
        List<String> lines = new String(bytes, 0, end, StandardCharsets.UTF_8).lines().toList();
        if (end < bytes.length) {
            log.warn("Ignoring torn entry of {} bytes after line {} of {}", bytes.length - end, lines.size(), path);
        }

        List<RegistryTransaction> transactions = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                transactions.add(objectMapper.readValue(line, RegistryTransaction.class));
            } catch (JsonProcessingException e) {
                throw new JournalException("Corrupt journal entry at line " + (i + 1) + " of " + path, e);
            }
        }
        return transactions;
    }

    /**
     * Cuts the file back to its last newline, dropping a partially written entry.
     */
    private void truncateTornTail() throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            long end = size;
            ByteBuffer lastByte = ByteBuffer.allocate(1);
            while (end > 0) {
                lastByte.clear();
                channel.read(lastByte, end - 1);
                if (lastByte.get(0) == '\n') {
                    break;
                }
                end--;
            }
            if (end < size) {
                log.warn("Truncating {} bytes of torn journal tail from {}", size - end, path);
                channel.truncate(end);
                channel.force(true);
            }
        }
    }

    public Path getPath() {
        return path;
    }
}
