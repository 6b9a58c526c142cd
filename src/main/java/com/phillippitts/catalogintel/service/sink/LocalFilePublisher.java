package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.exception.SinkException;
import com.phillippitts.catalogintel.util.Digests;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Publishes each message as one line of {@code <baseDir>/<topic>.jsonl}.
 * The message id is the SHA-1 of the written line.
 */
public class LocalFilePublisher implements PredictionPublisher {

    private final Path baseDir;
    private final Lock writeLock = new ReentrantLock();

    public LocalFilePublisher(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public String publish(String topic, JSONObject message) {
        String payload = message.toString();
        Path topicFile = baseDir.resolve(topic + ".jsonl");
        writeLock.lock();
        try {
            Files.createDirectories(baseDir);
            Files.writeString(topicFile, payload + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new SinkException("Failed to append to " + topicFile, e);
        } finally {
            writeLock.unlock();
        }
        return Digests.sha1Hex(payload);
    }

    public Path baseDir() {
        return baseDir;
    }
}
