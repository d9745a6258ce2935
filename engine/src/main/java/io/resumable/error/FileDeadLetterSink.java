package io.resumable.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.resumable.checkpoint.CheckpointCodec;
import io.resumable.checkpoint.CheckpointStoreException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends one JSON object per line.
 */
public class FileDeadLetterSink implements DeadLetterSink {
    private final Path file;
    private final ObjectMapper mapper = CheckpointCodec.defaultMapper();

    public FileDeadLetterSink(Path file) throws IOException {
        this.file = file;
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void acceptFailure(DeadLetter letter) {
        try {
            String json = mapper.writeValueAsString(letter) + System.lineSeparator();
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new CheckpointStoreException("cannot append dead letter for job " + letter.jobId() + " to " + file, e);
        }
    }

    public synchronized List<DeadLetter> readAll() throws IOException {
        List<DeadLetter> out = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) continue;
            out.add(mapper.readValue(line, DeadLetter.class));
        }
        return out;
    }

    public Path file() {
        return file;
    }
}
