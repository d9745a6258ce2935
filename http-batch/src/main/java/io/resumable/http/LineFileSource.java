package io.resumable.http;

import io.resumable.core.WorkSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Non-blank lines of a text file, re-read whenever {@link #size()} is called so every run sees the file as
 * it is now.
 */
public class LineFileSource implements WorkSource<String> {
    private final Path file;
    private volatile List<String> lines = List.of();

    public LineFileSource(Path file) {
        this.file = file;
    }

    @Override
    public long size() throws IOException {
        lines = Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                .filter(l -> !l.isBlank())
                .collect(Collectors.toUnmodifiableList());
        return lines.size();
    }

    @Override
    public String get(long offset) {
        List<String> current = lines;
        if (offset < 0 || offset >= current.size()) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside " + file + " (" + current.size() + " lines)");
        }
        return current.get((int) offset);
    }
}
