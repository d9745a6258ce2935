package io.resumable.http;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class LineFileSourceTest {
    @Test
    void skips_blank_lines_and_rereads_on_size() throws Exception {
        Path file = Files.createTempFile("lines", ".txt");
        Files.writeString(file, "a\n\n  \nb\n");
        LineFileSource source = new LineFileSource(file);
        assertEquals(2, source.size());
        assertEquals("b", source.get(1));

        Files.writeString(file, "a\nb\nc\n");
        assertEquals(3, source.size());
        assertEquals("c", source.get(2));
        assertThrows(IndexOutOfBoundsException.class, () -> source.get(3));
    }
}
