package com.agentstudio.observability.event;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append and tail helpers for newline-delimited JSON files.
 */
public final class NdjsonFiles {

    private NdjsonFiles() {
    }

    /**
     * Appends one line in a single write. A missing parent directory is created once.
     *
     * @throws IOException if the append fails
     */
    public static void appendLine(Path path, byte[] json) throws IOException {
        byte[] line = new byte[json.length + 1];
        System.arraycopy(json, 0, line, 0, json.length);
        line[json.length] = '\n';
        try {
            Files.write(path, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (NoSuchFileException e) {
            Files.createDirectories(path.getParent());
            Files.write(path, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }
    }

    /**
     * Returns the last non-blank lines of a file, reading at most {@code maxBytes} from its end.
     * A missing file yields an empty list.
     *
     * @throws IOException if the file exists but cannot be read
     */
    public static List<String> tail(Path path, int maxLines, int maxBytes) throws IOException {
        if (path == null || !Files.exists(path) || maxLines <= 0) {
            return new ArrayList<>();
        }
        String text;
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            long length = file.length();
            long start = Math.max(0L, length - Math.max(1, maxBytes));
            byte[] buf = new byte[(int) (length - start)];
            file.seek(start);
            file.readFully(buf);
            text = new String(buf, StandardCharsets.UTF_8);
            if (start > 0) {
                // drop the partial first line
                int newline = text.indexOf('\n');
                text = newline < 0 ? "" : text.substring(newline + 1);
            }
        }
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            if (!line.isBlank()) {
                lines.add(line.trim());
            }
        }
        return lines.size() <= maxLines ? lines : new ArrayList<>(lines.subList(lines.size() - maxLines, lines.size()));
    }
}
