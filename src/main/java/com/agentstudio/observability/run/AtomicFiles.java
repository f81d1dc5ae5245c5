package com.agentstudio.observability.run;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Atomic replace of whole files: write to a uniquely named temp file in the target
 * directory, then rename over the destination. Readers never observe a partial document.
 */
public final class AtomicFiles {

    private AtomicFiles() {
    }

    /**
     * Atomically replaces {@code target} with {@code content}. A missing parent directory is
     * created once and the write retried. On rename failure the temp file is removed and the
     * error propagates.
     *
     * @param target  destination file
     * @param content bytes to write
     * @throws IOException if the temp write or the rename fails
     */
    public static void write(Path target, byte[] content) throws IOException {
        Path tmp;
        try {
            tmp = writeTemp(target, content);
        } catch (NoSuchFileException e) {
            Files.createDirectories(target.getParent());
            tmp = writeTemp(target, content);
        }
        try {
            move(tmp, target);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    private static Path writeTemp(Path target, byte[] content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + "."
                + ProcessHandle.current().pid() + "."
                + Long.toHexString(System.nanoTime()) + "."
                + Integer.toHexString(ThreadLocalRandom.current().nextInt()) + ".tmp");
        Files.write(tmp, content);
        return tmp;
    }

    private static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
