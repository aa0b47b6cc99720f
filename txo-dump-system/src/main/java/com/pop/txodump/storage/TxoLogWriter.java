package com.pop.txodump.storage;

import com.pop.txodump.data.SpendRecord;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Append-only spend log.
 * <p>
 * Lines go to {@code txo.csv.tmp} in the dump folder. {@link #commit()} renames it to {@code txo.csv}; until then
 * the final file does not exist, so its presence marks a completed run.
 * <p>
 * On file systems without atomic rename the commit falls back to a replacing move, which a crash can interrupt
 * halfway.
 */
@Slf4j
public class TxoLogWriter implements Closeable {

    public static final String FILE_NAME = "txo.csv";
    public static final String TMP_FILE_NAME = FILE_NAME + ".tmp";

    private static final int BUFFER_SIZE = 1 << 16;

    @Getter
    private final Path tmpFile;
    @Getter
    private final Path finalFile;
    private final BufferedWriter writer;

    @Getter
    private long lineCount;
    private boolean closed;
    @Getter
    private boolean committed;

    private TxoLogWriter(Path folder, BufferedWriter writer) {
        this.tmpFile = folder.resolve(TMP_FILE_NAME);
        this.finalFile = folder.resolve(FILE_NAME);
        this.writer = writer;
    }

    /**
     * Creates (or truncates) the working file inside {@code folder}. A final file left by an earlier run is
     * removed first.
     */
    public static TxoLogWriter open(Path folder) throws IOException {
        if (!Files.exists(folder)) {
            throw new NoSuchFileException(folder.toString(), null, "dump folder does not exist");
        }
        if (!Files.isDirectory(folder)) {
            throw new NotDirectoryException(folder.toString());
        }
        if (!Files.isWritable(folder)) {
            throw new AccessDeniedException(folder.toString(), null, "dump folder is not writable");
        }
        Path finalFile = folder.resolve(FILE_NAME);
        if (Files.deleteIfExists(finalFile)) {
            log.info("Removed {} left by a previous run", finalFile);
        }
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(
                Files.newOutputStream(folder.resolve(TMP_FILE_NAME),
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE),
                StandardCharsets.UTF_8), BUFFER_SIZE);
        return new TxoLogWriter(folder, writer);
    }

    public void append(SpendRecord record) throws IOException {
        if (closed) {
            throw new IOException("Spend log " + tmpFile + " is closed");
        }
        writer.write(record.toCsvLine());
        writer.write('\n');
        lineCount++;
    }

    /**
     * Flushes, closes and renames the working file to its final name.
     */
    public void commit() throws IOException {
        if (committed) {
            throw new IOException("Spend log " + finalFile + " already committed");
        }
        if (closed) {
            throw new IOException("Spend log " + tmpFile + " was closed before commit");
        }
        closed = true;
        writer.close();
        try {
            Files.move(tmpFile, finalFile, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}, falling back to replace", tmpFile);
            Files.move(tmpFile, finalFile, StandardCopyOption.REPLACE_EXISTING);
        }
        committed = true;
        log.debug("Renamed {} to {} ({} lines)", tmpFile, finalFile, lineCount);
    }

    /**
     * Closes the working file without renaming it. No-op after {@link #commit()}.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        writer.close();
    }
}
