package com.wpanther.kmscert.output;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

import org.springframework.stereotype.Component;

import com.wpanther.kmscert.exception.SinkWriteException;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes certificates to standard output or a local file. Existing files are overwritten.
 */
@Component
@Slf4j
public class LocalSinkWriter {

    private final PrintStream out;

    public LocalSinkWriter() {
        this(System.out);
    }

    public LocalSinkWriter(PrintStream out) {
        this.out = out;
    }

    public void writeStdout(String payload) {
        out.print(payload);
        if (!payload.endsWith("\n")) {
            out.println();
        }
        out.flush();
        if (out.checkError()) {
            throw new SinkWriteException("Failed to write certificate to standard output");
        }
    }

    /**
     * Writes through a temporary sibling file that is moved into place, so
     * readers never see a partially written certificate
     */
    public void writeFile(String path, String payload) {
        Path target = Paths.get(path).toAbsolutePath();
        Path temp = null;
        try {
            Path directory = target.getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
            Files.writeString(temp, payload, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Wrote certificate to {}", target);
        } catch (IOException e) {
            deleteQuietly(temp);
            log.error("Failed to write certificate file", e);
            throw new SinkWriteException("Failed to write certificate to " + target + ": " + e.getMessage(), e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
