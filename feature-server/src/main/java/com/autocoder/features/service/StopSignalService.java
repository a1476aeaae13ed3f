package com.autocoder.features.service;

import com.autocoder.features.config.AutocoderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Graceful-stop marker for the coding agent.
 *
 * Requesting a stop drops a marker file into the project directory. The
 * agent checks for it between features and exits after finishing the one it
 * is on. The queue itself never reads the marker.
 */
@Service
public class StopSignalService {

    private static final Logger log = LoggerFactory.getLogger(StopSignalService.class);

    private final Path stopFile;

    public StopSignalService(AutocoderProperties properties) {
        this.stopFile = properties.projectPath().resolve(properties.getStopFileName());
    }

    public void requestStop() {
        try {
            Files.createDirectories(stopFile.getParent());
            Files.writeString(stopFile, Instant.now().toString());
            log.info("Stop requested: wrote {}", stopFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write stop marker " + stopFile, e);
        }
    }

    public boolean isStopRequested() {
        return Files.exists(stopFile);
    }

    /** @return true if a pending stop request was removed */
    public boolean clearStop() {
        try {
            boolean removed = Files.deleteIfExists(stopFile);
            if (removed) log.info("Stop request cleared: removed {}", stopFile);
            return removed;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not remove stop marker " + stopFile, e);
        }
    }

    public Path stopFile() {
        return stopFile;
    }
}
