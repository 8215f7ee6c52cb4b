package com.speckle.service;

import com.speckle.error.ExternalProcessException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Spawns the KISIP job and streams its merged stdout/stderr into the log while it runs.
public class ExternalToolService implements ReconstructionRunner {

    private static final Logger log = LoggerFactory.getLogger(ExternalToolService.class);
    private static final Logger toolLog = LoggerFactory.getLogger("kisip");

    private final ProcessOutputPump pump;
    private final Consumer<String> lineSink;

    public ExternalToolService() {
        this(new ProcessOutputPump(), toolLog::info);
    }

    public ExternalToolService(ProcessOutputPump pump, Consumer<String> lineSink) {
        this.pump = pump;
        this.lineSink = lineSink;
    }

    @Override
    public int run(List<String> command, Map<String, String> environment, Path workingDir) throws ExternalProcessException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDir.toFile());
        pb.redirectErrorStream(true);
        pb.environment().putAll(environment);

        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            throw new ExternalProcessException("KISIP run failed: " + e.getMessage(), e);
        }

        try {
            long lines = pump.drain(p.getInputStream(), lineSink);
            log.debug("Process output closed after {} lines", lines);
        } catch (IOException e) {
            // Losing the output does not lose the job; keep waiting for the exit code.
            log.warn("Could not read process output: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroy();
            throw new ExternalProcessException("Interrupted while running " + command.get(0), e);
        }

        try {
            return p.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroy();
            throw new ExternalProcessException("Interrupted while waiting for " + command.get(0), e);
        }
    }
}
