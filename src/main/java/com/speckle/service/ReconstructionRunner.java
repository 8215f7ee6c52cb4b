package com.speckle.service;

import com.speckle.error.ExternalProcessException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

// Runs one blocking reconstruction job and returns its exit code.
public interface ReconstructionRunner {

    /**
     * @param environment variables overriding the inherited environment
     * @throws ExternalProcessException when the process cannot be spawned or awaited
     */
    int run(List<String> command, Map<String, String> environment, Path workingDir) throws ExternalProcessException;
}
