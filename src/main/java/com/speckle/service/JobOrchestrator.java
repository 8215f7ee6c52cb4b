package com.speckle.service;

import com.speckle.error.ExternalProcessException;
import com.speckle.model.BatchResult;
import com.speckle.model.ImageGeometry;
import com.speckle.model.JobDescriptor;
import com.speckle.model.KisipEnv;
import com.speckle.model.RunConfig;
import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    public enum BatchState { IDLE, INDICES_RESOLVED, DESCRIPTORS_WRITTEN, PROCESS_RUNNING, COMPLETED, FAILED }

    private final RunConfig config;
    private final JobDescriptorWriter descriptors;
    private final ReconstructionRunner runner;
    private final Map<String, String> inheritedEnv;

    private BatchState state = BatchState.IDLE;

    public JobOrchestrator(RunConfig config, ImageGeometry geometry, ReconstructionRunner runner) {
        this(config, new JobDescriptorWriter(config, geometry), runner, System.getenv());
    }

    public JobOrchestrator(RunConfig config, JobDescriptorWriter descriptors, ReconstructionRunner runner,
                           Map<String, String> inheritedEnv) {
        this.config = config;
        this.descriptors = descriptors;
        this.runner = runner;
        this.inheritedEnv = inheritedEnv;
    }

    public BatchState state() { return state; }

    public void configure() throws IOException {
        log.info("Now configuring this KISIP run.");
        for (Path dir : List.of(config.preSpeckleBase(), config.speckleBase())) {
            if (!Files.isDirectory(dir)) {
                log.info("Attempting to create directory: {}", dir);
                Files.createDirectories(dir);
            }
        }
    }

    public List<BatchResult> despeckleAll(List<Integer> batchIds) throws IOException, ExternalProcessException {
        configure();
        log.info("Preparing to run KISIP on batches: {}", batchIds);
        List<BatchResult> results = new ArrayList<>();
        for (int batch : batchIds) results.add(runBatch(batch));
        return results;
    }

    public BatchResult runBatch(int batch) throws IOException, ExternalProcessException {
        transition(batch, BatchState.IDLE);

        // --- INDICES ---
        int[] bounds = resolveIndices(batch);
        transition(batch, BatchState.INDICES_RESOLVED);

        // --- DESCRIPTORS ---
        JobDescriptor descriptor = descriptors.write(batch, bounds[0], bounds[1]);
        transition(batch, BatchState.DESCRIPTORS_WRITTEN);

        // --- PROCESS ---
        Map<String, String> env = environment(config.env, inheritedEnv);
        List<String> command = command(config.env);
        log.info("KISIP command: {}", String.join(" ", command));
        log.info("KISIP log will be in directory: {}", config.speckleBase());
        log.info("Now running KISIP for batch: {} on: {} processes.", descriptor.batchId(), config.env.mpiProcesses());
        transition(batch, BatchState.PROCESS_RUNNING);

        int code;
        try {
            code = runner.run(command, env, config.workBase);
        } catch (ExternalProcessException e) {
            transition(batch, BatchState.FAILED);
            log.error("CRITICAL: KISIP run failed: {}", e.getMessage());
            throw e;
        }

        BatchResult result = new BatchResult(batch, code);
        if (result.failed()) {
            transition(batch, BatchState.FAILED);
            log.error("Something went wrong with KISIP run. Check logfile. Batch: {} Code: {}", batch, code);
        } else {
            transition(batch, BatchState.COMPLETED);
            log.info("KISIP batch: {} exited with code: {}", batch, code);
        }
        return result;
    }

    // {0, count - 1}; gaps in the burst numbering go unnoticed.
    public int[] resolveIndices(int batch) throws IOException {
        log.info("Setting batch number: {}", batch);
        String glob = BurstNaming.burstGlob(config, batch);
        log.info("Searching for files: {}", config.preSpeckleBase().resolve(glob));
        int n = 0;
        if (Files.isDirectory(config.preSpeckleBase())) {
            try (DirectoryStream<Path> ds = Files.newDirectoryStream(config.preSpeckleBase(), glob)) {
                for (Path p : ds) if (!p.getFileName().toString().endsWith(".txt")) n++;
            }
        }
        if (n == 0) {
            log.error("ERROR: batch {} has {} files.", batch, n);
            log.warn("WARNING: KISIP might run, but will ultimately do nothing.");
        } else {
            log.info("Batch {} has {} files.", batch, n);
        }
        log.info("Batch {}: setting start index: {} end index: {}.", batch, 0, n - 1);
        return new int[] { 0, n - 1 };
    }

    public static List<String> command(KisipEnv env) {
        return List.of(
                env.mpirunPath().toString(),
                "-np",
                Integer.toString(env.mpiProcesses()),
                env.executablePath().toString());
    }

    // Prepends the KISIP directories to the inherited search paths; nothing accumulates between batches.
    public static Map<String, String> environment(KisipEnv env, Map<String, String> inherited) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("PATH", prepend(env.binDir().toString(), inherited.get("PATH")));
        out.put("LD_LIBRARY_PATH", prepend(env.libDir().toString(), inherited.get("LD_LIBRARY_PATH")));
        log.info("Pre-appending to PATH: {}", env.binDir());
        log.info("Pre-appending to LD_LIBRARY_PATH: {}", env.libDir());
        return out;
    }

    private static String prepend(String dir, String current) {
        if (current == null || current.isEmpty()) return dir;
        return dir + File.pathSeparator + current;
    }

    private void transition(int batch, BatchState next) {
        log.debug("Batch {}: {} -> {}", batch, state, next);
        state = next;
    }
}
