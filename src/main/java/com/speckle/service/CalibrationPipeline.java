package com.speckle.service;

import com.speckle.error.CalibrationException;
import com.speckle.error.DiscoveryException;
import com.speckle.error.GeometryDetectionException;
import com.speckle.model.BatchResult;
import com.speckle.model.BurstPlan;
import com.speckle.model.FrameRole;
import com.speckle.model.FrameSet;
import com.speckle.model.ImageGeometry;
import com.speckle.model.PipelineReport;
import com.speckle.model.ReferenceFrames;
import com.speckle.model.RunConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CalibrationPipeline {

    private static final Logger log = LoggerFactory.getLogger(CalibrationPipeline.class);

    private final RunConfig config;
    private final FrameSource source;
    private final ReconstructionRunner runner;
    private final FitsImageStore store = new FitsImageStore();

    public CalibrationPipeline(RunConfig config, ReconstructionRunner runner) {
        this(config, FrameSource.forFamily(config.family), runner);
    }

    public CalibrationPipeline(RunConfig config, FrameSource source, ReconstructionRunner runner) {
        this.config = config;
        this.source = source;
        this.runner = runner;
    }

    public void configure() throws CalibrationException, IOException {
        log.info("Now configuring this {} data calibration run.", config.instrument);
        for (FrameRole role : FrameRole.values()) {
            FrameSetManager.requireDirectory(config.baseDir(role), role);
        }
        for (Path dir : List.of(config.workBase, config.preSpeckleBase(), config.speckleBase(), config.postSpeckleBase())) {
            if (!Files.isDirectory(dir)) {
                log.info("Attempting to create directory: {}", dir);
                Files.createDirectories(dir);
            }
        }
    }

    public PipelineReport run() throws CalibrationException, IOException {
        configure();

        // --- FRAME SETS ---
        Map<FrameRole, FrameSet> sets = new FrameSetManager(source).loadAll(config);
        FrameSet darks = sets.get(FrameRole.DARK);
        FrameSet flats = sets.get(FrameRole.FLAT);
        FrameSet data = sets.get(FrameRole.DATA);

        // --- GEOMETRY ---
        ImageGeometry geometry = source.detectGeometry(flats.first());
        checkShapes(geometry, darks, data);

        // --- REFERENCE FRAMES ---
        ReferenceFrameBuilder refBuilder = new ReferenceFrameBuilder(config, source, geometry, store);
        ReferenceFrames refs = refBuilder.build(darks, flats);
        refBuilder.saveCache(refs);
        refBuilder.writeNoiseCube(flats, refs);

        // --- BURSTS ---
        BurstBatcher batcher = new BurstBatcher(config, source, geometry);
        BurstPlan plan;
        if (config.saveBursts) {
            plan = batcher.writeBursts(data, refs);
        } else {
            log.info("Burst saving is off. Skipping the save bursts step.");
            plan = new BurstPlan(batcher.findExistingBatches(), 0, 0);
        }

        // --- KISIP ---
        JobOrchestrator orchestrator = new JobOrchestrator(config, geometry, runner);
        List<BatchResult> results = orchestrator.despeckleAll(plan.batchIds);

        // --- TRANSCRIPTION ---
        int transcribed = 0;
        try {
            transcribed = new ResultTranscriber(config, geometry, store).transcribeAll();
        } catch (DiscoveryException e) {
            boolean anyFailed = results.stream().anyMatch(BatchResult::failed);
            if (!anyFailed) {
                log.error("CRITICAL: no files found: {}", e.getMessage());
                throw e;
            }
            log.error("No reconstructed images to transcribe after failed batches: {}", e.getMessage());
        }

        PipelineReport report = new PipelineReport(plan, results, refs.zeroDenominators, transcribed);
        if (report.isDegraded()) {
            log.warn("Run finished degraded. Failed batches: {}, zero gain denominators: {}",
                    report.failedBatches(), report.zeroGainDenominators);
        } else {
            log.info("Run finished: {} bursts, {} batches, {} images transcribed.",
                    plan.burstCount, results.size(), transcribed);
        }
        return report;
    }

    // Dark and data files must match the flat layout; geometry itself is only detected on the flat.
    private void checkShapes(ImageGeometry geometry, FrameSet darks, FrameSet data) throws IOException, GeometryDetectionException {
        for (FrameSet set : List.of(darks, data)) {
            try {
                source.checkLayout(set.first(), geometry);
            } catch (GeometryDetectionException e) {
                throw new GeometryDetectionException(set.role().label() + " does not match flat geometry " + geometry
                        + ": " + e.getMessage(), e);
            }
        }
    }
}
