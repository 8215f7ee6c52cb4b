package com.speckle.service;

import com.speckle.model.BurstPlan;
import com.speckle.model.FrameSet;
import com.speckle.model.ImageGeometry;
import com.speckle.model.ReferenceFrames;
import com.speckle.model.RunConfig;
import com.speckle.model.SubFrame;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Frames left over after the last full cube are dropped.
public class BurstBatcher {

    private static final Logger log = LoggerFactory.getLogger(BurstBatcher.class);

    private final RunConfig config;
    private final FrameSource source;
    private final ImageGeometry geometry;

    public BurstBatcher(RunConfig config, FrameSource source, ImageGeometry geometry) {
        this.config = config;
        this.source = source;
        this.geometry = geometry;
    }

    public BurstPlan writeBursts(FrameSet data, ReferenceFrames refs) throws IOException {
        int burstNumber = config.burstNumber;
        int planeSize = geometry.imageShape().pixelCount();
        float[] dark = refs.darkPixels();
        float[] gain = refs.gainPixels();

        Files.createDirectories(config.preSpeckleBase());
        log.info("Preparing burst files, saving in directory: {}", config.preSpeckleBase());
        log.info("Number of files to be read: {}", data.size());
        log.info("Flat-fielding and saving data to burst files with burst number: {}: shape: ({}, {}, {})",
                burstNumber, burstNumber, geometry.imageShape().rows(), geometry.imageShape().cols());

        // The only cube buffer of the run; reset after every burst.
        float[] cube = new float[burstNumber * planeSize];
        List<Integer> batchIds = new ArrayList<>();
        int slot = 0;
        int burst = 0;
        int lastBatch = -1;
        int expectedBursts = -1;

        for (Path file : data.files()) {
            List<SubFrame> frames = source.readSubFrames(file, geometry);
            if (expectedBursts < 0) expectedBursts = Math.max(1, data.size() * frames.size() / burstNumber);
            for (SubFrame frame : frames) {
                flatField(frame.data(), dark, gain, cube, slot * planeSize);
                slot++;
                if (slot < burstNumber) continue;

                int batch = BurstNaming.batchOf(burst);
                int index = BurstNaming.indexInBatch(burst);
                Path burstFile = BurstNaming.burstFile(config, batch, index);
                writeSidecar(BurstNaming.sidecarFile(config, batch, index), source.sidecarLines(config, burst, frame));
                RawImageIO.writeFloat32(burstFile, cube);
                log.info("Progress: {} with file: {}",
                        String.format(Locale.ROOT, "%.2f%%", 100.0 * (burst + 1) / expectedBursts), burstFile.getFileName());

                if (batch != lastBatch) {
                    lastBatch = batch;
                    batchIds.add(batch);
                }
                burst++;
                slot = 0;
                Arrays.fill(cube, 0f);
            }
        }

        if (slot > 0) {
            log.warn("Dropping {} trailing frames that do not fill a {}-frame burst.", slot, burstNumber);
        }
        log.info("Burst files complete: {} bursts in batches {} ({})", burst, batchIds, config.preSpeckleBase());
        return new BurstPlan(batchIds, burst, slot);
    }

    // Batches of bursts left by an earlier run, ascending; used when this run skips writing bursts.
    public List<Integer> findExistingBatches() throws IOException {
        TreeSet<Integer> batches = new TreeSet<>();
        if (Files.isDirectory(config.preSpeckleBase())) {
            try (DirectoryStream<Path> ds = Files.newDirectoryStream(config.preSpeckleBase(), BurstNaming.allBurstsGlob(config))) {
                for (Path p : ds) {
                    int[] id = BurstNaming.parseBurstName(p.getFileName().toString());
                    if (id != null) batches.add(id[0]);
                }
            }
        }
        log.info("Existing burst files cover batches: {}", batches);
        return new ArrayList<>(batches);
    }

    // corrected = gain * (frame - avgDark)
    static void flatField(float[] frame, float[] dark, float[] gain, float[] cube, int offset) {
        for (int i = 0; i < frame.length; i++) cube[offset + i] = gain[i] * (frame[i] - dark[i]);
    }

    private static void writeSidecar(Path file, List<String> lines) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (String l : lines) sb.append(l).append('\n');
        Files.write(file, sb.toString().getBytes(StandardCharsets.UTF_8));
    }
}
