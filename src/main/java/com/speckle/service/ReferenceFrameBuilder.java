package com.speckle.service;

import com.speckle.model.FrameSet;
import com.speckle.model.FrameShape;
import com.speckle.model.ImageGeometry;
import com.speckle.model.ReferenceFrames;
import com.speckle.model.RunConfig;
import com.speckle.model.SubFrame;
import ij.process.FloatProcessor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ReferenceFrameBuilder {

    private static final Logger log = LoggerFactory.getLogger(ReferenceFrameBuilder.class);

    private final RunConfig config;
    private final FrameSource source;
    private final ImageGeometry geometry;
    private final FitsImageStore store;

    public ReferenceFrameBuilder(RunConfig config, FrameSource source, ImageGeometry geometry, FitsImageStore store) {
        this.config = config;
        this.source = source;
        this.geometry = geometry;
        this.store = store;
    }

    public ReferenceFrames build(FrameSet darks, FrameSet flats) throws IOException {
        FloatProcessor avgDark = loadOrAverage(config.darkFile(), darks, "dark");
        FloatProcessor avgFlat = loadOrAverage(config.flatFile(), flats, "flat");

        if (Files.exists(config.gainFile())) {
            log.info("Gain file found: {}", config.gainFile());
            log.info("Reading gain file.");
            FloatProcessor gain = checkShape(store.read(config.gainFile()), config.gainFile());
            int bad = 0;
            for (float g : (float[]) gain.getPixels()) if (!Float.isFinite(g)) bad++;
            if (bad > 0) log.warn("Cached gain table holds {} non-finite values: {}", bad, config.gainFile());
            return new ReferenceFrames(avgDark, avgFlat, gain, bad);
        }
        return computeGain(avgDark, avgFlat);
    }

    // --- AVERAGING ---

    // Streamed mean: one file in memory at a time, every sub-frame counts once.
    public FloatProcessor average(FrameSet set) throws IOException {
        List<Path> files = set.files();
        FrameShape shape = geometry.imageShape();
        log.info("Computing average image from {} files in directory: {}", files.size(), set.first().getParent());

        double[] sum = new double[shape.pixelCount()];
        int frames = 0;
        int predicted = -1;
        for (Path file : files) {
            List<SubFrame> subFrames = source.readSubFrames(file, geometry);
            if (predicted < 0) predicted = files.size() * subFrames.size();
            for (SubFrame sf : subFrames) {
                float[] px = sf.data();
                for (int i = 0; i < sum.length; i++) sum[i] += px[i];
                frames++;
                if (frames % 100 == 0) {
                    log.info("Progress: {}", String.format(Locale.ROOT, "%.1f%%", 100.0 * frames / predicted));
                }
            }
        }
        if (frames == 0) throw new IOException("No image planes found in " + set.first().getParent());

        log.info("Images averaged/images predicted: {}/{}", frames, predicted);
        if (frames != predicted) {
            log.warn("Number of images averaged does not match the number predicted; files hold differing frame counts.");
        }

        float[] avg = new float[sum.length];
        for (int i = 0; i < avg.length; i++) avg[i] = (float) (sum[i] / frames);
        log.info("Average complete, directory: {}", set.first().getParent());
        return new FloatProcessor(shape.cols(), shape.rows(), avg);
    }

    private FloatProcessor loadOrAverage(Path cache, FrameSet set, String what) throws IOException {
        if (Files.exists(cache)) {
            log.info("Average {} file found: {}", what, cache);
            log.info("Reading average {}.", what);
            return checkShape(store.read(cache), cache);
        }
        return average(set);
    }

    private FloatProcessor checkShape(FloatProcessor fp, Path file) throws IOException {
        FrameShape s = geometry.imageShape();
        if (fp.getWidth() != s.cols() || fp.getHeight() != s.rows()) {
            throw new IOException("Cached image " + file + " is " + fp.getHeight() + "x" + fp.getWidth()
                    + ", run geometry is " + s);
        }
        return fp;
    }

    // --- GAIN ---

    // gain = median(flat - dark) / (flat - dark), elementwise.
    public static ReferenceFrames computeGain(FloatProcessor avgDark, FloatProcessor avgFlat) {
        log.info("Computing gain table.");
        float[] dark = (float[]) avgDark.getPixels();
        float[] flat = (float[]) avgFlat.getPixels();
        float[] diff = new float[dark.length];
        for (int i = 0; i < diff.length; i++) diff[i] = flat[i] - dark[i];

        float median = median(diff);
        float[] gain = new float[diff.length];
        int zeros = 0;
        for (int i = 0; i < gain.length; i++) {
            if (diff[i] == 0f) zeros++;
            gain[i] = median / diff[i];
        }
        if (zeros > 0) {
            log.error("Error computing gain table: division by zero at {} of {} pixels; gain is not finite there. "
                    + "Inspect the dark and flat frames.", zeros, gain.length);
        }
        log.info("Gain table computed.");
        return new ReferenceFrames(avgDark, avgFlat,
                new FloatProcessor(avgDark.getWidth(), avgDark.getHeight(), gain), zeros);
    }

    // Even counts average the two middle values.
    static float median(float[] values) {
        float[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) return (float) ((sorted[mid - 1] + (double) sorted[mid]) / 2.0);
        return sorted[mid];
    }

    // --- CACHE + NOISE ---

    // Best effort: a failed write is logged and the run goes on.
    public void saveCache(ReferenceFrames refs) {
        saveIfMissing(config.darkFile(), refs.avgDark, "average dark");
        saveIfMissing(config.flatFile(), refs.avgFlat, "average flat");
        saveIfMissing(config.gainFile(), refs.gain, "gain");
    }

    private void saveIfMissing(Path file, FloatProcessor image, String what) {
        if (Files.exists(file)) {
            log.info("{} file already exists: {}", what, file);
            return;
        }
        log.info("Saving {}: {}", what, file);
        try {
            store.write(file, image);
        } catch (IOException e) {
            log.warn("Could not write FITS file: {} ({})", file, e.getMessage());
            log.warn("FITS write warning: continuing, but this could cause problems later.");
        }
    }

    // (flat - avgDark) * gain for the first burstNumber flat frames; kept if already on disk.
    public Path writeNoiseCube(FrameSet flats, ReferenceFrames refs) throws IOException {
        Path target = config.noisePath();
        if (Files.exists(target)) {
            log.info("Noise file already exists: {}", target);
            return target;
        }
        int planeSize = geometry.imageShape().pixelCount();
        log.info("Computing noise cube: shape: ({}, {}, {})", config.burstNumber,
                geometry.imageShape().rows(), geometry.imageShape().cols());

        float[] dark = refs.darkPixels();
        float[] gain = refs.gainPixels();
        float[] cube = new float[config.burstNumber * planeSize];
        int slot = 0;
        for (Path file : flats.files()) {
            if (slot == config.burstNumber) break;
            for (SubFrame sf : source.readSubFrames(file, geometry)) {
                if (slot == config.burstNumber) break;
                float[] px = sf.data();
                int off = slot * planeSize;
                for (int i = 0; i < planeSize; i++) cube[off + i] = (px[i] - dark[i]) * gain[i];
                slot++;
            }
        }
        if (slot == 0) throw new IOException("No flat frames to build the noise cube from");
        if (slot < config.burstNumber) {
            log.warn("Only {} flat frames available for a {}-frame noise cube.", slot, config.burstNumber);
            cube = Arrays.copyOf(cube, slot * planeSize);
        }
        Files.createDirectories(target.getParent());
        RawImageIO.writeFloat32(target, cube);
        log.info("Saved noise file: {}", target);
        return target;
    }
}
