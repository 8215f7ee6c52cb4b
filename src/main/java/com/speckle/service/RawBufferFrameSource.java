package com.speckle.service;

import com.speckle.error.GeometryDetectionException;
import com.speckle.error.OrderingException;
import com.speckle.model.FrameShape;
import com.speckle.model.ImageGeometry;
import com.speckle.model.RunConfig;
import com.speckle.model.SubFrame;
import ij.process.FloatProcessor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Zyla spool files: one uint16 frame per file, overscan included.
public class RawBufferFrameSource implements FrameSource {

    private static final Logger log = LoggerFactory.getLogger(RawBufferFrameSource.class);

    private static final DateTimeFormatter OBS_START = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final DateTimeFormatter FITS_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");

    private final OverscanDetector detector = new OverscanDetector();

    @Override
    public ImageGeometry detectGeometry(Path sample) throws IOException, GeometryDetectionException {
        log.info("Detecting image and data dimensions in binary file: {}", sample);
        return detector.detect(RawImageIO.readUnsigned16(sample));
    }

    @Override
    public void checkLayout(Path file, ImageGeometry geometry) throws IOException, GeometryDetectionException {
        long expected = geometry.dataShape().pixelCount() * 2L;
        long size = Files.size(file);
        if (size != expected) {
            throw new GeometryDetectionException(file + " is " + size + " bytes, expected " + expected
                    + " for " + geometry.dataShape());
        }
    }

    @Override
    public List<Path> orderFiles(List<Path> files) throws OrderingException {
        return FrameOrdering.orderByEmbeddedIndex(files);
    }

    @Override
    public List<SubFrame> readSubFrames(Path file, ImageGeometry geometry) throws IOException {
        short[] raw = RawImageIO.readUnsigned16(file);
        FrameShape data = geometry.dataShape();
        if (raw.length != data.pixelCount()) {
            throw new IOException(file + " holds " + raw.length + " samples, expected " + data.pixelCount() + " for " + data);
        }
        return Collections.singletonList(new SubFrame(crop(raw, geometry), Collections.emptyList()));
    }

    @Override
    public List<String> sidecarLines(RunConfig config, int burstIndex, SubFrame lastFrame) {
        return List.of(
                "DATE    =" + reconstructedTimestamp(config, burstIndex),
                "EXPOSURE=" + config.expTimeMs);
    }

    // run start + burstNumber * expTimeMs * burstIndex, assuming no gaps between frames
    public static String reconstructedTimestamp(RunConfig config, int burstIndex) {
        LocalDateTime start = LocalDateTime.parse(config.obsDate + config.obsTime, OBS_START);
        long offsetMs = (long) config.burstNumber * config.expTimeMs * burstIndex;
        return start.plusNanos(offsetMs * 1_000_000L).format(FITS_TIME);
    }

    private static FloatProcessor crop(short[] raw, ImageGeometry geometry) {
        int stride = geometry.dataShape().cols();
        int rows = geometry.imageShape().rows();
        int cols = geometry.imageShape().cols();
        float[] px = new float[rows * cols];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                px[y * cols + x] = raw[y * stride + x] & 0xFFFF;
            }
        }
        return new FloatProcessor(cols, rows, px);
    }
}
