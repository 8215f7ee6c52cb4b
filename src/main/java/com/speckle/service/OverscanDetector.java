package com.speckle.service;

import com.speckle.error.GeometryDetectionException;
import com.speckle.model.FrameShape;
import com.speckle.model.ImageGeometry;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers the buffer stride and usable image region of a raw sensor dump from its zero-valued
 * overscan. Assumes every overscan sample is exactly zero and the image holds no zero pixels.
 */
public class OverscanDetector {

    private static final Logger log = LoggerFactory.getLogger(OverscanDetector.class);

    public ImageGeometry detect(short[] samples) throws GeometryDetectionException {
        log.info("Attempting to detect overscan and data shape.");
        int[] bounds = zeroRunBoundaries(samples);
        log.info("Zeros boundary detected at: {}", Arrays.toString(bounds));
        if (bounds.length < 3) {
            throw new GeometryDetectionException("Found " + bounds.length
                    + " zero-run boundaries; overscan is missing or the frame is not a raw dump");
        }

        // --- DATA SHAPE ---
        // End of the first overscan run is the row stride.
        int stride = bounds[1];
        if (stride <= 0 || samples.length % stride != 0) {
            throw new GeometryDetectionException("Row stride " + stride + " does not divide " + samples.length + " samples");
        }
        FrameShape dataShape = new FrameShape(samples.length / stride, stride);

        // --- IMAGE SHAPE ---
        // Within the usable rows, boundaries alternate between the two first deltas.
        log.info("Attempting to detect image shape.");
        int dx1 = bounds[1] - bounds[0];
        int dx2 = bounds[2] - bounds[1];
        int endRow = -1;
        for (int j = 0; j < bounds.length - 1; j++) {
            int delta = Math.abs(bounds[j + 1] - bounds[j]);
            if (delta != dx1 && delta != dx2) {
                endRow = j / 2 + 1;
                break;
            }
        }
        if (endRow < 0) {
            throw new GeometryDetectionException("No end of the usable rows found; frame has no bottom overscan");
        }
        FrameShape imageShape = new FrameShape(endRow, bounds[0]);
        if (imageShape.rows() <= 0 || imageShape.cols() <= 0 || !dataShape.contains(imageShape)) {
            throw new GeometryDetectionException("Detected image shape " + imageShape + " is outside data shape " + dataShape);
        }

        log.info("Auto-detected data dimensions (rows, cols): {}", dataShape);
        log.info("Auto-detected image dimensions (rows, cols): {}", imageShape);
        return new ImageGeometry(dataShape, imageShape);
    }

    // Indices where the zero mask, padded with false at both ends, changes value.
    static int[] zeroRunBoundaries(short[] samples) {
        int[] out = new int[16];
        int n = 0;
        boolean prev = false;
        for (int i = 0; i <= samples.length; i++) {
            boolean cur = i < samples.length && samples[i] == 0;
            if (cur != prev) {
                if (n == out.length) out = Arrays.copyOf(out, n * 2);
                out[n++] = i;
            }
            prev = cur;
        }
        return Arrays.copyOf(out, n);
    }
}
