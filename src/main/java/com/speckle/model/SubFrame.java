package com.speckle.model;

import ij.process.FloatProcessor;
import java.util.List;

/**
 * One image plane read from a frame file, already cropped to the usable region.
 * {@code headerCards} holds the FITS cards describing the plane (extension header, blank line,
 * primary header) and is empty for headerless raw dumps.
 */
public record SubFrame(FloatProcessor pixels, List<String> headerCards) {

    public SubFrame {
        headerCards = List.copyOf(headerCards);
    }

    public float[] data() { return (float[]) pixels.getPixels(); }
}
