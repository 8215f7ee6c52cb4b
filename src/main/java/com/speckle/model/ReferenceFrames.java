package com.speckle.model;

import ij.process.FloatProcessor;

public class ReferenceFrames {
    public final FloatProcessor avgDark;
    public final FloatProcessor avgFlat;
    public final FloatProcessor gain;

    // Pixels where avgFlat - avgDark was exactly zero; their gain is not finite.
    public final int zeroDenominators;

    public ReferenceFrames(FloatProcessor avgDark, FloatProcessor avgFlat, FloatProcessor gain, int zeroDenominators) {
        this.avgDark = avgDark;
        this.avgFlat = avgFlat;
        this.gain = gain;
        this.zeroDenominators = zeroDenominators;
    }

    public float[] darkPixels() { return (float[]) avgDark.getPixels(); }
    public float[] flatPixels() { return (float[]) avgFlat.getPixels(); }
    public float[] gainPixels() { return (float[]) gain.getPixels(); }
}
