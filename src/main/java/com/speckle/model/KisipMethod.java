package com.speckle.model;

// Rarely-changed reconstruction tuning, written to init_method.dat in this order.
// Values are kept as the numeric text found in the configuration file.
public record KisipMethod(String method, String subfieldArcsec, String phaseRecLimit, String ux, String uv,
                          String maxIterations, String snThreshold, String weightExponent,
                          String phaseRecApodization, String noiseFilter) {
}
