package com.speckle.model;

import java.util.Locale;

public enum InstrumentFamily {
    // Zyla: headerless uint16 spool dumps with zero-valued overscan
    RAW_BUFFER,
    // ROSA: FITS files, one image per extension
    STRUCTURED_HEADER;

    public static InstrumentFamily of(String instrument) {
        String name = instrument.toUpperCase(Locale.ROOT);
        if (name.startsWith("ZYLA")) return RAW_BUFFER;
        if (name.startsWith("ROSA")) return STRUCTURED_HEADER;
        throw new IllegalArgumentException("Unknown instrument: " + instrument);
    }
}
