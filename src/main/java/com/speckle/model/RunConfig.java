package com.speckle.model;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Everything one calibration run needs, resolved once from the configuration file.
 * Instances are immutable and handed to each component explicitly.
 */
public final class RunConfig {
    public final String instrument;
    public final InstrumentFamily family;

    public final Path darkBase;
    public final Path dataBase;
    public final Path flatBase;
    public final Path workBase;

    public final String darkFilePattern;
    public final String dataFilePattern;
    public final String flatFilePattern;

    public final int burstNumber;
    // String.format patterns taking (obsDate, obsTime, batch, index)
    public final String burstFileForm;
    public final String speckledFileForm;
    public final String obsDate; // yyyyMMdd
    public final String obsTime; // HHmmss
    public final int expTimeMs;
    public final String noiseFile;

    // Numeric text, written to init_props.dat as given
    public final String wavelengthNm;
    public final String arcsecPerPixX;
    public final String arcsecPerPixY;

    public final KisipMethod method;
    public final KisipProps props;
    public final KisipEnv env;

    public final boolean saveBursts;

    private RunConfig(Builder b) {
        this.instrument = b.instrument.toUpperCase(Locale.ROOT);
        this.family = InstrumentFamily.of(this.instrument);
        this.darkBase = b.darkBase;
        this.dataBase = b.dataBase;
        this.flatBase = b.flatBase;
        this.workBase = b.workBase;
        this.darkFilePattern = b.darkFilePattern;
        this.dataFilePattern = b.dataFilePattern;
        this.flatFilePattern = b.flatFilePattern;
        this.burstNumber = b.burstNumber;
        this.burstFileForm = b.burstFileForm;
        this.speckledFileForm = b.speckledFileForm;
        this.obsDate = b.obsDate;
        this.obsTime = b.obsTime;
        this.expTimeMs = b.expTimeMs;
        this.noiseFile = b.noiseFile;
        this.wavelengthNm = b.wavelengthNm;
        this.arcsecPerPixX = b.arcsecPerPixX;
        this.arcsecPerPixY = b.arcsecPerPixY;
        this.method = b.method;
        this.props = b.props;
        this.env = b.env;
        this.saveBursts = b.saveBursts;
    }

    // --- DERIVED LOCATIONS ---
    public Path preSpeckleBase() { return workBase.resolve("preSpeckle"); }
    public Path speckleBase() { return workBase.resolve("speckle"); }
    public Path postSpeckleBase() { return workBase.resolve("postSpeckle"); }

    public Path darkFile() { return workBase.resolve(instrument + "_dark.fits"); }
    public Path flatFile() { return workBase.resolve(instrument + "_flat.fits"); }
    public Path gainFile() { return workBase.resolve(instrument + "_gain.fits"); }
    public Path noisePath() { return preSpeckleBase().resolve(noiseFile); }

    public Path logFile() {
        return workBase.resolve(obsTime + "_" + instrument.toLowerCase(Locale.ROOT) + ".log");
    }

    public String basePattern(FrameRole role) {
        switch (role) {
            case DARK: return darkFilePattern;
            case FLAT: return flatFilePattern;
            default: return dataFilePattern;
        }
    }

    public Path baseDir(FrameRole role) {
        switch (role) {
            case DARK: return darkBase;
            case FLAT: return flatBase;
            default: return dataBase;
        }
    }

    public Builder toBuilder() {
        return new Builder()
                .instrument(instrument)
                .darkBase(darkBase).dataBase(dataBase).flatBase(flatBase).workBase(workBase)
                .darkFilePattern(darkFilePattern).dataFilePattern(dataFilePattern).flatFilePattern(flatFilePattern)
                .burstNumber(burstNumber).burstFileForm(burstFileForm).speckledFileForm(speckledFileForm)
                .obsDate(obsDate).obsTime(obsTime).expTimeMs(expTimeMs).noiseFile(noiseFile)
                .wavelengthNm(wavelengthNm).arcsecPerPix(arcsecPerPixX, arcsecPerPixY)
                .method(method).props(props).env(env).saveBursts(saveBursts);
    }

    public static class Builder {
        private String instrument;
        private Path darkBase, dataBase, flatBase, workBase;
        private String darkFilePattern, dataFilePattern, flatFilePattern;
        private int burstNumber;
        private String burstFileForm, speckledFileForm;
        private String obsDate, obsTime;
        private int expTimeMs;
        private String noiseFile;
        private String wavelengthNm, arcsecPerPixX, arcsecPerPixY;
        private KisipMethod method;
        private KisipProps props;
        private KisipEnv env;
        private boolean saveBursts = true;

        public Builder instrument(String v) { instrument = v; return this; }
        public Builder darkBase(Path v) { darkBase = v; return this; }
        public Builder dataBase(Path v) { dataBase = v; return this; }
        public Builder flatBase(Path v) { flatBase = v; return this; }
        public Builder workBase(Path v) { workBase = v; return this; }
        public Builder darkFilePattern(String v) { darkFilePattern = v; return this; }
        public Builder dataFilePattern(String v) { dataFilePattern = v; return this; }
        public Builder flatFilePattern(String v) { flatFilePattern = v; return this; }
        public Builder burstNumber(int v) { burstNumber = v; return this; }
        public Builder burstFileForm(String v) { burstFileForm = v; return this; }
        public Builder speckledFileForm(String v) { speckledFileForm = v; return this; }
        public Builder obsDate(String v) { obsDate = v; return this; }
        public Builder obsTime(String v) { obsTime = v; return this; }
        public Builder expTimeMs(int v) { expTimeMs = v; return this; }
        public Builder noiseFile(String v) { noiseFile = v; return this; }
        public Builder wavelengthNm(String v) { wavelengthNm = v; return this; }
        public Builder arcsecPerPix(String x, String y) { arcsecPerPixX = x; arcsecPerPixY = y; return this; }
        public Builder method(KisipMethod v) { method = v; return this; }
        public Builder props(KisipProps v) { props = v; return this; }
        public Builder env(KisipEnv v) { env = v; return this; }
        public Builder saveBursts(boolean v) { saveBursts = v; return this; }

        public RunConfig build() {
            if (instrument == null || workBase == null) throw new IllegalStateException("instrument and workBase are required");
            if (burstNumber <= 0) throw new IllegalStateException("burstNumber must be positive: " + burstNumber);
            return new RunConfig(this);
        }
    }
}
