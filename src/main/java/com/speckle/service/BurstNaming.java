package com.speckle.service;

import com.speckle.model.RunConfig;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File names shared by the burst writer, the KISIP descriptors and the transcriber.
 * Forms look like {@code %s_%s_halpha_kisip.raw.batch.%02d.%03d}: date, time, batch, index.
 */
public final class BurstNaming {

    public static final int BURSTS_PER_BATCH = 1000;

    // <anything>.<batch>.<index>.final
    private static final Pattern FINAL_NAME = Pattern.compile("\\.(\\d+)\\.(\\d{3})\\.final$");
    // <anything>.<batch>.<index>
    private static final Pattern BURST_NAME = Pattern.compile("\\.(\\d+)\\.(\\d{3})$");

    private BurstNaming() {}

    public static int batchOf(int burstIndex) { return burstIndex / BURSTS_PER_BATCH; }

    public static int indexInBatch(int burstIndex) { return burstIndex % BURSTS_PER_BATCH; }

    public static String format(String form, RunConfig c, int batch, int index) {
        return String.format(Locale.ROOT, form, c.obsDate, c.obsTime, batch, index);
    }

    public static Path burstFile(RunConfig c, int batch, int index) {
        return c.preSpeckleBase().resolve(format(c.burstFileForm, c, batch, index));
    }

    public static Path sidecarFile(RunConfig c, int batch, int index) {
        Path burst = burstFile(c, batch, index);
        return burst.resolveSibling(burst.getFileName() + ".txt");
    }

    // "...batch.03.000" -> "...batch.03.*"
    public static String burstGlob(RunConfig c, int batch) {
        String name = format(c.burstFileForm, c, batch, 0);
        return name.substring(0, name.length() - 3) + "*";
    }

    // "...batch.03.000" -> ".../preSpeckle/...batch.03"
    public static Path burstStem(RunConfig c, int batch) {
        String name = format(c.burstFileForm, c, batch, 0);
        return c.preSpeckleBase().resolve(name.substring(0, name.length() - 4));
    }

    public static Path speckledStem(RunConfig c, int batch) {
        String name = format(c.speckledFileForm, c, batch, 0);
        return c.speckleBase().resolve(name.substring(0, name.length() - 4));
    }

    // "...batch.00.000" -> "...batch.*.final", covering every batch
    public static String speckledGlob(RunConfig c) {
        String name = format(c.speckledFileForm, c, 0, 0);
        return name.substring(0, name.length() - 7) + "*.final";
    }

    // "...batch.00.000" -> "...batch*", every burst of every batch
    public static String allBurstsGlob(RunConfig c) {
        String name = format(c.burstFileForm, c, 0, 0);
        return name.substring(0, name.length() - 7) + "*";
    }

    // {batch, index}, or null for sidecars and foreign files
    public static int[] parseBurstName(String fileName) {
        Matcher m = BURST_NAME.matcher(fileName);
        if (!m.find()) return null;
        return new int[] { Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)) };
    }

    // {batch, index}, or null
    public static int[] parseFinalName(String fileName) {
        Matcher m = FINAL_NAME.matcher(fileName);
        if (!m.find()) return null;
        return new int[] { Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)) };
    }
}
