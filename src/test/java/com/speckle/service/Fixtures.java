package com.speckle.service;

import com.speckle.model.KisipEnv;
import com.speckle.model.KisipMethod;
import com.speckle.model.KisipProps;
import com.speckle.model.RunConfig;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;

// Synthetic camera files and run configurations for tests.
final class Fixtures {

    static final String BURST_FORM = "%s_%s_halpha_kisip.raw.batch.%02d.%03d";
    static final String SPECKLED_FORM = "%s_%s_halpha_kisip.speckle.batch.%02d.%03d";

    private Fixtures() {}

    static KisipMethod method() {
        return new KisipMethod("1", "5", "95", "10", "10", "30", "80", "1.2", "15", "1");
    }

    static KisipProps props() {
        return new KisipProps("0", "760", "-1", "-1", "1");
    }

    static KisipEnv env(Path root) {
        return new KisipEnv(root.resolve("kisip/bin"), root.resolve("kisip/lib"), 4, "mpirun", "entry");
    }

    static RunConfig.Builder config(Path root, String instrument, int burstNumber) {
        String pattern = instrument.startsWith("ZYLA") ? "*spool.dat" : "*.fit";
        return new RunConfig.Builder()
                .instrument(instrument)
                .darkBase(root.resolve("dark"))
                .dataBase(root.resolve("data"))
                .flatBase(root.resolve("flat"))
                .workBase(root.resolve("work"))
                .darkFilePattern(pattern)
                .dataFilePattern(pattern)
                .flatFilePattern(pattern)
                .burstNumber(burstNumber)
                .burstFileForm(BURST_FORM)
                .speckledFileForm(SPECKLED_FORM)
                .obsDate("20180619")
                .obsTime("140100")
                .expTimeMs(20)
                .noiseFile("kisip.halpha.noise")
                .wavelengthNm("656.3")
                .arcsecPerPix("0.109", "0.109")
                .method(method())
                .props(props())
                .env(env(root));
    }

    // Zyla spool name whose leading counter reverses to the given index.
    static String spoolName(int index) {
        return new StringBuilder(String.format("%010d", index)).reverse() + "spool.dat";
    }

    /** Row-major dataRows x dataCols buffer; the top-left imageRows x imageCols block holds value, the rest is zero. */
    static short[] paddedFrame(int dataRows, int dataCols, int imageRows, int imageCols, int value) {
        short[] s = new short[dataRows * dataCols];
        for (int y = 0; y < imageRows; y++) {
            for (int x = 0; x < imageCols; x++) s[y * dataCols + x] = (short) value;
        }
        return s;
    }

    static Path writeRaw16(Path file, short[] samples) throws IOException {
        ByteBuffer bb = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (short v : samples) bb.putShort(v);
        Files.createDirectories(file.getParent());
        Files.write(file, bb.array());
        return file;
    }

    static float[] readFloatsLE(Path file) throws IOException {
        ByteBuffer bb = ByteBuffer.wrap(Files.readAllBytes(file)).order(ByteOrder.LITTLE_ENDIAN);
        float[] out = new float[bb.remaining() / 4];
        for (int i = 0; i < out.length; i++) out[i] = bb.getFloat();
        return out;
    }

    /** ROSA-style file: primary HDU plus one rows x cols extension per value, with a few header cards. */
    static Path writeRosaFits(Path file, int rows, int cols, List<Integer> frameValues) throws IOException {
        Files.createDirectories(file.getParent());
        try (Fits fits = new Fits()) {
            BasicHDU<?> primary = Fits.makeHDU(new short[1][1]);
            primary.getHeader().addValue("TELESCOP", "DST", "Dunn Solar Telescope");
            primary.getHeader().addValue("OBSERVER", "ROSA", null);
            fits.addHDU(primary);
            int n = 0;
            for (int v : frameValues) {
                short[][] px = new short[rows][cols];
                for (short[] row : px) java.util.Arrays.fill(row, (short) v);
                BasicHDU<?> ext = Fits.makeHDU(px);
                ext.getHeader().addValue("FRAMENUM", n++, "frame counter");
                ext.getHeader().addValue("EXPTIME", 0.012, "exposure s");
                fits.addHDU(ext);
            }
            fits.write(file.toFile());
        } catch (FitsException e) {
            throw new IOException(e);
        }
        return file;
    }
}
