package com.speckle.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.speckle.error.DiscoveryException;
import com.speckle.model.ImageGeometry;
import com.speckle.model.RunConfig;
import ij.process.FloatProcessor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultTranscriberTest {

    private static final ImageGeometry GEOMETRY = ImageGeometry.unpadded(4, 5);

    @TempDir
    Path tmp;

    private static float[] ramp() {
        float[] px = new float[20];
        for (int i = 0; i < px.length; i++) px[i] = i * 0.5f;
        return px;
    }

    private static boolean hasComment(Header h, String text) {
        Cursor<String, HeaderCard> it = h.iterator();
        while (it.hasNext()) {
            HeaderCard c = it.next();
            if ("COMMENT".equals(c.getKey()) && c.getComment() != null && c.getComment().contains(text)) return true;
        }
        return false;
    }

    @Test
    void zylaReconstructionGetsTimestampCardsAndWarning() throws Exception {
        RunConfig config = Fixtures.config(tmp, "ZYLA", 10).build();
        Files.createDirectories(config.speckleBase());
        Files.createDirectories(config.preSpeckleBase());
        Path fin = config.speckleBase().resolve("20180619_140100_halpha_kisip.speckle.batch.00.001.final");
        RawImageIO.writeFloat32(fin, ramp());
        Files.write(BurstNaming.sidecarFile(config, 0, 1),
                List.of("DATE    =2018-06-19T14:01:00.200", "EXPOSURE=20"));

        int written = new ResultTranscriber(config, GEOMETRY, new FitsImageStore()).transcribeAll();

        assertEquals(1, written);
        Path out = config.postSpeckleBase().resolve(fin.getFileName() + ".fits");
        try (Fits fits = new Fits(out.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            Header h = hdu.getHeader();
            assertEquals("2018-06-19T14:01:00.200", h.getStringValue("DATE"));
            assertEquals(20, h.getIntValue("EXPOSURE"));
            assertTrue(hasComment(h, "Timestamps were reconstructed"));
            float[][] px = (float[][]) hdu.getKernel();
            assertEquals(4, px.length);
            assertEquals(9.5f, px[3][4], 0f);
        }
        FloatProcessor back = new FitsImageStore().read(out);
        assertEquals(0.5f, ((float[]) back.getPixels())[1], 0f);
    }

    @Test
    void fitsCardsAreTypedAndStructuralKeysSkipped() throws Exception {
        BasicHDU<?> hdu = new FitsImageStore().toHdu(new FloatProcessor(5, 4, ramp()));
        Header h = hdu.getHeader();

        ResultTranscriber.applyCards(h, List.of(
                "XTENSION= 'IMAGE   '           / Image extension",
                "NAXIS1  =                   99",
                "FRAMENUM=                   12 / frame counter",
                "EXPTIME =                0.012 / exposure s",
                "",
                "SIMPLE  =                    T",
                "TELESCOP= 'DST     '           / Dunn Solar Telescope",
                "AOLOCKED=                    F",
                "COMMENT just text"));

        assertEquals(5, h.getIntValue("NAXIS1"));
        assertEquals(12, h.getIntValue("FRAMENUM"));
        assertEquals(0.012, h.getDoubleValue("EXPTIME"), 1e-12);
        assertEquals("DST", h.getStringValue("TELESCOP"));
        assertFalse(h.getBooleanValue("AOLOCKED", true));
        assertFalse(h.containsKey("XTENSION"));
    }

    @Test
    void rosaReconstructionHasNoTimestampWarning() throws Exception {
        RunConfig config = Fixtures.config(tmp, "ROSA_GBAND", 10).build();
        Files.createDirectories(config.speckleBase());
        Path fin = config.speckleBase().resolve("20180619_140100_halpha_kisip.speckle.batch.00.000.final");
        RawImageIO.writeFloat32(fin, ramp());

        ResultTranscriber t = new ResultTranscriber(config, GEOMETRY, new FitsImageStore());
        assertEquals(1, t.transcribeAll());

        try (Fits fits = new Fits(config.postSpeckleBase().resolve(fin.getFileName() + ".fits").toFile())) {
            assertFalse(hasComment(fits.getHDU(0).getHeader(), "Timestamps were reconstructed"));
        }
    }

    @Test
    void noReconstructionsIsADiscoveryFailure() {
        RunConfig config = Fixtures.config(tmp, "ZYLA", 10).build();
        ResultTranscriber t = new ResultTranscriber(config, GEOMETRY, new FitsImageStore());
        assertThrows(DiscoveryException.class, t::transcribeAll);
    }

    @Test
    void wrongSizedReconstructionIsAnIoFailure() throws Exception {
        RunConfig config = Fixtures.config(tmp, "ZYLA", 10).build();
        Files.createDirectories(config.speckleBase());
        RawImageIO.writeFloat32(config.speckleBase().resolve("20180619_140100_halpha_kisip.speckle.batch.00.000.final"),
                new float[7]);
        ResultTranscriber t = new ResultTranscriber(config, GEOMETRY, new FitsImageStore());
        assertThrows(java.io.IOException.class, t::transcribeAll);
    }
}
