package com.speckle.service;

import com.speckle.error.GeometryDetectionException;
import com.speckle.model.FrameShape;
import com.speckle.model.ImageGeometry;
import com.speckle.model.RunConfig;
import com.speckle.model.SubFrame;
import ij.process.FloatProcessor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// ROSA files: an empty-ish primary HDU followed by one image extension per frame.
public class FitsFrameSource implements FrameSource {

    private static final Logger log = LoggerFactory.getLogger(FitsFrameSource.class);

    @Override
    public ImageGeometry detectGeometry(Path sample) throws IOException, GeometryDetectionException {
        log.info("Detecting image and data dimensions in file: {}", sample);
        ImageGeometry g = firstExtensionGeometry(sample);
        log.info("Auto-detected data dimensions (rows, cols): {}", g.dataShape());
        log.info("Auto-detected image dimensions (rows, cols): {}", g.imageShape());
        return g;
    }

    @Override
    public void checkLayout(Path file, ImageGeometry geometry) throws IOException, GeometryDetectionException {
        ImageGeometry g = firstExtensionGeometry(file);
        if (!g.equals(geometry)) {
            throw new GeometryDetectionException(file + " holds " + g.imageShape() + " frames, expected " + geometry.imageShape());
        }
    }

    private static ImageGeometry firstExtensionGeometry(Path file) throws IOException, GeometryDetectionException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length < 2) {
                throw new GeometryDetectionException("No image extension in " + file);
            }
            Header h = hdus[1].getHeader();
            int naxis = h.getIntValue("NAXIS", 0);
            int cols = h.getIntValue("NAXIS1", 0);
            int rows = h.getIntValue("NAXIS2", 0);
            if (naxis != 2 || rows <= 0 || cols <= 0) {
                throw new GeometryDetectionException("Could not read frame dimensions from FITS header of " + file
                        + " (NAXIS=" + naxis + ", NAXIS1=" + cols + ", NAXIS2=" + rows + ")");
            }
            return ImageGeometry.unpadded(rows, cols);
        } catch (FitsException e) {
            throw new IOException("Could not read FITS file " + file, e);
        }
    }

    @Override
    public List<Path> orderFiles(List<Path> files) {
        return FrameOrdering.orderLexicographically(files);
    }

    @Override
    public List<SubFrame> readSubFrames(Path file, ImageGeometry geometry) throws IOException {
        FrameShape shape = geometry.imageShape();
        List<SubFrame> frames = new ArrayList<>();
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length == 0) throw new IOException("Empty FITS file: " + file);
            List<String> primaryCards = cards(hdus[0].getHeader());
            for (int i = 1; i < hdus.length; i++) {
                Header h = hdus[i].getHeader();
                float[] px = toFloat(hdus[i].getKernel(), h.getDoubleValue("BSCALE", 1.0), h.getDoubleValue("BZERO", 0.0), shape);
                if (px == null) {
                    throw new IOException("Extension " + i + " of " + file + " is not a " + shape + " image");
                }
                List<String> headerCards = new ArrayList<>(cards(h));
                headerCards.add("");
                headerCards.addAll(primaryCards);
                frames.add(new SubFrame(new FloatProcessor(shape.cols(), shape.rows(), px), headerCards));
            }
        } catch (FitsException e) {
            throw new IOException("Could not read FITS file " + file, e);
        }
        return frames;
    }

    @Override
    public List<String> sidecarLines(RunConfig config, int burstIndex, SubFrame lastFrame) {
        return lastFrame.headerCards();
    }

    static List<String> cards(Header header) {
        List<String> out = new ArrayList<>();
        Cursor<String, HeaderCard> it = header.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            if ("END".equals(card.getKey())) continue;
            out.add(card.toString().stripTrailing());
        }
        return out;
    }

    // Physical value = BZERO + BSCALE * stored value; null when the kernel is not a rows x cols image.
    private static float[] toFloat(Object k, double bscale, double bzero, FrameShape shape) {
        int rows = shape.rows();
        int cols = shape.cols();
        if (!(k instanceof Object[]) || ((Object[]) k).length != rows) return null;
        float[] px = new float[rows * cols];
        for (int y = 0; y < rows; y++) {
            double[] row = rowValues(((Object[]) k)[y]);
            if (row == null || row.length != cols) return null;
            for (int x = 0; x < cols; x++) {
                px[y * cols + x] = (float) (bzero + bscale * row[x]);
            }
        }
        return px;
    }

    // BITPIX 8 is unsigned
    private static double[] rowValues(Object row) {
        if (row instanceof short[]) {
            short[] r = (short[]) row;
            double[] out = new double[r.length];
            for (int x = 0; x < r.length; x++) {
                out[x] = r[x];
            }
            return out;
        }
        if (row instanceof int[]) {
            int[] r = (int[]) row;
            double[] out = new double[r.length];
            for (int x = 0; x < r.length; x++) {
                out[x] = r[x];
            }
            return out;
        }
        if (row instanceof byte[]) {
            byte[] r = (byte[]) row;
            double[] out = new double[r.length];
            for (int x = 0; x < r.length; x++) {
                out[x] = r[x] & 0xFF;
            }
            return out;
        }
        if (row instanceof float[]) {
            float[] r = (float[]) row;
            double[] out = new double[r.length];
            for (int x = 0; x < r.length; x++) {
                out[x] = r[x];
            }
            return out;
        }
        if (row instanceof double[]) {
            return (double[]) row;
        }
        return null;
    }
}
