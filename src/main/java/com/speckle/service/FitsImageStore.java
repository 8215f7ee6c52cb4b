package com.speckle.service;

import ij.process.FloatProcessor;
import java.io.IOException;
import java.nio.file.Path;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;

// Single-image FITS files: cached reference frames and transcribed reconstructions.
public class FitsImageStore {

    public FloatProcessor read(Path file) throws IOException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new IOException("No primary image in " + file);
            FloatProcessor fp = toProcessor(hdu.getKernel());
            if (fp == null) throw new IOException("Unsupported image data in " + file);
            return fp;
        } catch (FitsException e) {
            throw new IOException("Could not read FITS file " + file, e);
        }
    }

    public void write(Path file, FloatProcessor image) throws IOException {
        write(file, toHdu(image));
    }

    public void write(Path file, BasicHDU<?> hdu) throws IOException {
        try (Fits fits = new Fits()) {
            fits.addHDU(hdu);
            fits.write(file.toFile());
        } catch (FitsException e) {
            throw new IOException("Could not write FITS file " + file, e);
        }
    }

    public BasicHDU<?> toHdu(FloatProcessor image) throws IOException {
        int w = image.getWidth(), h = image.getHeight();
        float[] px = (float[]) image.getPixels();
        float[][] rows = new float[h][w];
        for (int y = 0; y < h; y++) System.arraycopy(px, y * w, rows[y], 0, w);
        try {
            return Fits.makeHDU(rows);
        } catch (FitsException e) {
            throw new IOException("Could not build FITS image " + w + "x" + h, e);
        }
    }

    private static FloatProcessor toProcessor(Object k) {
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            if (f.length == 0) return null;
            int h = f.length, w = f[0].length;
            float[] px = new float[w * h];
            for (int y = 0; y < h; y++) System.arraycopy(f[y], 0, px, y * w, w);
            return new FloatProcessor(w, h, px);
        }
        if (k instanceof double[][]) {
            double[][] d = (double[][]) k;
            if (d.length == 0) return null;
            int h = d.length, w = d[0].length;
            float[] px = new float[w * h];
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = (float) d[y][x];
            return new FloatProcessor(w, h, px);
        }
        return null;
    }
}
