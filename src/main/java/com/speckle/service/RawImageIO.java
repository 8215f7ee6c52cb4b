package com.speckle.service;

import ij.io.FileInfo;
import ij.io.ImageReader;
import ij.io.ImageWriter;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

// Headerless little-endian sample dumps: uint16 camera spools in, float32 cubes out.
public final class RawImageIO {

    private RawImageIO() {}

    public static short[] readUnsigned16(Path file) throws IOException {
        int n = sampleCount(file, 2);
        FileInfo fi = rawInfo(FileInfo.GRAY16_UNSIGNED, n);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            Object px = new ImageReader(fi).readPixels(in);
            if (!(px instanceof short[])) throw new IOException("Could not read 16-bit samples from " + file);
            return (short[]) px;
        }
    }

    public static float[] readFloat32(Path file, int expectedSamples) throws IOException {
        int n = sampleCount(file, 4);
        if (n != expectedSamples) {
            throw new IOException(file + " holds " + n + " float samples, expected " + expectedSamples);
        }
        FileInfo fi = rawInfo(FileInfo.GRAY32_FLOAT, n);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            Object px = new ImageReader(fi).readPixels(in);
            if (!(px instanceof float[])) throw new IOException("Could not read float samples from " + file);
            return (float[]) px;
        }
    }

    public static void writeFloat32(Path file, float[] samples) throws IOException {
        FileInfo fi = rawInfo(FileInfo.GRAY32_FLOAT, samples.length);
        fi.pixels = samples;
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file))) {
            new ImageWriter(fi).write(out);
        }
    }

    private static FileInfo rawInfo(int fileType, int samples) {
        FileInfo fi = new FileInfo();
        fi.fileType = fileType;
        fi.width = samples;
        fi.height = 1;
        fi.nImages = 1;
        fi.intelByteOrder = true;
        return fi;
    }

    private static int sampleCount(Path file, int bytesPerSample) throws IOException {
        long bytes = Files.size(file);
        if (bytes % bytesPerSample != 0) {
            throw new IOException(file + " is " + bytes + " bytes, not a whole number of " + bytesPerSample + "-byte samples");
        }
        long n = bytes / bytesPerSample;
        if (n == 0 || n > Integer.MAX_VALUE) throw new IOException(file + " has an unusable size: " + bytes + " bytes");
        return (int) n;
    }
}
