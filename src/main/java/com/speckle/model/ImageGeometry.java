package com.speckle.model;

/**
 * Physical buffer layout of a frame (including overscan) and the usable region inside it.
 * The usable region always starts at row 0, column 0.
 */
public record ImageGeometry(FrameShape dataShape, FrameShape imageShape) {

    public ImageGeometry {
        if (imageShape.rows() <= 0 || imageShape.cols() <= 0 || !dataShape.contains(imageShape)) {
            throw new IllegalArgumentException("Image shape " + imageShape + " does not fit in data shape " + dataShape);
        }
    }

    public static ImageGeometry unpadded(int rows, int cols) {
        FrameShape s = new FrameShape(rows, cols);
        return new ImageGeometry(s, s);
    }
}
