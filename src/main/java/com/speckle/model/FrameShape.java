package com.speckle.model;

// (rows, cols), row-major.
public record FrameShape(int rows, int cols) {

    public int pixelCount() { return rows * cols; }

    public boolean contains(FrameShape other) {
        return other.rows <= rows && other.cols <= cols;
    }

    @Override
    public String toString() { return "(" + rows + ", " + cols + ")"; }
}
