package com.example.facelandmarker.components.containers;

import java.util.Arrays;

public final class TransformMatrix {

    private final int rows;
    private final int cols;
    private final float[] data;

    public TransformMatrix(int rows, int cols, float[] data) {
        if (rows <= 0 || cols <= 0 || data.length != rows * cols) {
            throw new IllegalArgumentException("Matrix data must hold " + rows + "x" + cols + " values, got " + data.length);
        }
        this.rows = rows;
        this.cols = cols;
        this.data = data.clone();
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public float get(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + rows + "x" + cols);
        }
        return data[row * cols + col];
    }

    public float[] toArray() {
        return data.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TransformMatrix)) {
            return false;
        }
        TransformMatrix that = (TransformMatrix) other;
        return rows == that.rows && cols == that.cols && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "TransformMatrix[" + rows + "x" + cols + " " + Arrays.toString(data) + "]";
    }
}
