package com.techsheet.cscan.grid;

import com.techsheet.cscan.error.InvalidArgumentException;

import java.util.Arrays;

/**
 * Immutable rows x cols grid of relative echo amplitudes captured during a C-Scan.
 * Cells are stored row-major in a flat buffer addressed by {@code row * cols + col}.
 * Reads outside the grid return 0.0 ("no signal").
 */
public final class AmplitudeGrid {

    private final int rows;
    private final int cols;
    private final double[] cells;

    private AmplitudeGrid(int rows, int cols, double[] cells) {
        this.rows = rows;
        this.cols = cols;
        this.cells = cells;
    }

    /**
     * Builds a grid from a possibly ragged capture buffer.
     * The column count is taken from the first row; null rows, short rows and
     * non-finite values read as 0.0, cells beyond the first row's length are ignored.
     */
    public static AmplitudeGrid of(double[][] raw) {
        if (raw == null || raw.length == 0) {
            return new AmplitudeGrid(0, 0, new double[0]);
        }
        int rows = raw.length;
        int cols = raw[0] != null ? raw[0].length : 0;
        double[] cells = new double[cellCount(rows, cols)];
        for (int r = 0; r < rows; r++) {
            double[] row = raw[r];
            if (row == null) {
                continue;
            }
            int n = Math.min(cols, row.length);
            for (int c = 0; c < n; c++) {
                cells[r * cols + c] = sanitize(row[c]);
            }
        }
        return new AmplitudeGrid(rows, cols, cells);
    }

    public static AmplitudeGrid filled(int rows, int cols, double value) {
        double[] cells = new double[cellCount(rows, cols)];
        Arrays.fill(cells, sanitize(value));
        return new AmplitudeGrid(rows, cols, cells);
    }

    /** Copies a row-major buffer; non-finite values read as 0.0. */
    public static AmplitudeGrid fromFlat(int rows, int cols, double[] values) {
        int count = cellCount(rows, cols);
        if (values == null || values.length != count) {
            throw new InvalidArgumentException("Flat buffer must hold exactly " + count + " values");
        }
        double[] cells = new double[count];
        for (int i = 0; i < count; i++) {
            cells[i] = sanitize(values[i]);
        }
        return new AmplitudeGrid(rows, cols, cells);
    }

    /** Wraps a freshly computed buffer without copying; only for stages in this package. */
    static AmplitudeGrid wrap(int rows, int cols, double[] cells) {
        return new AmplitudeGrid(rows, cols, cells);
    }

    private static int cellCount(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new InvalidArgumentException("Grid dimensions must be non-negative: " + rows + "x" + cols);
        }
        try {
            return Math.multiplyExact(rows, cols);
        } catch (ArithmeticException e) {
            throw new InvalidArgumentException("Grid " + rows + "x" + cols + " exceeds the maximum cell count");
        }
    }

    private static double sanitize(double v) {
        return Double.isFinite(v) ? v : 0.0;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public int size() {
        return cells.length;
    }

    public boolean isEmpty() {
        return cells.length == 0;
    }

    public double get(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            return 0.0;
        }
        return cells[row * cols + col];
    }

    /** Value at a flat row-major index. */
    public double getFlat(int index) {
        return cells[index];
    }

    public double min() {
        double min = Double.POSITIVE_INFINITY;
        for (double v : cells) {
            if (v < min)
                min = v;
        }
        return min;
    }

    public double max() {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : cells) {
            if (v > max)
                max = v;
        }
        return max;
    }

    public double[][] toArray() {
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(cells, r * cols, out[r], 0, cols);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AmplitudeGrid))
            return false;
        AmplitudeGrid other = (AmplitudeGrid) o;
        return rows == other.rows && cols == other.cols && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return "AmplitudeGrid[" + rows + "x" + cols + "]";
    }
}
