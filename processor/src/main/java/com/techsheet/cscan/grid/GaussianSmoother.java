package com.techsheet.cscan.grid;

/**
 * Single-pass 3x3 Gaussian blur with kernel [[1,2,1],[2,4,2],[1,2,1]] / 16.
 * Border cells (first/last row, first/last column) are copied unchanged; no padding.
 */
public class GaussianSmoother implements GridStage {

    private static final int[][] KERNEL = {
            { 1, 2, 1 },
            { 2, 4, 2 },
            { 1, 2, 1 }
    };
    private static final double KERNEL_SUM = 16.0;

    @Override
    public AmplitudeGrid apply(AmplitudeGrid grid) {
        int rows = grid.getRows();
        int cols = grid.getCols();
        double[] out = new double[rows * cols];

        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (r == 0 || r == rows - 1 || c == 0 || c == cols - 1) {
                    out[r * cols + c] = grid.get(r, c);
                    continue;
                }

                double sum = 0.0;
                for (int kr = -1; kr <= 1; kr++) {
                    for (int kc = -1; kc <= 1; kc++) {
                        sum += grid.get(r + kr, c + kc) * KERNEL[kr + 1][kc + 1];
                    }
                }
                out[r * cols + c] = sum / KERNEL_SUM;
            }
        }
        return AmplitudeGrid.wrap(rows, cols, out);
    }
}
