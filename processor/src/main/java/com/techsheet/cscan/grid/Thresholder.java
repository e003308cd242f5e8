package com.techsheet.cscan.grid;

/**
 * Binarizes a grid: 1.0 where {@code value > threshold} (strictly), else 0.0.
 */
public class Thresholder implements GridStage {

    private final double threshold;

    public Thresholder(double threshold) {
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public AmplitudeGrid apply(AmplitudeGrid grid) {
        double[] out = new double[grid.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = grid.getFlat(i) > threshold ? 1.0 : 0.0;
        }
        return AmplitudeGrid.wrap(grid.getRows(), grid.getCols(), out);
    }
}
