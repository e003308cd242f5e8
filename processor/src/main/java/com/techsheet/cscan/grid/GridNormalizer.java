package com.techsheet.cscan.grid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linearly rescales a grid so its minimum maps to 0.0 and its maximum to 1.0.
 * A constant (or empty) grid is returned as-is.
 */
public class GridNormalizer implements GridStage {

    private static final Logger logger = LoggerFactory.getLogger(GridNormalizer.class);

    @Override
    public AmplitudeGrid apply(AmplitudeGrid grid) {
        if (grid.isEmpty()) {
            return grid;
        }
        double min = grid.min();
        double max = grid.max();
        double range = max - min;

        if (range == 0.0) {
            logger.debug("Constant grid {} (value={}), skipping normalization", grid, min);
            return grid;
        }

        double[] out = new double[grid.size()];
        if (Double.isInfinite(range)) {
            // max - min overflowed; rescale on halved values
            double halfMin = min / 2;
            double halfRange = max / 2 - halfMin;
            for (int i = 0; i < out.length; i++) {
                out[i] = (grid.getFlat(i) / 2 - halfMin) / halfRange;
            }
        } else {
            for (int i = 0; i < out.length; i++) {
                out[i] = (grid.getFlat(i) - min) / range;
            }
        }
        logger.debug("Normalized {} from range [{}, {}]", grid, min, max);
        return AmplitudeGrid.wrap(grid.getRows(), grid.getCols(), out);
    }
}
