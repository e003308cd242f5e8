package com.techsheet.cscan.synthetic;

import com.techsheet.cscan.error.InvalidArgumentException;
import com.techsheet.cscan.grid.AmplitudeGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds synthetic C-Scan grids for tests and demos: uniform background noise in
 * [0, 0.2) with circular blobs whose amplitude decays linearly from the centre,
 * {@code amplitude * (1 - distance / radius)}.
 *
 * All randomness comes from the injected {@link Random}; the same seed yields the same grid.
 */
public class SyntheticDataGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SyntheticDataGenerator.class);

    public static final int DEFAULT_DEFECT_COUNT = 2;

    private static final double NOISE_LEVEL = 0.2;
    private static final int MIN_RADIUS = 5;
    private static final int RADIUS_SPREAD = 10;
    private static final double MIN_AMPLITUDE = 0.6;
    private static final double AMPLITUDE_SPREAD = 0.4;

    private final Random random;

    public SyntheticDataGenerator(Random random) {
        if (random == null) {
            throw new InvalidArgumentException("Random source must not be null");
        }
        this.random = random;
    }

    public static SyntheticDataGenerator seeded(long seed) {
        return new SyntheticDataGenerator(new Random(seed));
    }

    public AmplitudeGrid generateGrid(int rows, int cols, int defectCount) {
        return generate(rows, cols, defectCount).getGrid();
    }

    public SyntheticScan generate(int rows, int cols, int defectCount) {
        if (rows <= 0 || cols <= 0) {
            throw new InvalidArgumentException("Synthetic grid dimensions must be positive: " + rows + "x" + cols);
        }
        if (defectCount < 0) {
            throw new InvalidArgumentException("defectCount must not be negative: " + defectCount);
        }

        double[] cells = new double[rows * cols];
        for (int i = 0; i < cells.length; i++) {
            cells[i] = random.nextDouble() * NOISE_LEVEL;
        }

        List<SyntheticBlob> blobs = new ArrayList<>(defectCount);
        for (int i = 0; i < defectCount; i++) {
            int centerX = (int) Math.floor(random.nextDouble() * cols);
            int centerY = (int) Math.floor(random.nextDouble() * rows);
            int radius = MIN_RADIUS + (int) Math.floor(random.nextDouble() * RADIUS_SPREAD);
            double amplitude = MIN_AMPLITUDE + random.nextDouble() * AMPLITUDE_SPREAD;

            for (int y = Math.max(0, centerY - radius); y < Math.min(rows, centerY + radius); y++) {
                for (int x = Math.max(0, centerX - radius); x < Math.min(cols, centerX + radius); x++) {
                    double distance = Math.sqrt((x - centerX) * (x - centerX) + (y - centerY) * (y - centerY));
                    if (distance < radius) {
                        cells[y * cols + x] = amplitude * (1 - distance / radius);
                    }
                }
            }
            blobs.add(new SyntheticBlob(centerX, centerY, radius, amplitude));
        }

        logger.debug("Generated synthetic {}x{} grid with {} blobs", rows, cols, defectCount);
        return new SyntheticScan(AmplitudeGrid.fromFlat(rows, cols, cells), blobs);
    }
}
