package com.techsheet.cscan.detection;

import com.techsheet.cscan.error.InvalidArgumentException;
import com.techsheet.cscan.grid.AmplitudeGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Automatic defect detection by connected-component labeling.
 *
 * Cells with {@code value > threshold} are grouped into 4-connected regions with an
 * iterative flood fill. The grid is scanned row-major and a fill is seeded at every
 * unvisited qualifying cell; regions smaller than {@link #MIN_DEFECT_AREA} are dropped as
 * noise. Defect IDs are DEF-001, DEF-002, ... in discovery order, so the output is fully
 * determined by the grid and the threshold.
 *
 * Instances hold no state between calls and can be shared across threads.
 */
public class DefectDetector {

    private static final Logger logger = LoggerFactory.getLogger(DefectDetector.class);

    public static final int MIN_DEFECT_AREA = 5;

    public List<Defect> detect(AmplitudeGrid grid, Double threshold) {
        return detectWithLabels(grid, threshold).getDefects();
    }

    public DetectionResult detectWithLabels(AmplitudeGrid grid, Double threshold) {
        if (grid == null) {
            throw new InvalidArgumentException("Grid must not be null");
        }
        if (threshold == null || threshold.isNaN()) {
            throw new InvalidArgumentException("Defect detection requires an explicit threshold");
        }

        Labeling labeling = new Labeling(grid, threshold);
        labeling.run();

        logger.debug("Detected {} defects in {} at threshold {} ({} regions below {} px discarded)",
                labeling.defects.size(), grid, threshold, labeling.discarded, MIN_DEFECT_AREA);
        return new DetectionResult(labeling.defects, grid.getRows(), grid.getCols(), labeling.labels);
    }

    /**
     * Working state of one detection call: visited and label buffers addressed by
     * {@code row * cols + col}, plus a reusable stack and region buffer.
     */
    private static final class Labeling {
        private final AmplitudeGrid grid;
        private final double threshold;
        private final int rows;
        private final int cols;

        private final boolean[] visited;
        private final int[] labels;
        private final List<Defect> defects = new ArrayList<>();
        private int discarded;

        private int[] stack = new int[64];
        private int top;
        private int[] region = new int[64];

        Labeling(AmplitudeGrid grid, double threshold) {
            this.grid = grid;
            this.threshold = threshold;
            this.rows = grid.getRows();
            this.cols = grid.getCols();
            this.visited = new boolean[rows * cols];
            this.labels = new int[rows * cols];
        }

        void run() {
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    int idx = y * cols + x;
                    if (!visited[idx] && grid.getFlat(idx) > threshold) {
                        fill(x, y);
                    }
                }
            }
        }

        private void fill(int startX, int startY) {
            int count = 0;
            double sumX = 0.0;
            double sumY = 0.0;
            double maxValue = Double.NEGATIVE_INFINITY;
            int minX = startX, maxX = startX, minY = startY, maxY = startY;

            top = 0;
            push(startY * cols + startX);

            while (top > 0) {
                int idx = stack[--top];
                if (visited[idx]) {
                    continue;
                }
                visited[idx] = true;

                double value = grid.getFlat(idx);
                if (!(value > threshold)) {
                    continue;
                }

                int cx = idx % cols;
                int cy = idx / cols;

                if (count == region.length) {
                    region = Arrays.copyOf(region, region.length * 2);
                }
                region[count++] = idx;
                sumX += cx;
                sumY += cy;
                maxValue = Math.max(maxValue, value);
                minX = Math.min(minX, cx);
                maxX = Math.max(maxX, cx);
                minY = Math.min(minY, cy);
                maxY = Math.max(maxY, cy);

                // 4-connectivity, pushed right, left, down, up
                if (cx + 1 < cols)
                    push(idx + 1);
                if (cx - 1 >= 0)
                    push(idx - 1);
                if (cy + 1 < rows)
                    push(idx + cols);
                if (cy - 1 >= 0)
                    push(idx - cols);
            }

            if (count < MIN_DEFECT_AREA) {
                discarded++;
                return;
            }

            int ordinal = defects.size() + 1;
            for (int i = 0; i < count; i++) {
                labels[region[i]] = ordinal;
            }
            defects.add(new Defect(
                    String.format("DEF-%03d", ordinal),
                    sumX / count,
                    sumY / count,
                    count,
                    maxValue,
                    new DefectBounds(minX, maxX, minY, maxY)));
        }

        private void push(int idx) {
            if (visited[idx]) {
                return;
            }
            if (top == stack.length) {
                stack = Arrays.copyOf(stack, stack.length * 2);
            }
            stack[top++] = idx;
        }
    }
}
