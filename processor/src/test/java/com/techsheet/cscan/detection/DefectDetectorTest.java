package com.techsheet.cscan.detection;

import com.techsheet.cscan.error.InvalidArgumentException;
import com.techsheet.cscan.grid.AmplitudeGrid;
import com.techsheet.cscan.synthetic.SyntheticDataGenerator;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DefectDetectorTest {

    private final DefectDetector detector = new DefectDetector();

    private static double[][] block(double[][] raw, int row0, int col0, int size, double value) {
        for (int r = row0; r < row0 + size; r++) {
            for (int c = col0; c < col0 + size; c++) {
                raw[r][c] = value;
            }
        }
        return raw;
    }

    @Test
    public void testSingleBlob() {
        double[][] raw = block(new double[10][10], 3, 3, 3, 0.9);
        List<Defect> defects = detector.detect(AmplitudeGrid.of(raw), 0.5);

        assertEquals(1, defects.size());
        Defect d = defects.get(0);
        assertEquals("DEF-001", d.getId());
        assertEquals(9, d.getArea());
        assertEquals(4.0, d.getCentroidX(), 1e-12);
        assertEquals(4.0, d.getCentroidY(), 1e-12);
        assertEquals(0.9, d.getMaxAmplitude());
        assertEquals(new DefectBounds(3, 5, 3, 5), d.getBounds());
    }

    @Test
    public void testIsolatedCellIsNoise() {
        double[][] raw = new double[8][8];
        raw[4][4] = 1.0;
        assertTrue(detector.detect(AmplitudeGrid.of(raw), 0.5).isEmpty());
    }

    @Test
    public void testMinimumAreaBoundary() {
        // plus shape: 5 cells
        double[][] plus = new double[7][7];
        plus[3][3] = plus[2][3] = plus[4][3] = plus[3][2] = plus[3][4] = 0.8;
        List<Defect> defects = detector.detect(AmplitudeGrid.of(plus), 0.5);
        assertEquals(1, defects.size());
        assertEquals(5, defects.get(0).getArea());

        // 2x2 square: 4 cells
        double[][] square = block(new double[6][6], 1, 1, 2, 0.8);
        assertTrue(detector.detect(AmplitudeGrid.of(square), 0.5).isEmpty());
    }

    @Test
    public void testDiagonalCellsAreNotConnected() {
        double[][] raw = new double[6][6];
        for (int i = 0; i < 6; i++) {
            raw[i][i] = 1.0;
        }
        assertTrue(detector.detect(AmplitudeGrid.of(raw), 0.5).isEmpty());
    }

    @Test
    public void testTwoBlobsInRowMajorOrder() {
        // the lower-left blob starts on row 6; the upper-right blob on row 1 is found first
        double[][] raw = new double[10][10];
        block(raw, 6, 0, 3, 0.7);
        block(raw, 1, 6, 3, 0.95);

        List<Defect> defects = detector.detect(AmplitudeGrid.of(raw), 0.5);

        assertEquals(2, defects.size());
        assertEquals("DEF-001", defects.get(0).getId());
        assertEquals("DEF-002", defects.get(1).getId());
        assertEquals(9, defects.get(0).getArea());
        assertEquals(9, defects.get(1).getArea());
        assertEquals(7.0, defects.get(0).getCentroidX(), 1e-12);
        assertEquals(2.0, defects.get(0).getCentroidY(), 1e-12);
        assertEquals(0.95, defects.get(0).getMaxAmplitude());
        assertEquals(1.0, defects.get(1).getCentroidX(), 1e-12);
        assertEquals(0.7, defects.get(1).getMaxAmplitude());
    }

    @Test
    public void testThresholdIsStrict() {
        double[][] raw = block(new double[5][5], 1, 1, 3, 0.5);
        assertTrue(detector.detect(AmplitudeGrid.of(raw), 0.5).isEmpty());
        assertEquals(1, detector.detect(AmplitudeGrid.of(raw), 0.49).size());
    }

    @Test
    public void testConcaveRegionIsOneDefect() {
        // U shape, connected only through the bottom row
        double[][] raw = new double[6][5];
        for (int r = 0; r < 5; r++) {
            raw[r][0] = 1.0;
            raw[r][4] = 1.0;
        }
        for (int c = 0; c < 5; c++) {
            raw[4][c] = 1.0;
        }
        List<Defect> defects = detector.detect(AmplitudeGrid.of(raw), 0.5);
        assertEquals(1, defects.size());
        assertEquals(13, defects.get(0).getArea());
        assertEquals(new DefectBounds(0, 4, 0, 4), defects.get(0).getBounds());
    }

    @Test
    public void testLargeRegionDoesNotOverflow() {
        AmplitudeGrid grid = AmplitudeGrid.filled(600, 600, 1.0);
        List<Defect> defects = detector.detect(grid, 0.5);
        assertEquals(1, defects.size());
        assertEquals(360000, defects.get(0).getArea());
    }

    @Test
    public void testMissingThreshold() {
        AmplitudeGrid grid = AmplitudeGrid.filled(3, 3, 1.0);
        assertThrows(InvalidArgumentException.class, () -> detector.detect(grid, null));
        assertThrows(InvalidArgumentException.class, () -> detector.detect(grid, Double.NaN));
        assertThrows(InvalidArgumentException.class, () -> detector.detect(null, 0.5));
    }

    @Test
    public void testDeterministicAcrossRuns() {
        AmplitudeGrid grid = SyntheticDataGenerator.seeded(7L).generateGrid(80, 80, 5);
        List<Defect> first = detector.detect(grid, 0.3);
        List<Defect> second = detector.detect(grid, 0.3);
        List<Defect> fresh = new DefectDetector().detect(grid, 0.3);

        assertFalse(first.isEmpty());
        assertEquals(first, second);
        assertEquals(first, fresh);
    }

    @Test
    public void testLabelsPartitionQualifyingCells() {
        AmplitudeGrid grid = SyntheticDataGenerator.seeded(42L).generateGrid(64, 64, 6);
        double threshold = 0.35;
        DetectionResult result = detector.detectWithLabels(grid, threshold);
        List<Defect> defects = result.getDefects();

        int[] labeledPerDefect = new int[defects.size() + 1];
        for (int r = 0; r < 64; r++) {
            for (int c = 0; c < 64; c++) {
                int label = result.labelAt(r, c);
                boolean qualifies = grid.get(r, c) > threshold;
                if (label > 0) {
                    assertTrue(qualifies, "labeled cell below threshold at " + r + "," + c);
                    assertTrue(defects.get(label - 1).getBounds().contains(c, r));
                    assertSame(defects.get(label - 1), result.defectAt(r, c));
                    labeledPerDefect[label]++;
                } else if (qualifies) {
                    assertTrue(componentSize(grid, threshold, r, c) < DefectDetector.MIN_DEFECT_AREA,
                            "qualifying cell omitted at " + r + "," + c);
                }
            }
        }
        for (int i = 0; i < defects.size(); i++) {
            assertEquals(defects.get(i).getArea(), labeledPerDefect[i + 1]);
        }
    }

    private static int componentSize(AmplitudeGrid grid, double threshold, int row, int col) {
        boolean[][] seen = new boolean[grid.getRows()][grid.getCols()];
        Deque<int[]> queue = new ArrayDeque<>();
        queue.add(new int[] { row, col });
        seen[row][col] = true;
        int size = 0;
        int[][] steps = { { 0, 1 }, { 0, -1 }, { 1, 0 }, { -1, 0 } };
        while (!queue.isEmpty()) {
            int[] cell = queue.poll();
            size++;
            for (int[] s : steps) {
                int r = cell[0] + s[0];
                int c = cell[1] + s[1];
                if (r >= 0 && r < grid.getRows() && c >= 0 && c < grid.getCols() && !seen[r][c]
                        && grid.get(r, c) > threshold) {
                    seen[r][c] = true;
                    queue.add(new int[] { r, c });
                }
            }
        }
        return size;
    }
}
