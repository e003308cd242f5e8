package com.techsheet.cscan.detection;

import java.util.Collections;
import java.util.List;

/**
 * Defects of one detection call plus a per-cell label buffer for overlays.
 * Label 0 is background (including regions discarded as noise); label n belongs to the
 * n-th defect in the list.
 */
public class DetectionResult {

    private final List<Defect> defects;
    private final int rows;
    private final int cols;
    private final int[] labels;

    public DetectionResult(List<Defect> defects, int rows, int cols, int[] labels) {
        this.defects = Collections.unmodifiableList(defects);
        this.rows = rows;
        this.cols = cols;
        this.labels = labels;
    }

    public List<Defect> getDefects() {
        return defects;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public int labelAt(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            return 0;
        }
        return labels[row * cols + col];
    }

    /** Returns the defect covering a cell, or null for background. */
    public Defect defectAt(int row, int col) {
        int label = labelAt(row, col);
        return label == 0 ? null : defects.get(label - 1);
    }
}
