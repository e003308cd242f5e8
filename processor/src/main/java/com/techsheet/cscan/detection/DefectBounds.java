package com.techsheet.cscan.detection;

import java.util.Objects;

/**
 * Inclusive bounding box of a defect in grid coordinates (x = column, y = row).
 */
public class DefectBounds {
    private final int minX;
    private final int maxX;
    private final int minY;
    private final int maxY;

    public DefectBounds(int minX, int maxX, int minY, int maxY) {
        this.minX = minX;
        this.maxX = maxX;
        this.minY = minY;
        this.maxY = maxY;
    }

    public int getMinX() {
        return minX;
    }

    public int getMaxX() {
        return maxX;
    }

    public int getMinY() {
        return minY;
    }

    public int getMaxY() {
        return maxY;
    }

    public int getWidth() {
        return maxX - minX + 1;
    }

    public int getHeight() {
        return maxY - minY + 1;
    }

    public boolean contains(int x, int y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DefectBounds))
            return false;
        DefectBounds that = (DefectBounds) o;
        return minX == that.minX && maxX == that.maxX && minY == that.minY && maxY == that.maxY;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minX, maxX, minY, maxY);
    }

    @Override
    public String toString() {
        return "[x " + minX + ".." + maxX + ", y " + minY + ".." + maxY + "]";
    }
}
