package com.techsheet.cscan.detection;

import java.util.Locale;
import java.util.Objects;

/**
 * A flaw candidate: one 4-connected region of above-threshold cells.
 */
public class Defect {

    private final String id;
    private final double centroidX;
    private final double centroidY;
    private final int area;
    private final double maxAmplitude;
    private final DefectBounds bounds;

    public Defect(String id, double centroidX, double centroidY, int area, double maxAmplitude,
            DefectBounds bounds) {
        this.id = id;
        this.centroidX = centroidX;
        this.centroidY = centroidY;
        this.area = area;
        this.maxAmplitude = maxAmplitude;
        this.bounds = bounds;
    }

    public String getId() {
        return id;
    }

    public double getCentroidX() {
        return centroidX;
    }

    public double getCentroidY() {
        return centroidY;
    }

    /** Pixel count. */
    public int getArea() {
        return area;
    }

    public double getMaxAmplitude() {
        return maxAmplitude;
    }

    public DefectBounds getBounds() {
        return bounds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Defect))
            return false;
        Defect that = (Defect) o;
        return area == that.area
                && Double.compare(centroidX, that.centroidX) == 0
                && Double.compare(centroidY, that.centroidY) == 0
                && Double.compare(maxAmplitude, that.maxAmplitude) == 0
                && id.equals(that.id)
                && bounds.equals(that.bounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, centroidX, centroidY, area, maxAmplitude, bounds);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s: area=%d, centroid=(%.2f, %.2f), maxAmplitude=%.4f, bounds=%s",
                id, area, centroidX, centroidY, maxAmplitude, bounds);
    }
}
