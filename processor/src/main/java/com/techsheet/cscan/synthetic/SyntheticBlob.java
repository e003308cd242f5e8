package com.techsheet.cscan.synthetic;

/**
 * Ground truth for one circular blob planted by {@link SyntheticDataGenerator}.
 */
public class SyntheticBlob {
    private final int centerX;
    private final int centerY;
    private final int radius;
    private final double amplitude;

    public SyntheticBlob(int centerX, int centerY, int radius, double amplitude) {
        this.centerX = centerX;
        this.centerY = centerY;
        this.radius = radius;
        this.amplitude = amplitude;
    }

    public int getCenterX() {
        return centerX;
    }

    public int getCenterY() {
        return centerY;
    }

    public int getRadius() {
        return radius;
    }

    public double getAmplitude() {
        return amplitude;
    }
}
