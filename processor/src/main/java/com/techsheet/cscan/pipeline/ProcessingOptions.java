package com.techsheet.cscan.pipeline;

import com.techsheet.cscan.colormap.CScanColormap;
import com.techsheet.cscan.error.InvalidArgumentException;

/**
 * Options for turning an amplitude grid into an image. Bound from JSON by Jackson, so
 * fields are public and mutable; use {@link #copy()} before changing shared instances.
 */
public class ProcessingOptions {
    public int width;
    public int height;
    // null disables binarization
    public Double threshold = null;
    public boolean smoothing = false;
    public boolean normalize = true;
    public String colormap = "jet";

    public ProcessingOptions() {
    }

    public ProcessingOptions(int width, int height, Double threshold, boolean smoothing, boolean normalize,
            String colormap) {
        this.width = width;
        this.height = height;
        this.threshold = threshold;
        this.smoothing = smoothing;
        this.normalize = normalize;
        this.colormap = colormap;
    }

    public static ProcessingOptions defaults(int width, int height) {
        return new ProcessingOptions(width, height, null, false, true, "jet");
    }

    public ProcessingOptions copy() {
        return new ProcessingOptions(width, height, threshold, smoothing, normalize, colormap);
    }

    public ProcessingOptions withThreshold(Double threshold) {
        ProcessingOptions c = copy();
        c.threshold = threshold;
        return c;
    }

    public ProcessingOptions withSmoothing(boolean smoothing) {
        ProcessingOptions c = copy();
        c.smoothing = smoothing;
        return c;
    }

    public ProcessingOptions withNormalize(boolean normalize) {
        ProcessingOptions c = copy();
        c.normalize = normalize;
        return c;
    }

    public ProcessingOptions withColormap(String colormap) {
        ProcessingOptions c = copy();
        c.colormap = colormap;
        return c;
    }

    /**
     * Checks output size and resolves the colormap.
     *
     * @throws InvalidArgumentException for a non-positive width or height
     * @throws com.techsheet.cscan.error.ConfigurationException for an unknown colormap
     */
    public CScanColormap validate() {
        if (width <= 0 || height <= 0) {
            throw new InvalidArgumentException("Output size must be positive: " + width + "x" + height);
        }
        return CScanColormap.fromName(colormap);
    }

    @Override
    public String toString() {
        return "ProcessingOptions{" + width + "x" + height + ", threshold=" + threshold + ", smoothing=" + smoothing
                + ", normalize=" + normalize + ", colormap=" + colormap + "}";
    }
}
