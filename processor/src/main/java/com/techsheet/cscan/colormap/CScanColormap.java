package com.techsheet.cscan.colormap;

import com.techsheet.cscan.error.ConfigurationException;

import java.util.Locale;

/**
 * Named colormaps for C-Scan amplitude display. Each maps a scalar in [0,1] to sRGB by
 * interpolating its evenly spaced control colors in CIE L*a*b*, so equal scalar steps give
 * perceptually even color steps.
 */
public enum CScanColormap {

    JET("jet", "#000083", "#0000FF", "#00FFFF", "#FFFF00", "#FF0000", "#830000"),
    VIRIDIS("viridis", "#440154", "#414487", "#2a788e", "#22a884", "#7ad151", "#fde725"),
    GRAYSCALE("grayscale", "#000000", "#FFFFFF"),
    THERMAL("thermal", "#000000", "#4B0082", "#FF0000", "#FFFF00", "#FFFFFF");

    private final String colormapName;
    private final int[][] stopsRgb;
    private final double[][] stopsLab;

    CScanColormap(String colormapName, String... hexStops) {
        this.colormapName = colormapName;
        this.stopsRgb = new int[hexStops.length][];
        this.stopsLab = new double[hexStops.length][];
        for (int i = 0; i < hexStops.length; i++) {
            stopsRgb[i] = ColorSpaceUtils.parseHex(hexStops[i]);
            stopsLab[i] = ColorSpaceUtils.srgbToLab(stopsRgb[i][0], stopsRgb[i][1], stopsRgb[i][2]);
        }
    }

    /**
     * Resolves a colormap by its name, ignoring case and surrounding whitespace.
     *
     * @throws ConfigurationException if the name is null or not a known colormap
     */
    public static CScanColormap fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (CScanColormap cm : values()) {
                if (cm.colormapName.equals(key)) {
                    return cm;
                }
            }
        }
        throw new ConfigurationException("Unknown colormap '" + name + "'; expected one of jet, viridis, grayscale, thermal");
    }

    public String getColormapName() {
        return colormapName;
    }

    public int getStopCount() {
        return stopsRgb.length;
    }

    /**
     * Maps a scalar to {r, g, b}. Values are clamped to [0,1]; NaN reads as 0.
     */
    public int[] map(double value) {
        double t = Double.isNaN(value) ? 0.0 : Math.max(0.0, Math.min(1.0, value));
        int segments = stopsRgb.length - 1;
        double pos = t * segments;
        int i = (int) Math.floor(pos);
        if (i >= segments) {
            return stopsRgb[segments].clone();
        }
        double f = pos - i;
        if (f == 0.0) {
            return stopsRgb[i].clone();
        }

        double[] from = stopsLab[i];
        double[] to = stopsLab[i + 1];
        return ColorSpaceUtils.labToSrgb(
                from[0] + (to[0] - from[0]) * f,
                from[1] + (to[1] - from[1]) * f,
                from[2] + (to[2] - from[2]) * f);
    }
}
