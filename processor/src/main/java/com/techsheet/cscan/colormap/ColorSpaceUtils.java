package com.techsheet.cscan.colormap;

/**
 * Conversions between 8-bit sRGB and CIE L*a*b* (D65 reference white).
 */
public final class ColorSpaceUtils {

    // sRGB -> XYZ (D65)
    private static final double[][] RGB_TO_XYZ = {
            { 0.4124564, 0.3575761, 0.1804375 },
            { 0.2126729, 0.7151522, 0.0721750 },
            { 0.0193339, 0.1191920, 0.9503041 }
    };
    private static final double[][] XYZ_TO_RGB = {
            { 3.2404542, -1.5371385, -0.4985314 },
            { -0.9692660, 1.8760108, 0.0415560 },
            { 0.0556434, -0.2040259, 1.0572252 }
    };

    // Reference white taken from the matrix so that #FFFFFF maps to a* = b* = 0.
    private static final double XN = RGB_TO_XYZ[0][0] + RGB_TO_XYZ[0][1] + RGB_TO_XYZ[0][2];
    private static final double YN = RGB_TO_XYZ[1][0] + RGB_TO_XYZ[1][1] + RGB_TO_XYZ[1][2];
    private static final double ZN = RGB_TO_XYZ[2][0] + RGB_TO_XYZ[2][1] + RGB_TO_XYZ[2][2];

    private static final double DELTA = 6.0 / 29.0;
    private static final double DELTA_SQ_3 = 3.0 * DELTA * DELTA;
    private static final double DELTA_CUBE = DELTA * DELTA * DELTA;

    private ColorSpaceUtils() {
    }

    /**
     * @return {L*, a*, b*}
     */
    public static double[] srgbToLab(int r, int g, int b) {
        double lr = toLinear(r / 255.0);
        double lg = toLinear(g / 255.0);
        double lb = toLinear(b / 255.0);

        double x = RGB_TO_XYZ[0][0] * lr + RGB_TO_XYZ[0][1] * lg + RGB_TO_XYZ[0][2] * lb;
        double y = RGB_TO_XYZ[1][0] * lr + RGB_TO_XYZ[1][1] * lg + RGB_TO_XYZ[1][2] * lb;
        double z = RGB_TO_XYZ[2][0] * lr + RGB_TO_XYZ[2][1] * lg + RGB_TO_XYZ[2][2] * lb;

        double fx = labF(x / XN);
        double fy = labF(y / YN);
        double fz = labF(z / ZN);

        return new double[] { 116.0 * fy - 16.0, 500.0 * (fx - fy), 200.0 * (fy - fz) };
    }

    /**
     * @return {r, g, b}, each rounded and clamped to 0..255
     */
    public static int[] labToSrgb(double l, double a, double b) {
        double fy = (l + 16.0) / 116.0;
        double fx = fy + a / 500.0;
        double fz = fy - b / 200.0;

        double x = XN * labFInverse(fx);
        double y = YN * labFInverse(fy);
        double z = ZN * labFInverse(fz);

        double lr = XYZ_TO_RGB[0][0] * x + XYZ_TO_RGB[0][1] * y + XYZ_TO_RGB[0][2] * z;
        double lg = XYZ_TO_RGB[1][0] * x + XYZ_TO_RGB[1][1] * y + XYZ_TO_RGB[1][2] * z;
        double lb = XYZ_TO_RGB[2][0] * x + XYZ_TO_RGB[2][1] * y + XYZ_TO_RGB[2][2] * z;

        return new int[] { toChannel(lr), toChannel(lg), toChannel(lb) };
    }

    /** Parses {@code #RRGGBB} (leading '#' optional). */
    public static int[] parseHex(String hex) {
        String h = hex.startsWith("#") ? hex.substring(1) : hex;
        if (h.length() != 6) {
            throw new IllegalArgumentException("Expected #RRGGBB but got " + hex);
        }
        int rgb = Integer.parseInt(h, 16);
        return new int[] { (rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff };
    }

    private static double toLinear(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static int toChannel(double linear) {
        double c = linear <= 0.0031308 ? 12.92 * linear : 1.055 * Math.pow(linear, 1.0 / 2.4) - 0.055;
        long v = Math.round(c * 255.0);
        return (int) Math.max(0, Math.min(255, v));
    }

    private static double labF(double t) {
        return t > DELTA_CUBE ? Math.cbrt(t) : t / DELTA_SQ_3 + 4.0 / 29.0;
    }

    private static double labFInverse(double t) {
        return t > DELTA ? t * t * t : DELTA_SQ_3 * (t - 4.0 / 29.0);
    }
}
