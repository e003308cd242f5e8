package com.techsheet.cscan.raster;

import com.techsheet.cscan.error.InvalidArgumentException;

/**
 * width x height RGBA raster, 4 bytes per pixel in row-major order.
 * The caller owns the buffer once the image has been produced.
 */
public class RasterImage {

    private final int width;
    private final int height;
    private final byte[] rgba;

    public RasterImage(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        try {
            this.rgba = new byte[Math.multiplyExact(Math.multiplyExact(width, height), 4)];
        } catch (ArithmeticException e) {
            throw new InvalidArgumentException("Raster " + width + "x" + height + " exceeds the maximum buffer size");
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /** Direct access to the backing RGBA buffer. */
    public byte[] getRgba() {
        return rgba;
    }

    public void setPixel(int x, int y, int r, int g, int b, int a) {
        int index = (y * width + x) * 4;
        rgba[index] = (byte) r;
        rgba[index + 1] = (byte) g;
        rgba[index + 2] = (byte) b;
        rgba[index + 3] = (byte) a;
    }

    public int getRed(int x, int y) {
        return channel(x, y, 0);
    }

    public int getGreen(int x, int y) {
        return channel(x, y, 1);
    }

    public int getBlue(int x, int y) {
        return channel(x, y, 2);
    }

    public int getAlpha(int x, int y) {
        return channel(x, y, 3);
    }

    /** Pixel packed as 0xAARRGGBB, the layout {@link java.awt.image.BufferedImage#TYPE_INT_ARGB} expects. */
    public int getArgb(int x, int y) {
        return (getAlpha(x, y) << 24) | (getRed(x, y) << 16) | (getGreen(x, y) << 8) | getBlue(x, y);
    }

    private int channel(int x, int y, int offset) {
        return rgba[(y * width + x) * 4 + offset] & 0xff;
    }
}
