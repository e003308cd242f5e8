package com.techsheet.cscan.raster;

import com.techsheet.cscan.error.ResourceException;

import java.awt.image.BufferedImage;

/**
 * Renders rasters into an AWT {@link BufferedImage}, drawn from the top-left corner.
 */
public class BufferedImageSurface implements RenderSurface {

    private final BufferedImage target;

    public BufferedImageSurface(BufferedImage target) {
        this.target = target;
    }

    /** Creates a surface backed by a new ARGB image sized for {@code image} and draws it. */
    public static BufferedImage render(RasterImage image) {
        BufferedImage bi = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        new BufferedImageSurface(bi).draw(image);
        return bi;
    }

    public BufferedImage getTarget() {
        return target;
    }

    @Override
    public void draw(RasterImage image) {
        if (target == null) {
            throw new ResourceException("Rendering surface has no backing image");
        }
        if (target.getWidth() < image.getWidth() || target.getHeight() < image.getHeight()) {
            throw new ResourceException("Rendering surface " + target.getWidth() + "x" + target.getHeight()
                    + " cannot hold a " + image.getWidth() + "x" + image.getHeight() + " raster");
        }
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                target.setRGB(x, y, image.getArgb(x, y));
            }
        }
    }
}
