package com.techsheet.cscan.raster;

import com.techsheet.cscan.colormap.CScanColormap;
import com.techsheet.cscan.grid.AmplitudeGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rasterizes an amplitude grid through a colormap at an arbitrary output resolution.
 * Sampling is nearest-neighbour: pixel (x, y) reads source cell
 * (floor(y / height * rows), floor(x / width * cols)).
 */
public class Colorizer {

    private static final Logger logger = LoggerFactory.getLogger(Colorizer.class);
    private static final int OPAQUE = 255;

    public RasterImage colorize(AmplitudeGrid grid, int width, int height, CScanColormap colormap) {
        RasterImage image = new RasterImage(width, height);
        int rows = grid.getRows();
        int cols = grid.getCols();

        for (int y = 0; y < height; y++) {
            int dataY = (int) Math.floor((double) y / height * rows);
            for (int x = 0; x < width; x++) {
                int dataX = (int) Math.floor((double) x / width * cols);
                int[] rgb = colormap.map(grid.get(dataY, dataX));
                image.setPixel(x, y, rgb[0], rgb[1], rgb[2], OPAQUE);
            }
        }

        logger.debug("Colorized {} to {}x{} using {}", grid, width, height, colormap.getColormapName());
        return image;
    }
}
