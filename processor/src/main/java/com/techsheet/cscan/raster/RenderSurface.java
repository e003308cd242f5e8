package com.techsheet.cscan.raster;

/**
 * A drawable target (bitmap, canvas) that receives a finished raster.
 */
public interface RenderSurface {

    /**
     * @throws com.techsheet.cscan.error.ResourceException if the surface has no drawable context
     */
    void draw(RasterImage image);
}
