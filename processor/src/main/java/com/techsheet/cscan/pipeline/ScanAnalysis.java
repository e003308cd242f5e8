package com.techsheet.cscan.pipeline;

import com.techsheet.cscan.detection.Defect;
import com.techsheet.cscan.raster.RasterImage;

import java.util.Collections;
import java.util.List;

/**
 * Image and defect list produced from the same processed grid.
 */
public class ScanAnalysis {
    private final RasterImage image;
    private final List<Defect> defects;

    public ScanAnalysis(RasterImage image, List<Defect> defects) {
        this.image = image;
        this.defects = Collections.unmodifiableList(defects);
    }

    public RasterImage getImage() {
        return image;
    }

    public List<Defect> getDefects() {
        return defects;
    }
}
