package com.techsheet.cscan.pipeline;

import com.techsheet.cscan.colormap.CScanColormap;
import com.techsheet.cscan.detection.Defect;
import com.techsheet.cscan.detection.DefectDetector;
import com.techsheet.cscan.error.InvalidArgumentException;
import com.techsheet.cscan.grid.AmplitudeGrid;
import com.techsheet.cscan.grid.GaussianSmoother;
import com.techsheet.cscan.grid.GridNormalizer;
import com.techsheet.cscan.grid.GridStage;
import com.techsheet.cscan.grid.Thresholder;
import com.techsheet.cscan.raster.Colorizer;
import com.techsheet.cscan.raster.RasterImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The C-Scan processing chain: normalize -> smooth -> threshold -> colorize, and
 * threshold -> flood-fill detection. Stateless; every call works on its own copies.
 */
public class CScanPipeline {

    private static final Logger logger = LoggerFactory.getLogger(CScanPipeline.class);

    private final GridNormalizer normalizer = new GridNormalizer();
    private final GaussianSmoother smoother = new GaussianSmoother();
    private final Colorizer colorizer = new Colorizer();
    private final DefectDetector detector = new DefectDetector();

    public RasterImage process(AmplitudeGrid grid, ProcessingOptions options) {
        CScanColormap colormap = checkedColormap(grid, options);

        AmplitudeGrid processed = runStages(grid, stagesFor(options, true));
        return colorizer.colorize(processed, options.width, options.height, colormap);
    }

    /**
     * Runs only the continuous stages (normalize, smooth) selected by {@code options}.
     */
    public AmplitudeGrid prepare(AmplitudeGrid grid, ProcessingOptions options) {
        if (grid == null || options == null) {
            throw new InvalidArgumentException("Grid and options must not be null");
        }
        return runStages(grid, stagesFor(options, false));
    }

    /**
     * Colorizes an already prepared grid, binarizing first when {@code options.threshold} is set.
     */
    public RasterImage colorizePrepared(AmplitudeGrid prepared, ProcessingOptions options) {
        CScanColormap colormap = checkedColormap(prepared, options);
        AmplitudeGrid source = options.threshold != null ? new Thresholder(options.threshold).apply(prepared) : prepared;
        return colorizer.colorize(source, options.width, options.height, colormap);
    }

    public List<Defect> detectDefects(AmplitudeGrid grid, Double threshold) {
        return detector.detect(grid, threshold);
    }

    public DefectDetector getDetector() {
        return detector;
    }

    private CScanColormap checkedColormap(AmplitudeGrid grid, ProcessingOptions options) {
        if (grid == null || options == null) {
            throw new InvalidArgumentException("Grid and options must not be null");
        }
        return options.validate();
    }

    private List<GridStage> stagesFor(ProcessingOptions options, boolean includeThreshold) {
        List<GridStage> stages = new ArrayList<>(3);
        if (options.normalize) {
            stages.add(normalizer);
        }
        if (options.smoothing) {
            stages.add(smoother);
        }
        if (includeThreshold && options.threshold != null) {
            stages.add(new Thresholder(options.threshold));
        }
        return stages;
    }

    private AmplitudeGrid runStages(AmplitudeGrid grid, List<GridStage> stages) {
        AmplitudeGrid current = grid;
        for (GridStage stage : stages) {
            current = stage.apply(current);
        }
        logger.debug("Ran {} stages over {}", stages.size(), grid);
        return current;
    }
}
