package com.techsheet.cscan.service;

import com.techsheet.cscan.config.ProcessorConfig;
import com.techsheet.cscan.config.ProcessorConfigLoader;
import com.techsheet.cscan.detection.Defect;
import com.techsheet.cscan.error.InvalidArgumentException;
import com.techsheet.cscan.error.ResourceException;
import com.techsheet.cscan.grid.AmplitudeGrid;
import com.techsheet.cscan.pipeline.CScanPipeline;
import com.techsheet.cscan.pipeline.ProcessingOptions;
import com.techsheet.cscan.pipeline.ScanAnalysis;
import com.techsheet.cscan.raster.RasterImage;
import com.techsheet.cscan.raster.RenderSurface;
import com.techsheet.cscan.synthetic.SyntheticDataGenerator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for the technique-sheet UI and report layers: colorized C-Scan images,
 * automatic defect lists and synthetic demo grids.
 */
@Service
public class CScanProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(CScanProcessingService.class);

    private final ProcessorConfig config;
    private final CScanPipeline pipeline = new CScanPipeline();
    private final ExecutorService analysisExecutor;
    private final AtomicInteger threadCounter = new AtomicInteger();

    public CScanProcessingService() {
        this(ProcessorConfigLoader.loadOrDefault());
    }

    public CScanProcessingService(ProcessorConfig config) {
        this.config = config.withDefaults();
        int threads = Math.max(1, this.config.analysisThreads);
        this.analysisExecutor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "cscan-analysis-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        logger.info("C-Scan processor ready: defaultOptions={}, syntheticSeed={}, analysisThreads={}",
                config.defaultOptions, config.synthetic.seed, config.analysisThreads);
    }

    @PreDestroy
    public void shutdown() {
        analysisExecutor.shutdownNow();
    }

    public ProcessorConfig getConfig() {
        return config;
    }

    ExecutorService getAnalysisExecutor() {
        return analysisExecutor;
    }

    /**
     * normalize -> smooth -> threshold -> colorize, as selected by {@code options}.
     */
    public RasterImage process(AmplitudeGrid grid, ProcessingOptions options) {
        return pipeline.process(grid, options);
    }

    public RasterImage processWithDefaults(AmplitudeGrid grid) {
        return pipeline.process(grid, config.defaultOptions);
    }

    /**
     * Flood-fill detection of above-threshold regions of at least
     * {@link com.techsheet.cscan.detection.DefectDetector#MIN_DEFECT_AREA} cells.
     *
     * @throws InvalidArgumentException if {@code threshold} is null
     */
    public List<Defect> detectDefects(AmplitudeGrid grid, Double threshold) {
        List<Defect> defects = pipeline.detectDefects(grid, threshold);
        logger.info("Detected {} defects in {} at threshold {}", defects.size(), grid, threshold);
        return defects;
    }

    public AmplitudeGrid generateSyntheticData(int rows, int cols) {
        return generateSyntheticData(rows, cols, config.synthetic.defectCount);
    }

    /**
     * Synthetic grid for demos; reproducible when a seed is configured.
     */
    public AmplitudeGrid generateSyntheticData(int rows, int cols, int defectCount) {
        Long seed = config.synthetic.seed;
        Random random = seed != null ? new Random(seed) : new Random();
        return new SyntheticDataGenerator(random).generateGrid(rows, cols, defectCount);
    }

    /**
     * Prepares the grid once, then colorizes it and detects defects on it in parallel.
     * Requires {@code options.threshold}; the image is binarized at that threshold and the
     * defects carry amplitudes of the prepared grid.
     */
    public ScanAnalysis analyze(AmplitudeGrid grid, ProcessingOptions options) {
        if (options == null || options.threshold == null) {
            throw new InvalidArgumentException("Analysis requires options with a threshold");
        }
        options.validate();
        AmplitudeGrid prepared = pipeline.prepare(grid, options);

        Future<RasterImage> image = analysisExecutor.submit(() -> pipeline.colorizePrepared(prepared, options));
        Future<List<Defect>> defects = analysisExecutor.submit(() -> pipeline.detectDefects(prepared, options.threshold));

        try {
            ScanAnalysis analysis = new ScanAnalysis(await(image), await(defects));
            logger.info("Analyzed {}: {} defects", grid, analysis.getDefects().size());
            return analysis;
        } finally {
            image.cancel(true);
            defects.cancel(true);
        }
    }

    /**
     * @throws ResourceException if no surface is available
     */
    public void renderTo(RasterImage image, RenderSurface surface) {
        if (surface == null) {
            throw new ResourceException("No drawable rendering surface available");
        }
        surface.draw(image);
    }

    private static <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for C-Scan analysis", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("C-Scan analysis failed", cause);
        }
    }
}
