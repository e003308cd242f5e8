package com.techsheet.cscan.service;

import com.techsheet.cscan.config.ProcessorConfig;
import com.techsheet.cscan.detection.Defect;
import com.techsheet.cscan.error.ConfigurationException;
import com.techsheet.cscan.error.InvalidArgumentException;
import com.techsheet.cscan.error.ResourceException;
import com.techsheet.cscan.grid.AmplitudeGrid;
import com.techsheet.cscan.pipeline.CScanPipeline;
import com.techsheet.cscan.pipeline.ProcessingOptions;
import com.techsheet.cscan.pipeline.ScanAnalysis;
import com.techsheet.cscan.raster.BufferedImageSurface;
import com.techsheet.cscan.raster.RasterImage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class CScanProcessingServiceTest {

    private CScanProcessingService service;

    @BeforeEach
    public void setup() {
        ProcessorConfig config = ProcessorConfig.defaults();
        config.synthetic.seed = 31L;
        service = new CScanProcessingService(config);
        service.init();
    }

    @AfterEach
    public void teardown() {
        service.shutdown();
    }

    @Test
    public void testSyntheticDataIsReproducibleWithSeed() {
        AmplitudeGrid a = service.generateSyntheticData(60, 60);
        AmplitudeGrid b = service.generateSyntheticData(60, 60, 2);
        assertEquals(a, b);
    }

    @Test
    public void testDetectDefectsSingleBlob() {
        double[][] raw = new double[10][10];
        for (int r = 3; r <= 5; r++) {
            for (int c = 3; c <= 5; c++) {
                raw[r][c] = 0.9;
            }
        }
        List<Defect> defects = service.detectDefects(AmplitudeGrid.of(raw), 0.5);
        assertEquals(1, defects.size());
        assertEquals(9, defects.get(0).getArea());

        assertThrows(InvalidArgumentException.class, () -> service.detectDefects(AmplitudeGrid.of(raw), null));
    }

    @Test
    public void testProcessWithDefaults() {
        AmplitudeGrid grid = service.generateSyntheticData(40, 30);
        RasterImage image = service.processWithDefaults(grid);
        assertEquals(ProcessorConfig.DEFAULT_WIDTH, image.getWidth());
        assertEquals(ProcessorConfig.DEFAULT_HEIGHT, image.getHeight());
        assertEquals(255, image.getAlpha(0, 0));
    }

    @Test
    public void testAnalyzeMatchesSequentialCalls() {
        AmplitudeGrid grid = service.generateSyntheticData(96, 96, 4);
        ProcessingOptions options = ProcessingOptions.defaults(48, 48).withSmoothing(true).withThreshold(0.4);

        ScanAnalysis analysis = service.analyze(grid, options);

        CScanPipeline pipeline = new CScanPipeline();
        RasterImage expectedImage = service.process(grid, options);
        List<Defect> expectedDefects = pipeline.detectDefects(pipeline.prepare(grid, options), 0.4);

        assertArrayEquals(expectedImage.getRgba(), analysis.getImage().getRgba());
        assertEquals(expectedDefects, analysis.getDefects());
        assertFalse(analysis.getDefects().isEmpty());
    }

    @Test
    public void testAnalyzeErrors() {
        AmplitudeGrid grid = AmplitudeGrid.filled(4, 4, 0.3);
        assertThrows(InvalidArgumentException.class,
                () -> service.analyze(grid, ProcessingOptions.defaults(4, 4)));
        assertThrows(ConfigurationException.class,
                () -> service.analyze(grid, ProcessingOptions.defaults(4, 4).withThreshold(0.2).withColormap("sepia")));
    }

    @Test
    public void testRenderTo() {
        RasterImage image = service.process(AmplitudeGrid.filled(2, 2, 1.0),
                ProcessingOptions.defaults(3, 3).withColormap("grayscale").withNormalize(false));

        assertThrows(ResourceException.class, () -> service.renderTo(image, null));

        BufferedImage target = new BufferedImage(3, 3, BufferedImage.TYPE_INT_ARGB);
        service.renderTo(image, new BufferedImageSurface(target));
        assertEquals(0xffffffff, target.getRGB(2, 2));
    }

    @Test
    public void testAnalysisThreadsHaveDistinctNames() throws Exception {
        Set<String> names = ConcurrentHashMap.newKeySet();
        CountDownLatch bothRunning = new CountDownLatch(2);
        Runnable task = () -> {
            names.add(Thread.currentThread().getName());
            bothRunning.countDown();
            try {
                bothRunning.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        Future<?> first = service.getAnalysisExecutor().submit(task);
        Future<?> second = service.getAnalysisExecutor().submit(task);
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        assertEquals(Set.of("cscan-analysis-1", "cscan-analysis-2"), names);
    }
}
