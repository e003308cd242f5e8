package com.techsheet.cscan.config;

import com.techsheet.cscan.pipeline.ProcessingOptions;
import com.techsheet.cscan.synthetic.SyntheticDataGenerator;

/**
 * Root of {@code cscan_config.json}.
 */
public class ProcessorConfig {

    public static final int DEFAULT_WIDTH = 512;
    public static final int DEFAULT_HEIGHT = 512;
    public static final int DEFAULT_ANALYSIS_THREADS = 2;

    public ProcessingOptions defaultOptions;
    public SyntheticConfig synthetic;
    public Integer analysisThreads;

    public static class SyntheticConfig {
        // null means an unseeded generator
        public Long seed;
        public Integer defectCount;
    }

    public static ProcessorConfig defaults() {
        ProcessorConfig cfg = new ProcessorConfig();
        cfg.defaultOptions = ProcessingOptions.defaults(DEFAULT_WIDTH, DEFAULT_HEIGHT);
        cfg.synthetic = new SyntheticConfig();
        cfg.synthetic.defectCount = SyntheticDataGenerator.DEFAULT_DEFECT_COUNT;
        cfg.analysisThreads = DEFAULT_ANALYSIS_THREADS;
        return cfg;
    }

    /** Fills unset sections from {@link #defaults()}. */
    public ProcessorConfig withDefaults() {
        ProcessorConfig d = defaults();
        if (defaultOptions == null) {
            defaultOptions = d.defaultOptions;
        }
        if (synthetic == null) {
            synthetic = d.synthetic;
        } else if (synthetic.defectCount == null) {
            synthetic.defectCount = d.synthetic.defectCount;
        }
        if (analysisThreads == null) {
            analysisThreads = d.analysisThreads;
        }
        return this;
    }
}
