package com.techsheet.cscan.grid;

/**
 * One step of the amplitude-grid pipeline. Implementations never mutate their input.
 */
public interface GridStage {

    AmplitudeGrid apply(AmplitudeGrid grid);
}
