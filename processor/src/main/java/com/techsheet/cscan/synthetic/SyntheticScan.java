package com.techsheet.cscan.synthetic;

import com.techsheet.cscan.grid.AmplitudeGrid;

import java.util.Collections;
import java.util.List;

public class SyntheticScan {
    private final AmplitudeGrid grid;
    private final List<SyntheticBlob> blobs;

    public SyntheticScan(AmplitudeGrid grid, List<SyntheticBlob> blobs) {
        this.grid = grid;
        this.blobs = Collections.unmodifiableList(blobs);
    }

    public AmplitudeGrid getGrid() {
        return grid;
    }

    /** Blobs in the order they were drawn; later blobs overwrite earlier ones where they overlap. */
    public List<SyntheticBlob> getBlobs() {
        return blobs;
    }
}
