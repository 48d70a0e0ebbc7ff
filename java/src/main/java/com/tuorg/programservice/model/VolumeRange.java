package com.tuorg.programservice.model;

/** Recommended weekly sets per muscle group. */
public class VolumeRange {

    private final int min;
    private final int max;

    public VolumeRange(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public int getMin() { return min; }
    public int getMax() { return max; }

    /** Deload bounds: both limits halved, rounding down. */
    public VolumeRange halved() {
        return new VolumeRange(min / 2, max / 2);
    }

    public boolean contains(int sets) {
        return sets >= min && sets <= max;
    }

    @Override
    public String toString() {
        return min + "-" + max;
    }
}
