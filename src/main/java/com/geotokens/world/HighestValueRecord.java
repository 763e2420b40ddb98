package com.geotokens.world;

import java.util.logging.Logger;

/**
 * Monotonic maximum of every token value ever generated or produced by
 * doubling. Drives the one-shot win signal.
 */
public class HighestValueRecord {

    private static final Logger LOG = Logger.getLogger(HighestValueRecord.class.getName());

    private final int threshold;
    private final WorldListener listener;

    private int highest;
    private boolean thresholdFired;

    public HighestValueRecord(int threshold, WorldListener listener) {
        this.threshold = threshold;
        this.listener = listener;
    }

    /** Raise the record if {@code value} exceeds it. Never lowers it. */
    public void observe(int value) {
        if (value <= highest) return;
        highest = value;
        listener.onHighestValueChanged(value);
        if (!thresholdFired && highest >= threshold) {
            thresholdFired = true;
            LOG.info("Win threshold " + threshold + " reached with " + highest);
            listener.onThresholdReached();
        }
    }

    /**
     * Set the record from a saved session. A restored value already past the
     * threshold counts as fired, so loading a won game does not celebrate again.
     */
    public void restore(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Highest value must not be negative: " + value);
        }
        highest = value;
        thresholdFired = value >= threshold;
        listener.onHighestValueChanged(value);
    }

    public int get() { return highest; }


    public boolean isThresholdReached() { return thresholdFired; }
}
