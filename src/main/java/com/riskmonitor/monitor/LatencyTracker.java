package com.riskmonitor.monitor;

/**
 * Accumulates latency samples between two refresh cycles.
 */
class LatencyTracker {

    private double sum;
    private long count;

    synchronized void record(double millis) {
        sum += millis;
        count++;
    }

    /**
     * Returns the average of the samples recorded since the last drain and resets the
     * accumulator, or {@code fallback} if nothing was recorded.
     */
    synchronized double drainAverage(double fallback) {
        if (count == 0) {
            return fallback;
        }
        double average = sum / count;
        sum = 0;
        count = 0;
        return average;
    }
}
