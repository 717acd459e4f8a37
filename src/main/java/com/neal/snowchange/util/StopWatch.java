package com.neal.snowchange.util;

/**
 * @author Neal
 * @date 2021/8/27
 */
public class StopWatch {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private long start;

    public StopWatch() {
        reset();
    }

    public void reset() {
        start = System.nanoTime();
    }

    public long elapsed() {
        long end = System.nanoTime();
        return end - start;
    }

    /**
     * elapsed wall-clock time, rounded to the nearest whole second, ties to even
     */
    public long elapsedSeconds() {
        return toSeconds(elapsed());
    }

    static long toSeconds(long nanos) {
        return (long) Math.rint((double) nanos / NANOS_PER_SECOND);
    }
}
