package com.neal.snowchange.util;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * @author Neal
 */
public class StopWatchTest {

    @Test
    public void testToSecondsRoundsToNearest() {
        assertEquals(0, StopWatch.toSeconds(0));
        assertEquals(0, StopWatch.toSeconds(499_000_000L));
        assertEquals(1, StopWatch.toSeconds(501_000_000L));
        assertEquals(2, StopWatch.toSeconds(1_600_000_000L));
    }

    @Test
    public void testToSecondsRoundsTiesToEven() {
        assertEquals(0, StopWatch.toSeconds(500_000_000L));
        assertEquals(2, StopWatch.toSeconds(1_500_000_000L));
        assertEquals(2, StopWatch.toSeconds(2_500_000_000L));
    }

    @Test
    public void testElapsedIsMonotonic() {
        StopWatch stopWatch = new StopWatch();
        assertTrue(stopWatch.elapsed() >= 0);
        assertTrue(stopWatch.elapsedSeconds() >= 0);
    }
}
