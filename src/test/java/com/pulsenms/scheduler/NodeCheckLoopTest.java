package com.pulsenms.scheduler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NodeCheckLoopTest
{

    private static final long ANCHOR = 1_700_000_000_000L;

    @Test
    void nextTickIsTheNextBoundaryAfterAnchor()
    {
        assertEquals(60_000, NodeCheckLoop.alignedDelayMs(ANCHOR, ANCHOR, 60));

        assertEquals(59_000, NodeCheckLoop.alignedDelayMs(ANCHOR, ANCHOR + 1_000, 60));

        assertEquals(1, NodeCheckLoop.alignedDelayMs(ANCHOR, ANCHOR + 59_999, 60));
    }

    @Test
    void slowCheckDoesNotDriftTheSchedule()
    {
        // A check that ended 2.5 intervals in lands on the third boundary
        assertEquals(5_000, NodeCheckLoop.alignedDelayMs(ANCHOR, ANCHOR + 25_000, 10));

        // Exactly on a boundary waits for the following one
        assertEquals(10_000, NodeCheckLoop.alignedDelayMs(ANCHOR, ANCHOR + 30_000, 10));
    }

    @Test
    void clockBeforeAnchorWaitsOneInterval()
    {
        assertEquals(15_000, NodeCheckLoop.alignedDelayMs(ANCHOR, ANCHOR - 5_000, 10));
    }

    @Test
    void retryDelayIsAThirdOfTheIntervalButAtLeastOneSecond()
    {
        assertEquals(20_000, NodeCheckLoop.retryDelayMs(60));

        assertEquals(1_000, NodeCheckLoop.retryDelayMs(2));

        assertEquals(1_000, NodeCheckLoop.retryDelayMs(3));
    }
}
