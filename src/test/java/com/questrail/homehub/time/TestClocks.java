package com.questrail.homehub.time;

import java.time.Duration;

/**
 * A monotonic and a wall clock that move together, plus a scheduler driven by
 * the monotonic one.
 */
public final class TestClocks {

    public final ManualMonotonicClock monotonic = new ManualMonotonicClock();
    public final ManualWallClock wall = new ManualWallClock();
    public final DeterministicScheduler scheduler = new DeterministicScheduler(monotonic);

    /** Advance both clocks without running any scheduled task. */
    public void advance(Duration delta) {
        monotonic.advance(delta);
        wall.advance(delta);
    }

    /** Advance both clocks and run everything that became due. */
    public void advanceAndRun(Duration delta) {
        advance(delta);
        scheduler.runDueTasks();
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }
}
