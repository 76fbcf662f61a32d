package com.lineage.sync.graph;

import java.time.Duration;

/**
 * Blocks the current thread. Replaced in tests to avoid real delays.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
}
