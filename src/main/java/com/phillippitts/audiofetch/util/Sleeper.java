package com.phillippitts.audiofetch.util;

import java.time.Duration;

/**
 * Pauses the current thread. Injected wherever code backs off, so tests can run without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
