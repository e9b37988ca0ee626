package com.tmdbsync.common;

/**
 * Blocking pause used between retry attempts; replaced in tests to observe requested delays.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleep() {
        return Thread::sleep;
    }
}
