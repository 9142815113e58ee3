package com.vgen.generation.client;

/** Blocking wait, replaceable in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
