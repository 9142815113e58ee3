package com.vgen.generation.client;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestPacerTest {

    @Test
    void await_waitsForRemainderOfInterval() throws Exception {
        AtomicLong now = new AtomicLong(1_000);
        List<Long> sleeps = new ArrayList<>();
        RequestPacer pacer = new RequestPacer(2_000, now::get, millis -> {
            sleeps.add(millis);
            now.addAndGet(millis);
        });

        pacer.await();
        now.addAndGet(500);
        pacer.await();
        now.addAndGet(5_000);
        pacer.await();

        assertEquals(List.of(1_500L), sleeps);
    }

    @Test
    void await_zeroIntervalNeverSleeps() throws Exception {
        List<Long> sleeps = new ArrayList<>();
        RequestPacer pacer = new RequestPacer(0, () -> 0L, sleeps::add);
        pacer.await();
        pacer.await();
        assertTrue(sleeps.isEmpty());
    }
}
