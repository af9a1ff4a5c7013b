package com.neuralroots.orchestrator.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowIdGeneratorTest {

    private static final Clock FROZEN = Clock.fixed(Instant.ofEpochMilli(1_768_716_000_000L), ZoneOffset.UTC);

    @Test
    @DisplayName("ids carry the clock millis and a zero-padded sequence")
    void format() {
        WorkflowIdGenerator generator = new WorkflowIdGenerator(FROZEN);
        assertEquals("wf-1768716000000-000001", generator.next());
        assertEquals("wf-1768716000000-000002", generator.next());
    }

    @Test
    @DisplayName("ids minted concurrently in the same millisecond are unique")
    void uniqueUnderConcurrency() throws InterruptedException {
        WorkflowIdGenerator generator = new WorkflowIdGenerator(FROZEN);
        Set<String> ids = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int t = 0; t < 8; t++) {
            pool.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    ids.add(generator.next());
                }
            });
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(8000, ids.size());
    }
}
