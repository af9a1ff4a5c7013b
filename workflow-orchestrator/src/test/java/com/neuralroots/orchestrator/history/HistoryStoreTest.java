package com.neuralroots.orchestrator.history;

import com.neuralroots.common.model.WorkflowRecord;
import com.neuralroots.common.model.WorkflowStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HistoryStoreTest {

    private static WorkflowRecord record(String id) {
        return new WorkflowRecord(id, null, null, null, null, null, null,
            WorkflowStatus.COMPLETED, Instant.EPOCH);
    }

    private static List<String> ids(List<WorkflowRecord> records) {
        return records.stream().map(WorkflowRecord::id).toList();
    }

    @Nested
    @DisplayName("capacity")
    class Capacity {

        @Test
        @DisplayName("capacity + 1 appends → size stays at capacity, oldest evicted")
        void evictsOldest() {
            HistoryStore store = new HistoryStore(3);
            for (int i = 1; i <= 4; i++) {
                store.append(record("wf-" + i));
            }

            assertEquals(3, store.size());
            assertEquals(List.of("wf-2", "wf-3", "wf-4"), ids(store.snapshot()));
            assertTrue(store.find("wf-1").isEmpty());
        }

        @Test
        @DisplayName("non-positive capacity is rejected")
        void invalidCapacity() {
            assertThrows(IllegalArgumentException.class, () -> new HistoryStore(0));
        }
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("recent() is most-recent-first and honours the limit")
        void recent() {
            HistoryStore store = new HistoryStore(10);
            store.append(record("a"));
            store.append(record("b"));
            store.append(record("c"));

            assertEquals(List.of("c", "b"), ids(store.recent(2)));
            assertEquals(List.of("c", "b", "a"), ids(store.recent(50)));
            assertTrue(store.recent(0).isEmpty());
        }

        @Test
        @DisplayName("snapshots are immutable and unaffected by later appends")
        void snapshotIsolation() {
            HistoryStore store = new HistoryStore(10);
            store.append(record("a"));
            List<WorkflowRecord> snapshot = store.snapshot();
            store.append(record("b"));

            assertEquals(1, snapshot.size());
            assertThrows(UnsupportedOperationException.class, () -> snapshot.add(record("x")));
        }

        @Test
        @DisplayName("find() locates a retained record by id")
        void find() {
            HistoryStore store = new HistoryStore(10);
            store.append(record("a"));
            assertEquals("a", store.find("a").orElseThrow().id());
            assertTrue(store.find("missing").isEmpty());
        }
    }

    @Test
    @DisplayName("concurrent appends never exceed capacity or lose the count")
    void concurrentAppends() throws InterruptedException {
        HistoryStore store = new HistoryStore(100);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            int thread = t;
            pool.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    store.append(record("wf-" + thread + "-" + i));
                    assertTrue(store.recent(5).size() <= 5);
                }
                done.countDown();
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(100, store.size());
        assertEquals(100, store.snapshot().size());
    }
}
