package com.neuralroots.orchestrator.history;

import com.neuralroots.common.model.WorkflowRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity, append-only log of completed workflows. When full, the oldest record is evicted.
 *
 * <p>Appends and reads are serialized on a single monitor. Reads return immutable copies, so a
 * caller never observes the log while an append is in progress. {@link WorkflowRecord} is itself
 * immutable, so copying the list is enough.
 */
public class HistoryStore {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<WorkflowRecord> records;
    private final Object lock = new Object();

    public HistoryStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.records  = new ArrayDeque<>(Math.min(capacity, DEFAULT_CAPACITY));
    }

    public void append(WorkflowRecord record) {
        synchronized (lock) {
            if (records.size() == capacity) {
                records.removeFirst();
            }
            records.addLast(record);
        }
    }

    /** Up to {@code limit} records, most recent first. */
    public List<WorkflowRecord> recent(int limit) {
        if (limit <= 0) return List.of();
        synchronized (lock) {
            List<WorkflowRecord> out = new ArrayList<>(Math.min(limit, records.size()));
            Iterator<WorkflowRecord> it = records.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(it.next());
            }
            return List.copyOf(out);
        }
    }

    /** Every retained record, oldest first. */
    public List<WorkflowRecord> snapshot() {
        synchronized (lock) {
            return List.copyOf(records);
        }
    }

    public Optional<WorkflowRecord> find(String id) {
        synchronized (lock) {
            return records.stream().filter(r -> r.id().equals(id)).findFirst();
        }
    }

    public int size() {
        synchronized (lock) {
            return records.size();
        }
    }

    public int capacity() {
        return capacity;
    }
}
