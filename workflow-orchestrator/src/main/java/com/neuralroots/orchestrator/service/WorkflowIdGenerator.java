package com.neuralroots.orchestrator.service;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues workflow ids of the form {@code wf-<epochMillis>-<sequence>}. The sequence is a
 * process-wide monotonically increasing counter, so two ids minted in the same millisecond
 * still differ.
 */
public class WorkflowIdGenerator {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public WorkflowIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        return String.format(Locale.ROOT, "wf-%d-%06d", clock.millis(), sequence.incrementAndGet());
    }
}
