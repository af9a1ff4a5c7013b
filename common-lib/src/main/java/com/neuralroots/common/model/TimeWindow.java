package com.neuralroots.common.model;

import java.time.Duration;
import java.time.Instant;

public record TimeWindow(Instant start, Instant end) {

    public static TimeWindow lookback(Instant now, Duration length) {
        return new TimeWindow(now.minus(length), now);
    }

    public static TimeWindow ahead(Instant now, Duration length) {
        return new TimeWindow(now, now.plus(length));
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}
