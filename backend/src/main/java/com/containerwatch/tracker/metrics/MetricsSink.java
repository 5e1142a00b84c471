package com.containerwatch.tracker.metrics;

import java.util.Map;
import java.util.function.Supplier;

public interface MetricsSink {

    void increment(String name, Map<String, String> labels);

    void observe(String name, double value, Map<String, String> labels);

    void gauge(String name, Supplier<Number> value);

    default void increment(String name) {
        increment(name, Map.of());
    }
}
