package com.containerwatch.tracker.support;

import com.containerwatch.tracker.metrics.MetricsSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

public class RecordingMetricsSink implements MetricsSink {
    private final List<Sample> counters = new CopyOnWriteArrayList<>();
    private final List<Sample> observations = new CopyOnWriteArrayList<>();
    private final Map<String, Supplier<Number>> gauges = new ConcurrentHashMap<>();

    @Override
    public void increment(String name, Map<String, String> labels) {
        counters.add(new Sample(name, labels, 1));
    }

    @Override
    public void observe(String name, double value, Map<String, String> labels) {
        observations.add(new Sample(name, labels, value));
    }

    @Override
    public void gauge(String name, Supplier<Number> value) {
        gauges.put(name, value);
    }

    public long count(String name) {
        return counters.stream().filter(sample -> sample.name().equals(name)).count();
    }

    public long count(String name, String label, String value) {
        return counters.stream()
            .filter(sample -> sample.name().equals(name))
            .filter(sample -> value.equals(sample.labels().get(label)))
            .count();
    }

    public List<Sample> observations(String name) {
        List<Sample> matching = new ArrayList<>();
        for (Sample sample : observations) {
            if (sample.name().equals(name)) {
                matching.add(sample);
            }
        }
        return matching;
    }

    public Number gaugeValue(String name) {
        Supplier<Number> supplier = gauges.get(name);
        return supplier == null ? null : supplier.get();
    }

    public record Sample(String name, Map<String, String> labels, double value) {
    }
}
