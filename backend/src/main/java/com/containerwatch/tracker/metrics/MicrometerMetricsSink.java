package com.containerwatch.tracker.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Component
public class MicrometerMetricsSink implements MetricsSink {
    private final MeterRegistry registry;

    public MicrometerMetricsSink(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void increment(String name, Map<String, String> labels) {
        Counter.builder(name)
            .tags(tags(labels))
            .register(registry)
            .increment();
    }

    @Override
    public void observe(String name, double value, Map<String, String> labels) {
        DistributionSummary.builder(name)
            .baseUnit("seconds")
            .publishPercentileHistogram()
            .tags(tags(labels))
            .register(registry)
            .record(value);
    }

    @Override
    public void gauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value).register(registry);
    }

    private List<Tag> tags(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return List.of();
        }
        List<Tag> tags = new ArrayList<>(labels.size());
        labels.forEach((key, value) -> tags.add(Tag.of(key, value == null ? "none" : value)));
        return tags;
    }
}
