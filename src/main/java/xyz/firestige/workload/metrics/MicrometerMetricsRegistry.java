package xyz.firestige.workload.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class MicrometerMetricsRegistry implements MetricsRegistry {
    private final MeterRegistry registry;
    private final ConcurrentMap<String, DoubleHolder> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) { this.registry = registry; }

    @Override
    public void incrementCounter(String name) { registry.counter(name).increment(); }

    /**
     * 首次设置时注册 gauge，之后只更新持有的值
     */
    @Override
    public void setGauge(String name, double value) {
        gauges.computeIfAbsent(name, n -> registry.gauge(n, new DoubleHolder(), DoubleHolder::get)).set(value);
    }

    static class DoubleHolder {
        private volatile double v;
        double get() { return v; }
        void set(double v) { this.v = v; }
    }
}
