package xyz.firestige.workload.metrics;

public interface MetricsRegistry {
    String SUBMITTED = "workload.deploy.submitted";
    String NO_CHANGES = "workload.deploy.no_changes";
    String FORCE_UPDATE = "workload.deploy.force_update";
    String FORCE_UPDATE_TIMEOUT = "workload.deploy.force_update.timeout";
    String FAILED = "workload.deploy.failed";

    void incrementCounter(String name);
    void setGauge(String name, double value);
}
