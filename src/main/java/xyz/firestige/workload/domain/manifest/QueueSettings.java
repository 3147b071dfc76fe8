package xyz.firestige.workload.domain.manifest;

import java.time.Duration;

/**
 * 订阅队列的可选设置，原样传递给模板
 */
public record QueueSettings(Duration retention, Duration delay, Duration timeout) {

    public static QueueSettings defaults() {
        return new QueueSettings(null, null, null);
    }
}
