package xyz.firestige.workload.domain.stack;

import xyz.firestige.workload.domain.topic.ResolvedSubscription;

import java.util.List;

/**
 * Worker 服务配置段
 */
public record WorkerServiceSection(List<ResolvedSubscription> subscriptions) implements StackExtension {

    public WorkerServiceSection {
        subscriptions = List.copyOf(subscriptions);
    }
}
