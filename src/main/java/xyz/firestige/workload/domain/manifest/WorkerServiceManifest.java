package xyz.firestige.workload.domain.manifest;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import xyz.firestige.workload.domain.shared.vo.WorkloadKind;

import java.util.List;

/**
 * Worker 服务清单
 *
 * @param name          服务名称
 * @param subscriptions 订阅的 Topic 列表
 */
public record WorkerServiceManifest(
        @NotBlank(message = "服务名称不能为空") String name,
        List<@Valid TopicSubscription> subscriptions) implements WorkloadManifest {

    public WorkerServiceManifest {
        subscriptions = subscriptions == null ? List.of() : List.copyOf(subscriptions);
    }

    @Override
    public WorkloadKind kind() {
        return WorkloadKind.WORKER_SERVICE;
    }
}
