package xyz.firestige.workload.domain.deploy.event;

import xyz.firestige.workload.domain.shared.vo.WorkloadIdentity;

/**
 * 强制更新完成且服务已稳定
 */
public class ForceUpdateCompletedEvent extends WorkloadDeployEvent {

    private final int attempts;

    public ForceUpdateCompletedEvent(WorkloadIdentity identity, int attempts) {
        super(identity);
        this.attempts = attempts;
        setMessage("服务 " + identity.name() + " 已稳定，轮询次数: " + attempts);
    }

    public int getAttempts() { return attempts; }
}
