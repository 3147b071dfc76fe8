package xyz.firestige.workload.domain.deploy.event;

import xyz.firestige.workload.domain.shared.vo.WorkloadIdentity;
import xyz.firestige.workload.exception.FailureInfo;

/**
 * 强制更新失败、超时或被取消
 */
public class ForceUpdateFailedEvent extends WorkloadDeployEvent {

    private final FailureInfo failureInfo;

    public ForceUpdateFailedEvent(WorkloadIdentity identity, FailureInfo failureInfo) {
        super(identity);
        this.failureInfo = failureInfo;
        setMessage("强制更新服务 " + identity.name() + " 失败: " + failureInfo.getErrorMessage());
    }

    public FailureInfo getFailureInfo() { return failureInfo; }
}
