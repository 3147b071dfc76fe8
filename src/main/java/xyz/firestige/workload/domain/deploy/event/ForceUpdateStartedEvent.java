package xyz.firestige.workload.domain.deploy.event;

import xyz.firestige.workload.domain.shared.vo.WorkloadIdentity;

/**
 * 开始强制更新服务
 */
public class ForceUpdateStartedEvent extends WorkloadDeployEvent {

    public ForceUpdateStartedEvent(WorkloadIdentity identity) {
        super(identity);
        setMessage("强制更新服务 " + identity.name() + "，环境 " + identity.environment());
    }
}
