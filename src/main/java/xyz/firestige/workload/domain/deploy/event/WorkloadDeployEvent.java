package xyz.firestige.workload.domain.deploy.event;

import xyz.firestige.workload.domain.shared.event.DomainEvent;
import xyz.firestige.workload.domain.shared.vo.WorkloadIdentity;

/**
 * 部署事件基类，携带工作负载标识与栈名称
 */
public abstract class WorkloadDeployEvent extends DomainEvent {

    private final WorkloadIdentity identity;

    protected WorkloadDeployEvent(WorkloadIdentity identity) {
        super();
        this.identity = identity;
    }

    public WorkloadIdentity getIdentity() { return identity; }
    public String getStackName() { return identity.stackName(); }
}
