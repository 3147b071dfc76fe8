package xyz.firestige.workload.domain.deploy.event;

import xyz.firestige.workload.domain.deploy.DeployOutcome;
import xyz.firestige.workload.domain.shared.vo.WorkloadIdentity;

/**
 * 部署调用成功结束
 */
public class WorkloadDeployedEvent extends WorkloadDeployEvent {

    private final DeployOutcome outcome;

    public WorkloadDeployedEvent(WorkloadIdentity identity, DeployOutcome outcome) {
        super(identity);
        this.outcome = outcome;
        setMessage("工作负载 " + identity.name() + " 部署结束: " + outcome);
    }

    public DeployOutcome getOutcome() { return outcome; }
}
