package xyz.firestige.workload.domain.deploy.event;

import xyz.firestige.workload.domain.shared.vo.WorkloadIdentity;

/**
 * 栈已提交给部署后端
 */
public class StackSubmittedEvent extends WorkloadDeployEvent {

    private final boolean changeSetEmpty;

    public StackSubmittedEvent(WorkloadIdentity identity, boolean changeSetEmpty) {
        super(identity);
        this.changeSetEmpty = changeSetEmpty;
        setMessage(changeSetEmpty
                ? "栈 " + identity.stackName() + " 无变更"
                : "栈 " + identity.stackName() + " 已提交");
    }

    public boolean isChangeSetEmpty() { return changeSetEmpty; }
}
