package xyz.firestige.workload.exception;

/**
 * 部署后端报告变更集为空
 * 唯一可恢复的后端结果，驱动强制更新分支
 */
public class ChangeSetEmptyException extends WorkloadDeployException {

    private final String changeSetName;
    private final String stackName;

    public ChangeSetEmptyException(String changeSetName, String stackName) {
        super(String.format("change set with name %s for stack %s has no changes", changeSetName, stackName),
                ErrorType.PROVISIONING_ERROR);
        this.changeSetName = changeSetName;
        this.stackName = stackName;
    }

    public String getChangeSetName() {
        return changeSetName;
    }

    public String getStackName() {
        return stackName;
    }
}
