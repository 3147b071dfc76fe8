package xyz.firestige.workload.exception;

/**
 * 强制更新失败（非超时）
 */
public class ForceUpdateException extends WorkloadDeployException {

    private final String workload;

    public ForceUpdateException(String workload, Throwable cause) {
        super(describe("force an update for service " + workload, cause), ErrorType.PROVISIONING_ERROR, cause);
        this.workload = workload;
        addContext("workload", workload);
    }

    protected ForceUpdateException(String workload, String message, ErrorType errorType, Throwable cause) {
        super(message, errorType, cause);
        this.workload = workload;
        addContext("workload", workload);
    }

    public String getWorkload() {
        return workload;
    }
}
