package xyz.firestige.workload.exception;

/**
 * 部署后端失败，本层不重试
 */
public class ProvisioningException extends WorkloadDeployException {

    public ProvisioningException(String operation, Throwable cause) {
        super(describe(operation, cause), ErrorType.PROVISIONING_ERROR, cause);
        setFailedAt(operation);
    }
}
