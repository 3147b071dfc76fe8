package xyz.firestige.workload.exception;

/**
 * 部署期间上传服务专属资源失败，终止部署
 */
public class ArtifactUploadException extends WorkloadDeployException {

    public ArtifactUploadException(String operation, Throwable cause) {
        super(describe(operation, cause), ErrorType.SYSTEM_ERROR, cause);
        setFailedAt(operation);
    }
}
