package xyz.firestige.workload.exception;

/**
 * 调用方在等待服务稳定期间取消了部署
 */
public class DeployCancelledException extends WorkloadDeployException {

    public DeployCancelledException(String workload) {
        super(String.format("deployment of %s was cancelled while waiting for the service to stabilize", workload),
                ErrorType.CANCELLED);
        addContext("workload", workload);
    }
}
