package xyz.firestige.workload.exception;

/**
 * 强制更新后等待服务稳定超过重试预算
 * <p>
 * 与一般失败区分：部署可能仍在进行，调用方应提示用户在带外检查服务状态。
 */
public class StabilityTimeoutException extends ForceUpdateException {

    private final int maxAttempts;
    private String remediation;

    public StabilityTimeoutException(String workload, int maxAttempts) {
        this(workload, maxAttempts, null);
    }

    public StabilityTimeoutException(String workload, int maxAttempts, Throwable cause) {
        super(workload,
                String.format("force an update for service %s: max retries %d exceeded", workload, maxAttempts),
                ErrorType.STABILITY_TIMEOUT, cause);
        this.maxAttempts = maxAttempts;
        setRetryable(true);
    }

    /**
     * 附加修复建议
     */
    public StabilityTimeoutException withRemediation(String remediation) {
        this.remediation = remediation;
        return this;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public String getRemediation() {
        return remediation;
    }

    @Override
    public FailureInfo toFailureInfo() {
        FailureInfo info = super.toFailureInfo();
        info.setRemediation(remediation);
        return info;
    }
}
