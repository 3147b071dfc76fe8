package xyz.firestige.workload.exception;

import java.time.LocalDateTime;

/**
 * 失败信息封装类
 * 统一封装部署过程中的失败信息，供调用方渲染
 */
public class FailureInfo {

    /**
     * 错误码
     */
    private final String errorCode;

    /**
     * 错误消息
     */
    private final String errorMessage;

    /**
     * 错误类型
     */
    private final ErrorType errorType;

    /**
     * 失败位置（步骤名称）
     */
    private String failedAt;

    /**
     * 修复建议（可选）
     */
    private String remediation;

    /**
     * 失败时间
     */
    private final LocalDateTime timestamp;

    /**
     * 是否可重试
     */
    private boolean retryable;

    public FailureInfo(String errorCode, String errorMessage, ErrorType errorType) {
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.errorType = errorType;
        this.timestamp = LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        FailureInfo info = new FailureInfo(errorType.name(), errorMessage, errorType);
        info.setFailedAt(failedAt);
        return info;
    }

    // Getters and Setters

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(String failedAt) {
        this.failedAt = failedAt;
    }

    public String getRemediation() {
        return remediation;
    }

    public void setRemediation(String remediation) {
        this.remediation = remediation;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public void setRetryable(boolean retryable) {
        this.retryable = retryable;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorCode='" + errorCode + '\'' +
                ", errorMessage='" + errorMessage + '\'' +
                ", errorType=" + errorType +
                ", failedAt='" + failedAt + '\'' +
                ", timestamp=" + timestamp +
                ", retryable=" + retryable +
                '}';
    }
}
