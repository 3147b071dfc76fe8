package xyz.firestige.workload.exception;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 部署基础异常类
 * 所有工作负载部署相关异常的基类
 * <p>
 * 每经过一层调用只包装一次，消息为 "操作: 原因"，原始异常作为 cause 保留。
 */
public class WorkloadDeployException extends RuntimeException {

    /**
     * 错误类型
     */
    private final ErrorType errorType;

    /**
     * 是否可重试
     */
    private boolean retryable;

    /**
     * 失败位置（步骤名称）
     */
    private String failedAt;

    /**
     * 上下文信息（workload / environment 等）
     */
    private final Map<String, Object> context = new HashMap<>();

    public WorkloadDeployException(String message, ErrorType errorType) {
        super(message);
        this.errorType = errorType;
    }

    public WorkloadDeployException(String message, ErrorType errorType, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    /**
     * 添加上下文信息
     */
    public WorkloadDeployException addContext(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    /**
     * 设置是否可重试
     */
    public WorkloadDeployException setRetryable(boolean retryable) {
        this.retryable = retryable;
        return this;
    }

    /**
     * 设置失败位置
     */
    public WorkloadDeployException setFailedAt(String failedAt) {
        this.failedAt = failedAt;
        return this;
    }

    /**
     * 转换为 FailureInfo
     */
    public FailureInfo toFailureInfo() {
        FailureInfo info = FailureInfo.of(errorType, getMessage(), failedAt);
        info.setRetryable(retryable);
        return info;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * "操作: 原因" 格式化，原因为空时退回异常类名
     */
    protected static String describe(String operation, Throwable cause) {
        if (cause == null) {
            return operation;
        }
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return operation + ": " + reason;
    }
}
