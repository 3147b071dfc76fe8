package xyz.firestige.workload.exception;

/**
 * 错误类型枚举
 * 用于区分部署过程中不同类别的错误，便于调用方分别呈现
 */
public enum ErrorType {

    /**
     * 清单校验错误（别名、域名、版本、订阅），调用方需修改清单
     */
    VALIDATION_ERROR("校验错误"),

    /**
     * 环境查询错误（CIDR、Topic 列表、服务发现端点）
     */
    ENVIRONMENT_QUERY_ERROR("环境查询错误"),

    /**
     * 部署后端错误
     */
    PROVISIONING_ERROR("部署后端错误"),

    /**
     * 强制更新后等待服务稳定超时
     */
    STABILITY_TIMEOUT("稳定等待超时"),

    /**
     * 调用方取消
     */
    CANCELLED("已取消"),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
