package xyz.firestige.workload.exception;

/**
 * 环境查询失败（服务发现端点、公网 CIDR、Topic 列表、应用版本、自定义资源上传）
 * 环境级错误，直接终止本次部署
 */
public class EnvironmentQueryException extends WorkloadDeployException {

    private final String environment;

    public EnvironmentQueryException(String operation, String environment, Throwable cause) {
        super(describe(operation, cause), ErrorType.ENVIRONMENT_QUERY_ERROR, cause);
        this.environment = environment;
        addContext("environment", environment);
        setFailedAt(operation);
    }

    public String getEnvironment() {
        return environment;
    }
}
