package xyz.firestige.workload.domain.shared.vo;

import java.util.Objects;

/**
 * 工作负载标识
 * 一次部署调用期间不可变
 */
public record WorkloadIdentity(String name, WorkloadKind kind, String application, String environment) {

    public WorkloadIdentity {
        Objects.requireNonNull(name, "workload name");
        Objects.requireNonNull(kind, "workload kind");
        Objects.requireNonNull(application, "application");
        Objects.requireNonNull(environment, "environment");
    }

    /**
     * 部署栈名称：app-env-workload
     */
    public String stackName() {
        return String.format("%s-%s-%s", application, environment, name);
    }
}
