package xyz.firestige.workload.domain.shared.vo;

/**
 * 工作负载类型
 */
public enum WorkloadKind {

    /**
     * 面向公网、负载均衡的 Web 服务
     */
    LOAD_BALANCED_WEB_SERVICE("Load Balanced Web Service"),

    /**
     * 请求驱动的 Web 服务
     */
    REQUEST_DRIVEN_WEB_SERVICE("Request-Driven Web Service"),

    /**
     * 后台 Worker 服务（订阅 Topic）
     */
    WORKER_SERVICE("Worker Service");

    private final String manifestType;

    WorkloadKind(String manifestType) {
        this.manifestType = manifestType;
    }

    /**
     * 清单中的类型名称
     */
    public String getManifestType() {
        return manifestType;
    }

    /**
     * 按清单类型名称解析
     *
     * @throws IllegalArgumentException 未知类型
     */
    public static WorkloadKind fromManifestType(String manifestType) {
        for (WorkloadKind kind : values()) {
            if (kind.manifestType.equals(manifestType)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("未知的工作负载类型: " + manifestType);
    }
}
