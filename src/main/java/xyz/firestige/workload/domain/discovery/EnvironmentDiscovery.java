package xyz.firestige.workload.domain.discovery;

/**
 * 某个环境中服务的服务发现参数
 */
public record EnvironmentDiscovery(String environment, String service, String app, String port) {
}
