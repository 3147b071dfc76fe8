package xyz.firestige.workload.service.environment;

/**
 * 环境私有命名空间端点，如 env.app.local
 */
@FunctionalInterface
public interface ServiceDiscoveryEndpointGetter {

    String serviceDiscoveryEndpoint(String app, String env) throws Exception;
}
