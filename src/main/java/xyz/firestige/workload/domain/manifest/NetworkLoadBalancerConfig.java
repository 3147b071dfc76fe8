package xyz.firestige.workload.domain.manifest;

/**
 * NLB 配置
 *
 * @param port    监听端口，如 "443/tcp"；为空表示未启用 NLB
 * @param aliases NLB 别名
 */
public record NetworkLoadBalancerConfig(String port, Alias aliases) {

    public NetworkLoadBalancerConfig {
        aliases = aliases == null ? Alias.empty() : aliases;
    }

    public static NetworkLoadBalancerConfig disabled() {
        return new NetworkLoadBalancerConfig(null, Alias.empty());
    }

    public boolean isEnabled() {
        return port != null && !port.isBlank();
    }
}
