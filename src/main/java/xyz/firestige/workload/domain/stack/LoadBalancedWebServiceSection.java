package xyz.firestige.workload.domain.stack;

import java.util.List;

/**
 * 负载均衡 Web 服务配置段
 *
 * @param httpAliases      http.alias，保持声明顺序
 * @param nlbPort          NLB 端口，未启用时为空
 * @param nlbAliases       nlb.alias
 * @param publicCidrBlocks 环境公网入口网段，仅启用 NLB 时查询
 * @param serviceDiscovery 服务发现记录 svc.app.local:port，未声明端口时为空
 */
public record LoadBalancedWebServiceSection(
        List<String> httpAliases,
        String nlbPort,
        List<String> nlbAliases,
        List<String> publicCidrBlocks,
        String serviceDiscovery) implements StackExtension {

    public LoadBalancedWebServiceSection {
        httpAliases = List.copyOf(httpAliases);
        nlbAliases = List.copyOf(nlbAliases);
        publicCidrBlocks = List.copyOf(publicCidrBlocks);
    }
}
