package xyz.firestige.workload.domain.manifest;

import jakarta.validation.constraints.NotBlank;
import xyz.firestige.workload.domain.shared.vo.WorkloadKind;

/**
 * 负载均衡 Web 服务清单
 *
 * @param name      服务名称
 * @param port      容器端口
 * @param httpAlias http.alias
 * @param nlb       NLB 配置
 */
public record LoadBalancedWebServiceManifest(
        @NotBlank(message = "服务名称不能为空") String name,
        Integer port,
        Alias httpAlias,
        NetworkLoadBalancerConfig nlb) implements WorkloadManifest {

    public LoadBalancedWebServiceManifest {
        httpAlias = httpAlias == null ? Alias.empty() : httpAlias;
        nlb = nlb == null ? NetworkLoadBalancerConfig.disabled() : nlb;
    }

    @Override
    public WorkloadKind kind() {
        return WorkloadKind.LOAD_BALANCED_WEB_SERVICE;
    }
}
