package xyz.firestige.workload.domain.discovery;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 服务发现解析器
 * <p>
 * 服务发现名称格式 service.app.local:port。
 * 聚合时按名称去重，名称相同的环境归为一组，即使环境名不同。
 */
public class ServiceDiscoveryResolver {

    private static final String FMT_DISCOVERY = "%s.%s.local:%s";

    public String resolveDiscovery(String service, String app, String port) {
        return String.format(FMT_DISCOVERY, service, app, port);
    }

    public String resolveDiscovery(String service, String app, int port) {
        return resolveDiscovery(service, app, String.valueOf(port));
    }

    /**
     * 按服务发现名称分组，组顺序与环境顺序均为首次出现顺序
     */
    public List<ServiceDiscoveryGroup> aggregate(List<EnvironmentDiscovery> discoveries) {
        Map<String, ServiceDiscoveryGroup> groups = new LinkedHashMap<>();
        if (discoveries == null) {
            return new ArrayList<>();
        }
        for (EnvironmentDiscovery d : discoveries) {
            String namespace = resolveDiscovery(d.service(), d.app(), d.port());
            groups.computeIfAbsent(namespace, ns -> new ServiceDiscoveryGroup(null, ns))
                    .addEnvironment(d.environment());
        }
        return new ArrayList<>(groups.values());
    }
}
