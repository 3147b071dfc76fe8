package xyz.firestige.workload.domain.stack;

import java.util.Map;

/**
 * 请求驱动 Web 服务配置段
 *
 * @param alias              http.alias，未设置时为空
 * @param customResourceUrls 自定义资源名称 → 上传后的 URL
 * @param serviceDiscovery   服务发现记录，未声明端口时为空
 */
public record RequestDrivenWebServiceSection(String alias, Map<String, String> customResourceUrls,
                                             String serviceDiscovery)
        implements StackExtension {

    public RequestDrivenWebServiceSection {
        customResourceUrls = Map.copyOf(customResourceUrls);
    }
}
