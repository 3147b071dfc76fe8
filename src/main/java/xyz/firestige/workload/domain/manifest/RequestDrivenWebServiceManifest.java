package xyz.firestige.workload.domain.manifest;

import jakarta.validation.constraints.NotBlank;
import xyz.firestige.workload.domain.shared.vo.WorkloadKind;

/**
 * 请求驱动 Web 服务清单
 *
 * @param name  服务名称
 * @param port  容器端口
 * @param alias http.alias，单个主机名，可为空
 */
public record RequestDrivenWebServiceManifest(
        @NotBlank(message = "服务名称不能为空") String name,
        Integer port,
        String alias) implements WorkloadManifest {

    @Override
    public WorkloadKind kind() {
        return WorkloadKind.REQUEST_DRIVEN_WEB_SERVICE;
    }

    public boolean hasAlias() {
        return alias != null && !alias.isBlank();
    }
}
