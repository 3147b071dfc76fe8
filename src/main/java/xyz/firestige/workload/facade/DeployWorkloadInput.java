package xyz.firestige.workload.facade;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import xyz.firestige.workload.domain.deploy.DeployOptions;
import xyz.firestige.workload.domain.environment.ApplicationInfo;
import xyz.firestige.workload.domain.environment.EnvironmentInfo;
import xyz.firestige.workload.domain.manifest.WorkloadManifest;
import xyz.firestige.workload.domain.stack.StackRuntimeConfiguration;

/**
 * deployWorkload 的入参
 *
 * @param manifest    工作负载清单
 * @param application 应用记录
 * @param environment 目标环境
 * @param artifacts   已上传产物的引用
 * @param options     部署选项，为空时使用默认值
 */
public record DeployWorkloadInput(
        @NotNull(message = "清单不能为空") @Valid WorkloadManifest manifest,
        @NotNull(message = "应用不能为空") @Valid ApplicationInfo application,
        @NotNull(message = "环境不能为空") @Valid EnvironmentInfo environment,
        @NotNull(message = "产物引用不能为空") StackRuntimeConfiguration artifacts,
        DeployOptions options) {

    public DeployWorkloadInput {
        options = options == null ? DeployOptions.defaults() : options;
    }
}
