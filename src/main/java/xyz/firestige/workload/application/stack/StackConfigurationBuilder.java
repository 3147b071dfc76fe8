package xyz.firestige.workload.application.stack;

import xyz.firestige.workload.domain.deploy.DeployOptions;
import xyz.firestige.workload.domain.shared.vo.WorkloadKind;
import xyz.firestige.workload.domain.stack.StackConfiguration;
import xyz.firestige.workload.domain.stack.StackRuntimeConfiguration;

/**
 * 部署栈配置构建器，每种工作负载类型一个实现
 */
public interface StackConfigurationBuilder {

    WorkloadKind kind();

    /**
     * 由清单、环境和已上传产物组装配置
     * <p>
     * 任一步骤失败都不会返回部分配置。
     */
    StackConfiguration stackConfiguration(StackRuntimeConfiguration runtime, DeployOptions options);
}
