package xyz.firestige.workload.facade;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.workload.application.deploy.CancellationSignal;
import xyz.firestige.workload.application.deploy.DeployResult;
import xyz.firestige.workload.application.deploy.StackDeployer;
import xyz.firestige.workload.application.stack.StackConfigurationBuilder;
import xyz.firestige.workload.application.stack.StackConfigurationBuilderRegistry;
import xyz.firestige.workload.domain.stack.StackConfiguration;
import xyz.firestige.workload.exception.WorkloadDeployException;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * 工作负载部署 Facade
 * <p>
 * 职责：
 * 1. 参数校验（快速失败）
 * 2. 按清单类型构建栈配置
 * 3. 调用部署器并返回结果
 * <p>
 * 错误通过异常返回：参数错误为 IllegalArgumentException，
 * 其余为 {@link WorkloadDeployException} 的子类，原样透传。
 */
public class WorkloadDeploymentFacade {

    private static final Logger logger = LoggerFactory.getLogger(WorkloadDeploymentFacade.class);

    private final StackConfigurationBuilderRegistry builderRegistry;
    private final StackDeployer stackDeployer;
    private final Validator validator;  // Jakarta Validator

    public WorkloadDeploymentFacade(StackConfigurationBuilderRegistry builderRegistry,
                                    StackDeployer stackDeployer,
                                    Validator validator) {
        this.builderRegistry = builderRegistry;
        this.stackDeployer = stackDeployer;
        this.validator = validator;
    }

    public DeployResult deployWorkload(DeployWorkloadInput input) {
        return deployWorkload(input, CancellationSignal.none());
    }

    /**
     * 部署工作负载
     *
     * @param input  部署入参
     * @param signal 取消信号，等待服务稳定时生效
     */
    public DeployResult deployWorkload(DeployWorkloadInput input, CancellationSignal signal) {
        // Step 1: 参数校验（快速失败）
        if (input == null) {
            throw new IllegalArgumentException("部署入参不能为空");
        }
        Set<ConstraintViolation<DeployWorkloadInput>> violations = validator.validate(input);
        if (!violations.isEmpty()) {
            String errorDetail = violations.stream()
                    .map(v -> String.format("[%s] %s", v.getPropertyPath(), v.getMessage()))
                    .sorted()
                    .collect(Collectors.joining("; "));
            logger.warn("[Facade] 部署入参校验失败: {}", errorDetail);
            throw new IllegalArgumentException("部署入参校验失败: " + errorDetail);
        }

        logger.info("[Facade] 部署工作负载: {}, app={}, env={}",
                input.manifest().name(), input.application().name(), input.environment().name());

        // Step 2: 构建栈配置
        StackConfigurationBuilder builder = builderRegistry.builderFor(
                input.manifest(), input.application(), input.environment());
        StackConfiguration configuration;
        try {
            configuration = builder.stackConfiguration(input.artifacts(), input.options());
        } catch (WorkloadDeployException e) {
            logger.error("[Facade] 构建栈配置失败: {}", e.getMessage());
            throw e.setFailedAt(e.getFailedAt() != null ? e.getFailedAt() : "stack-configuration");
        }

        // Step 3: 部署
        DeployResult result = stackDeployer.deploy(configuration, signal);
        logger.info("[Facade] 部署完成: {}, outcome={}", result.stackName(), result.outcome());
        return result;
    }
}
