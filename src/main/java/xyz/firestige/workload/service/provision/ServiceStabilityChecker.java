package xyz.firestige.workload.service.provision;

/**
 * 服务稳定性检查，强制更新后轮询调用
 */
@FunctionalInterface
public interface ServiceStabilityChecker {

    /**
     * @return true 表示服务已达到稳定运行状态
     */
    boolean isStable(String app, String env, String workload) throws Exception;
}
