package xyz.firestige.workload.service.provision;

import xyz.firestige.workload.exception.StabilityTimeoutException;

import java.time.Instant;

/**
 * 运行中服务的强制更新
 */
public interface ServiceForceUpdater {

    /**
     * 服务最近一次部署更新的时间
     */
    Instant lastUpdatedAt(String app, String env, String workload) throws Exception;

    /**
     * 不产生新的栈版本，重启运行中的任务
     *
     * @throws StabilityTimeoutException 后端自身等待稳定超时
     */
    void forceUpdate(String app, String env, String workload) throws Exception;
}
