package xyz.firestige.workload.domain.deploy;

/**
 * 调用方传入的部署选项
 *
 * @param forceNewUpdate  变更集为空时强制重启运行中的任务
 * @param disableRollback 部署失败时禁止后端回滚，原样透传给后端
 */
public record DeployOptions(boolean forceNewUpdate, boolean disableRollback) {

    public static DeployOptions defaults() {
        return new DeployOptions(false, false);
    }
}
