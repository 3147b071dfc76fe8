package xyz.firestige.workload.domain.deploy;

/**
 * 部署调用的成功结果
 */
public enum DeployOutcome {

    /**
     * 后端应用了变更
     */
    APPLIED,

    /**
     * 变更集为空且未要求强制更新，视为成功
     */
    NO_CHANGES,

    /**
     * 本次调用开始后服务已被更新过，跳过强制更新
     */
    FORCE_UPDATE_SKIPPED,

    /**
     * 强制更新完成且服务已稳定
     */
    FORCE_UPDATED
}
