package xyz.firestige.workload.domain.state;

/**
 * 单次部署调用的状态
 */
public enum DeployState {

    IDLE("空闲"),
    SUBMITTED("已提交"),
    APPLIED("已应用"),
    CHANGE_SET_EMPTY("变更集为空"),
    FAILED("失败"),
    CHECKING_STALENESS("检查最近部署时间"),
    SKIPPED("跳过强制更新"),
    FORCE_UPDATING("强制更新中"),
    COMPLETED("强制更新完成"),
    TIMED_OUT("稳定等待超时");

    private final String description;

    DeployState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == APPLIED || this == FAILED || this == SKIPPED || this == COMPLETED || this == TIMED_OUT;
    }
}
