package xyz.firestige.workload.exception;

/**
 * 状态转移异常
 * 部署状态机出现非法转移时抛出
 */
public class StateTransitionException extends WorkloadDeployException {

    private final String fromStatus;
    private final String toStatus;

    public StateTransitionException(String fromStatus, String toStatus) {
        super(String.format("illegal deploy state transition %s -> %s", fromStatus, toStatus), ErrorType.SYSTEM_ERROR);
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        addContext("fromStatus", fromStatus);
        addContext("toStatus", toStatus);
    }

    public String getFromStatus() {
        return fromStatus;
    }

    public String getToStatus() {
        return toStatus;
    }
}
