package xyz.firestige.workload.domain.state;

/**
 * 状态迁移回调，迁移生效后按注册顺序触发
 */
@FunctionalInterface
public interface DeployTransitionListener {

    void onTransition(DeployState from, DeployState to);
}
