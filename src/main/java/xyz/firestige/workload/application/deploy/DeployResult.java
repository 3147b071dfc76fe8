package xyz.firestige.workload.application.deploy;

import xyz.firestige.workload.domain.deploy.DeployOutcome;
import xyz.firestige.workload.domain.state.DeployState;

import java.util.List;

/**
 * 部署结果
 *
 * @param outcome      结果类型
 * @param details      面向用户的描述
 * @param stateHistory 经历过的部署状态
 * @param stackName    栈名称
 */
public record DeployResult(DeployOutcome outcome, String details, List<DeployState> stateHistory, String stackName) {

    public DeployResult {
        stateHistory = stateHistory == null ? List.of() : List.copyOf(stateHistory);
    }
}
