package xyz.firestige.workload.domain.state;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.workload.exception.StateTransitionException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DeployStateMachine 单元测试")
class DeployStateMachineTest {

    @Test
    @DisplayName("场景: 强制更新完整路径")
    void forceUpdatePath() {
        DeployStateMachine sm = new DeployStateMachine();
        List<String> transitions = new ArrayList<>();
        sm.registerListener((from, to) -> transitions.add(from + "->" + to));

        sm.transitionTo(DeployState.SUBMITTED);
        sm.transitionTo(DeployState.CHANGE_SET_EMPTY);
        sm.transitionTo(DeployState.CHECKING_STALENESS);
        sm.transitionTo(DeployState.FORCE_UPDATING);
        sm.transitionTo(DeployState.COMPLETED);

        assertThat(sm.getCurrent()).isEqualTo(DeployState.COMPLETED);
        assertThat(sm.getCurrent().isTerminal()).isTrue();
        assertThat(sm.getHistory()).containsExactly(DeployState.IDLE, DeployState.SUBMITTED,
                DeployState.CHANGE_SET_EMPTY, DeployState.CHECKING_STALENESS, DeployState.FORCE_UPDATING,
                DeployState.COMPLETED);
        assertThat(transitions).hasSize(5).first().isEqualTo("IDLE->SUBMITTED");
    }

    @Test
    @DisplayName("场景: 非法迁移抛出异常且状态不变")
    void illegalTransition() {
        DeployStateMachine sm = new DeployStateMachine();
        sm.transitionTo(DeployState.SUBMITTED);
        sm.transitionTo(DeployState.APPLIED);

        assertThat(sm.canTransition(DeployState.FORCE_UPDATING)).isFalse();
        assertThatThrownBy(() -> sm.transitionTo(DeployState.FORCE_UPDATING))
                .isInstanceOf(StateTransitionException.class)
                .hasMessage("illegal deploy state transition APPLIED -> FORCE_UPDATING");
        assertThat(sm.getCurrent()).isEqualTo(DeployState.APPLIED);
    }

    @Test
    @DisplayName("场景: 未检查最近部署时间不能直接强制更新")
    void cannotSkipStalenessCheck() {
        DeployStateMachine sm = new DeployStateMachine(DeployState.CHANGE_SET_EMPTY);

        assertThat(sm.canTransition(DeployState.FORCE_UPDATING)).isFalse();
        assertThat(sm.canTransition(DeployState.CHECKING_STALENESS)).isTrue();
    }
}
