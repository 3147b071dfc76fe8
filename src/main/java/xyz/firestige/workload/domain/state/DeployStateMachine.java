package xyz.firestige.workload.domain.state;

import xyz.firestige.workload.exception.StateTransitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 部署状态机，带迁移监听扩展
 * <p>
 * CHANGE_SET_EMPTY 在调用方未要求强制更新时即为终态（无变更）。
 */
public class DeployStateMachine {

    private DeployState current;

    private final Map<DeployState, Set<DeployState>> rules = new EnumMap<>(DeployState.class);
    private final List<DeployTransitionListener> listeners = new ArrayList<>();
    private final List<DeployState> history = new ArrayList<>();

    public DeployStateMachine() {
        this(DeployState.IDLE);
    }

    public DeployStateMachine(DeployState initial) {
        this.current = initial;
        this.history.add(initial);
        initRules();
    }

    private void initRules() {
        rules.put(DeployState.IDLE, EnumSet.of(DeployState.SUBMITTED));
        rules.put(DeployState.SUBMITTED, EnumSet.of(DeployState.APPLIED, DeployState.CHANGE_SET_EMPTY, DeployState.FAILED));
        rules.put(DeployState.CHANGE_SET_EMPTY, EnumSet.of(DeployState.CHECKING_STALENESS));
        rules.put(DeployState.CHECKING_STALENESS, EnumSet.of(DeployState.SKIPPED, DeployState.FORCE_UPDATING, DeployState.FAILED));
        rules.put(DeployState.FORCE_UPDATING, EnumSet.of(DeployState.COMPLETED, DeployState.TIMED_OUT, DeployState.FAILED));
        rules.put(DeployState.APPLIED, EnumSet.noneOf(DeployState.class));
        rules.put(DeployState.SKIPPED, EnumSet.noneOf(DeployState.class));
        rules.put(DeployState.COMPLETED, EnumSet.noneOf(DeployState.class));
        rules.put(DeployState.TIMED_OUT, EnumSet.noneOf(DeployState.class));
        rules.put(DeployState.FAILED, EnumSet.noneOf(DeployState.class));
    }

    public void registerListener(DeployTransitionListener listener) {
        listeners.add(listener);
    }

    public synchronized boolean canTransition(DeployState to) {
        return rules.getOrDefault(current, Collections.emptySet()).contains(to);
    }

    /**
     * 迁移到目标状态
     *
     * @throws StateTransitionException 非法迁移
     */
    public synchronized DeployState transitionTo(DeployState to) {
        if (!canTransition(to)) {
            throw new StateTransitionException(current.name(), to.name());
        }
        DeployState old = current;
        current = to;
        history.add(to);
        for (DeployTransitionListener listener : listeners) {
            listener.onTransition(old, to);
        }
        return current;
    }

    public synchronized DeployState getCurrent() {
        return current;
    }

    /**
     * 经历过的状态，含初始状态
     */
    public synchronized List<DeployState> getHistory() {
        return List.copyOf(history);
    }
}
