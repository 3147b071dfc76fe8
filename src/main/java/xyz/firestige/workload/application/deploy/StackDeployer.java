package xyz.firestige.workload.application.deploy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.workload.domain.deploy.DeployOutcome;
import xyz.firestige.workload.domain.deploy.event.ForceUpdateCompletedEvent;
import xyz.firestige.workload.domain.deploy.event.ForceUpdateFailedEvent;
import xyz.firestige.workload.domain.deploy.event.ForceUpdateStartedEvent;
import xyz.firestige.workload.domain.deploy.event.StackSubmittedEvent;
import xyz.firestige.workload.domain.deploy.event.WorkloadDeployedEvent;
import xyz.firestige.workload.domain.shared.vo.WorkloadIdentity;
import xyz.firestige.workload.domain.stack.StackConfiguration;
import xyz.firestige.workload.domain.state.DeployState;
import xyz.firestige.workload.domain.state.DeployStateMachine;
import xyz.firestige.workload.event.DomainEventPublisher;
import xyz.firestige.workload.exception.ChangeSetEmptyException;
import xyz.firestige.workload.exception.DeployCancelledException;
import xyz.firestige.workload.exception.ForceUpdateException;
import xyz.firestige.workload.exception.ProvisioningException;
import xyz.firestige.workload.exception.StabilityTimeoutException;
import xyz.firestige.workload.exception.WorkloadDeployException;
import xyz.firestige.workload.metrics.MetricsRegistry;
import xyz.firestige.workload.service.provision.ServiceForceUpdater;
import xyz.firestige.workload.service.provision.StackProvisioner;
import xyz.firestige.workload.service.provision.StackTemplateRenderer;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * 栈部署器
 *
 * 职责：
 * 1. 渲染配置并提交给部署后端
 * 2. 变更集为空时按调用方选项决定是否强制更新
 * 3. 强制更新前检查服务是否已在本次调用开始后更新过
 * 4. 强制更新后等待服务稳定
 *
 * 注意：
 * - 只有"变更集为空"会进入强制更新分支，其他后端错误直接失败
 * - 调用开始时间每次调用只取一次，来自注入的 Clock
 * - 本层不重试
 */
public class StackDeployer {

    private static final Logger log = LoggerFactory.getLogger(StackDeployer.class);

    private final StackTemplateRenderer templateRenderer;
    private final StackProvisioner provisioner;
    private final ServiceForceUpdater forceUpdater;
    private final StabilityWaiter stabilityWaiter;
    private final Clock clock;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;

    public StackDeployer(StackTemplateRenderer templateRenderer,
                         StackProvisioner provisioner,
                         ServiceForceUpdater forceUpdater,
                         StabilityWaiter stabilityWaiter,
                         Clock clock,
                         DomainEventPublisher eventPublisher,
                         MetricsRegistry metrics) {
        this.templateRenderer = Objects.requireNonNull(templateRenderer, "templateRenderer cannot be null");
        this.provisioner = Objects.requireNonNull(provisioner, "provisioner cannot be null");
        this.forceUpdater = Objects.requireNonNull(forceUpdater, "forceUpdater cannot be null");
        this.stabilityWaiter = Objects.requireNonNull(stabilityWaiter, "stabilityWaiter cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    public DeployResult deploy(StackConfiguration configuration) {
        return deploy(configuration, CancellationSignal.none());
    }

    /**
     * 部署栈
     *
     * @param configuration 栈配置
     * @param signal        取消信号，仅在等待服务稳定时生效
     * @return 部署结果
     * @throws ProvisioningException      提交失败或查询最近部署时间失败
     * @throws StabilityTimeoutException  强制更新后服务未在预算内稳定
     * @throws DeployCancelledException   等待期间被取消
     * @throws ForceUpdateException       强制更新失败
     */
    public DeployResult deploy(StackConfiguration configuration, CancellationSignal signal) {
        Objects.requireNonNull(configuration, "configuration cannot be null");
        Objects.requireNonNull(signal, "signal cannot be null");

        Instant startedAt = clock.instant();
        WorkloadIdentity identity = configuration.getIdentity();
        String stackName = configuration.getStackName();

        DeployStateMachine stateMachine = new DeployStateMachine();
        stateMachine.registerListener((from, to) ->
                log.info("[StackDeployer] {} 状态迁移: {} -> {}", stackName, from, to));

        String document = render(configuration);

        stateMachine.transitionTo(DeployState.SUBMITTED);
        metrics.incrementCounter(MetricsRegistry.SUBMITTED);
        try {
            provisioner.submit(stackName, document, configuration.getRuntime().artifactBucket(),
                    configuration.getOptions());
        } catch (ChangeSetEmptyException e) {
            log.warn("[StackDeployer] 变更集为空: {}", e.getMessage());
            stateMachine.transitionTo(DeployState.CHANGE_SET_EMPTY);
            eventPublisher.publish(new StackSubmittedEvent(identity, true));
            return onChangeSetEmpty(configuration, identity, startedAt, stateMachine, signal);
        } catch (Exception e) {
            stateMachine.transitionTo(DeployState.FAILED);
            metrics.incrementCounter(MetricsRegistry.FAILED);
            log.error("[StackDeployer] 提交栈失败: {}", stackName, e);
            throw new ProvisioningException("deploy failed", e).addContext("stackName", stackName);
        }

        stateMachine.transitionTo(DeployState.APPLIED);
        eventPublisher.publish(new StackSubmittedEvent(identity, false));
        return succeed(identity, DeployOutcome.APPLIED,
                "Deployed " + identity.name() + " to " + identity.environment() + ".", stateMachine);
    }

    private String render(StackConfiguration configuration) {
        try {
            return templateRenderer.render(configuration);
        } catch (Exception e) {
            metrics.incrementCounter(MetricsRegistry.FAILED);
            throw new ProvisioningException("render stack template for " + configuration.getStackName(), e);
        }
    }

    private DeployResult onChangeSetEmpty(StackConfiguration configuration, WorkloadIdentity identity,
                                          Instant startedAt, DeployStateMachine stateMachine,
                                          CancellationSignal signal) {
        if (!configuration.isForceUpdate()) {
            metrics.incrementCounter(MetricsRegistry.NO_CHANGES);
            return succeed(identity, DeployOutcome.NO_CHANGES,
                    "No changes to deploy for " + identity.name() + ".", stateMachine);
        }

        stateMachine.transitionTo(DeployState.CHECKING_STALENESS);
        Instant lastUpdatedAt;
        try {
            lastUpdatedAt = forceUpdater.lastUpdatedAt(identity.application(), identity.environment(), identity.name());
        } catch (Exception e) {
            stateMachine.transitionTo(DeployState.FAILED);
            metrics.incrementCounter(MetricsRegistry.FAILED);
            throw new ProvisioningException("get the last updated deployment time for " + identity.name(), e);
        }
        if (lastUpdatedAt != null && !lastUpdatedAt.isBefore(startedAt)) {
            log.warn("[StackDeployer] 服务 {} 已在本次调用开始后更新 ({} >= {})，跳过强制更新",
                    identity.name(), lastUpdatedAt, startedAt);
            stateMachine.transitionTo(DeployState.SKIPPED);
            return succeed(identity, DeployOutcome.FORCE_UPDATE_SKIPPED,
                    "Service " + identity.name() + " was already updated after this deployment started.",
                    stateMachine);
        }

        stateMachine.transitionTo(DeployState.FORCE_UPDATING);
        metrics.incrementCounter(MetricsRegistry.FORCE_UPDATE);
        eventPublisher.publish(new ForceUpdateStartedEvent(identity));
        int attempts;
        try {
            attempts = forceUpdateAndWait(identity, signal);
        } catch (StabilityTimeoutException e) {
            stateMachine.transitionTo(DeployState.TIMED_OUT);
            metrics.incrementCounter(MetricsRegistry.FORCE_UPDATE_TIMEOUT);
            eventPublisher.publish(new ForceUpdateFailedEvent(identity, e.toFailureInfo()));
            throw e;
        } catch (WorkloadDeployException e) {
            stateMachine.transitionTo(DeployState.FAILED);
            metrics.incrementCounter(MetricsRegistry.FAILED);
            eventPublisher.publish(new ForceUpdateFailedEvent(identity, e.toFailureInfo()));
            throw e;
        }

        stateMachine.transitionTo(DeployState.COMPLETED);
        metrics.setGauge(MetricsRegistry.FORCE_UPDATE + ".attempts", attempts);
        eventPublisher.publish(new ForceUpdateCompletedEvent(identity, attempts));
        return succeed(identity, DeployOutcome.FORCE_UPDATED,
                "Forced an update for service " + identity.name() + " in " + identity.environment() + ".",
                stateMachine);
    }

    private int forceUpdateAndWait(WorkloadIdentity identity, CancellationSignal signal) {
        try {
            forceUpdater.forceUpdate(identity.application(), identity.environment(), identity.name());
        } catch (StabilityTimeoutException e) {
            throw new StabilityTimeoutException(identity.name(), stabilityWaiter.getMaxAttempts(), e)
                    .withRemediation(stabilityWaiter.remediation(identity));
        } catch (Exception e) {
            log.error("[StackDeployer] 强制更新失败: {}", identity.name(), e);
            throw new ForceUpdateException(identity.name(), e);
        }
        return stabilityWaiter.await(identity, signal);
    }

    private DeployResult succeed(WorkloadIdentity identity, DeployOutcome outcome, String details,
                                 DeployStateMachine stateMachine) {
        log.info("[StackDeployer] {} 部署结束: {}", identity.stackName(), outcome);
        eventPublisher.publish(new WorkloadDeployedEvent(identity, outcome));
        return new DeployResult(outcome, details, stateMachine.getHistory(), identity.stackName());
    }
}
