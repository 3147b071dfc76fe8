package xyz.firestige.workload.application.deploy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.workload.domain.shared.vo.WorkloadIdentity;
import xyz.firestige.workload.exception.DeployCancelledException;
import xyz.firestige.workload.exception.ForceUpdateException;
import xyz.firestige.workload.exception.StabilityTimeoutException;
import xyz.firestige.workload.service.provision.ServiceStabilityChecker;

import java.time.Duration;
import java.util.Objects;

/**
 * 强制更新后的服务稳定轮询
 *
 * 职责：
 * - 按固定间隔查询服务是否稳定，最多 maxAttempts 次
 * - 等待期间响应取消信号与线程中断
 * - 超出预算时抛出带修复建议的超时异常
 *
 * 注意：超时不代表部署失败，服务可能仍在滚动
 */
public class StabilityWaiter {

    private static final Logger log = LoggerFactory.getLogger(StabilityWaiter.class);

    private final ServiceStabilityChecker stabilityChecker;
    private final Duration interval;
    private final int maxAttempts;
    private final String statusCommandTemplate;

    public StabilityWaiter(ServiceStabilityChecker stabilityChecker, Duration interval, int maxAttempts,
                           String statusCommandTemplate) {
        this.stabilityChecker = Objects.requireNonNull(stabilityChecker, "stabilityChecker cannot be null");
        this.interval = Objects.requireNonNull(interval, "interval cannot be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.statusCommandTemplate = statusCommandTemplate;
    }

    /**
     * 等待服务稳定
     *
     * @return 轮询次数
     * @throws StabilityTimeoutException 超出重试预算
     * @throws DeployCancelledException  调用方取消或线程被中断
     * @throws ForceUpdateException      稳定性查询失败
     */
    public int await(WorkloadIdentity identity, CancellationSignal signal) {
        String workload = identity.name();
        log.info("[StabilityWaiter] 开始等待服务稳定: {}, interval={}, maxAttempts={}", workload, interval, maxAttempts);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (signal.isCancelled()) {
                throw cancelled(identity);
            }
            boolean stable;
            try {
                stable = stabilityChecker.isStable(identity.application(), identity.environment(), workload);
            } catch (Exception e) {
                log.error("[StabilityWaiter] 查询服务状态失败: {}, attempt={}", workload, attempt, e);
                throw new ForceUpdateException(workload, e);
            }
            log.debug("[StabilityWaiter] Attempt {}: service={}, stable={}", attempt, workload, stable);
            if (stable) {
                log.info("[StabilityWaiter] 服务已稳定: {}, attempts={}", workload, attempt);
                return attempt;
            }
            if (attempt < maxAttempts && pause(signal)) {
                throw cancelled(identity);
            }
        }

        log.warn("[StabilityWaiter] 服务 {} 在 {} 次轮询后仍未稳定", workload, maxAttempts);
        throw new StabilityTimeoutException(workload, maxAttempts).withRemediation(remediation(identity));
    }

    /**
     * @return 是否在等待期间被取消
     */
    private boolean pause(CancellationSignal signal) {
        try {
            return signal.awaitCancellation(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[StabilityWaiter] 等待被中断");
            return true;
        }
    }

    private DeployCancelledException cancelled(WorkloadIdentity identity) {
        log.warn("[StabilityWaiter] 等待服务稳定时被取消: {}", identity.name());
        return new DeployCancelledException(identity.name());
    }

    /**
     * 超时的修复建议，附带查看服务状态的命令
     */
    public String remediation(WorkloadIdentity identity) {
        String hint = "The service may still be deploying. Check its status out-of-band";
        if (statusCommandTemplate == null || statusCommandTemplate.isBlank()) {
            return hint + ".";
        }
        return hint + " with `" + String.format(statusCommandTemplate, identity.name(), identity.environment()) + "`.";
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInterval() {
        return interval;
    }
}
