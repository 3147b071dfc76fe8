package xyz.firestige.workload.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 异常体系单元测试
 * 每层只包装一次，原因保留
 */
@Tag("unit")
@Tag("fast")
@DisplayName("WorkloadDeployException 单元测试")
class WorkloadDeployExceptionTest {

    @Test
    @DisplayName("场景: 包装消息为 操作: 原因")
    void wrapsOnce() {
        RuntimeException cause = new RuntimeException("some error");

        EnvironmentQueryException e = new EnvironmentQueryException("get service discovery endpoint", "test", cause);

        assertEquals("get service discovery endpoint: some error", e.getMessage());
        assertSame(cause, e.getCause());
        assertEquals(ErrorType.ENVIRONMENT_QUERY_ERROR, e.getErrorType());
        assertEquals("test", e.getContext().get("environment"));
    }

    @Test
    @DisplayName("场景: 原因无消息时使用异常类名")
    void causeWithoutMessage() {
        ProvisioningException e = new ProvisioningException("deploy failed", new IllegalStateException());

        assertEquals("deploy failed: IllegalStateException", e.getMessage());
    }

    @Test
    @DisplayName("场景: 转换为 FailureInfo")
    void toFailureInfo() {
        FailureInfo info = new ChangeSetEmptyException("cs", "app-env-svc").setFailedAt("submit").toFailureInfo();

        assertEquals(ErrorType.PROVISIONING_ERROR, info.getErrorType());
        assertEquals("change set with name cs for stack app-env-svc has no changes", info.getErrorMessage());
        assertEquals("submit", info.getFailedAt());
        assertFalse(info.isRetryable());
    }

    @Test
    @DisplayName("场景: 超时可重试且携带修复建议")
    void timeoutRetryable() {
        StabilityTimeoutException e = new StabilityTimeoutException("svc", 80).withRemediation("check it");

        assertTrue(e.isRetryable());
        assertEquals("check it", e.toFailureInfo().getRemediation());
        assertEquals("svc", e.getWorkload());
    }
}
