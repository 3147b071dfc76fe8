package xyz.firestige.workload.domain.topic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.workload.domain.manifest.TopicSubscription;
import xyz.firestige.workload.exception.TopicNotFoundException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TopicSubscriptionResolver 单元测试
 */
@Tag("unit")
@DisplayName("TopicSubscriptionResolver 单元测试")
class TopicSubscriptionResolverTest {

    private static final String ARN_PREFIX = "arn:aws:sns:us-west-2:012345678012:";

    private final TopicSubscriptionResolver resolver = new TopicSubscriptionResolver();

    @Test
    @DisplayName("场景: 订阅的 Topic 已部署在目标环境")
    void topicDeployed_resolved() {
        // Given
        List<String> arns = List.of(
                ARN_PREFIX + "app-env-database-events",
                ARN_PREFIX + "app-env-database-orders");
        List<TopicSubscription> subs = List.of(
                TopicSubscription.of("database", "orders"),
                TopicSubscription.of("database", "events"));

        // When
        List<ResolvedSubscription> resolved = resolver.resolve(subs, arns, "app", "env");

        // Then: 保持声明顺序
        assertThat(resolved).extracting(ResolvedSubscription::topicArn)
                .containsExactly(ARN_PREFIX + "app-env-database-orders", ARN_PREFIX + "app-env-database-events");
    }

    @Test
    @DisplayName("场景: 同名 Topic 只部署在其他环境时校验失败")
    void topicInOtherEnvironment_rejected() {
        List<String> arns = List.of(ARN_PREFIX + "app-prod-database-events");

        assertThatThrownBy(() -> resolver.validateTopicsExist(
                List.of(TopicSubscription.of("database", "events")), arns, "app", "env"))
                .isInstanceOf(TopicNotFoundException.class)
                .hasMessage("SNS topic app-env-database-events does not exist in environment env");
    }

    @Test
    @DisplayName("场景: 匹配区分大小写且必须完全相等")
    void exactCaseSensitiveMatch() {
        List<String> arns = List.of(
                ARN_PREFIX + "app-env-Database-events",
                ARN_PREFIX + "app-env-database-events-v2");

        assertThatThrownBy(() -> resolver.validateTopicsExist(
                List.of(TopicSubscription.of("database", "events")), arns, "app", "env"))
                .isInstanceOf(TopicNotFoundException.class);
    }

    @Test
    @DisplayName("场景: 第一个缺失的 Topic 决定错误消息")
    void firstMissingTopicReported() {
        List<String> arns = List.of(ARN_PREFIX + "app-env-database-events");
        List<TopicSubscription> subs = List.of(
                TopicSubscription.of("database", "events"),
                TopicSubscription.of("api", "missing1"),
                TopicSubscription.of("api", "missing2"));

        assertThatThrownBy(() -> resolver.validateTopicsExist(subs, arns, "app", "env"))
                .isInstanceOfSatisfying(TopicNotFoundException.class,
                        e -> assertThat(e.getTopicName()).isEqualTo("app-env-api-missing1"));
    }

    @Test
    @DisplayName("场景: 无订阅时总是通过，非法 ARN 被忽略")
    void emptySubscriptions_valid() {
        assertThatNoException().isThrownBy(() -> resolver.validateTopicsExist(null, List.of(), "app", "env"));
        assertThatNoException().isThrownBy(() -> resolver.validateTopicsExist(List.of(), List.of("garbage"), "app", "env"));
    }
}
