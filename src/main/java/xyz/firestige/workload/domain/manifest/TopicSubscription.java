package xyz.firestige.workload.domain.manifest;

import jakarta.validation.constraints.NotBlank;

/**
 * Topic 订阅声明
 *
 * @param service 发布该 Topic 的服务
 * @param name    Topic 名称
 * @param queue   队列设置，可为空
 */
public record TopicSubscription(
        @NotBlank(message = "订阅的服务名称不能为空") String service,
        @NotBlank(message = "订阅的 Topic 名称不能为空") String name,
        QueueSettings queue) {

    public static TopicSubscription of(String service, String name) {
        return new TopicSubscription(service, name, null);
    }

    /**
     * 目标环境中该 Topic 的资源名：app-env-service-topic
     */
    public String resourceName(String app, String env) {
        return String.format("%s-%s-%s-%s", app, env, service, name);
    }
}
