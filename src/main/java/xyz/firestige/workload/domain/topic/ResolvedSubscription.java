package xyz.firestige.workload.domain.topic;

import xyz.firestige.workload.domain.manifest.TopicSubscription;

/**
 * 已匹配到部署 Topic 的订阅
 */
public record ResolvedSubscription(TopicSubscription subscription, String topicArn) {
}
