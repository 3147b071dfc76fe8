package xyz.firestige.workload.domain.topic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.workload.domain.manifest.TopicSubscription;
import xyz.firestige.workload.exception.TopicNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Topic 订阅解析器
 *
 * 职责：
 * - 校验 Worker 声明的每个订阅都对应目标环境中已部署的 Topic
 * - 按输入顺序逐个检查，第一个缺失的 Topic 立即失败
 *
 * 注意：
 * - 资源名精确匹配，大小写敏感；其他环境的同名 Topic 不算
 * - 空订阅列表直接通过
 */
public class TopicSubscriptionResolver {

    private static final Logger logger = LoggerFactory.getLogger(TopicSubscriptionResolver.class);

    /**
     * 校验订阅的 Topic 均已部署
     *
     * @param subscriptions     订阅声明
     * @param deployedTopicArns 目标环境已部署的 Topic ARN
     * @param app               应用名称
     * @param env               环境名称
     * @throws TopicNotFoundException 第一个缺失的 Topic
     */
    public void validateTopicsExist(List<TopicSubscription> subscriptions, Collection<String> deployedTopicArns,
                                    String app, String env) {
        resolve(subscriptions, deployedTopicArns, app, env);
    }

    /**
     * 校验并返回订阅与 Topic ARN 的配对，保持输入顺序
     */
    public List<ResolvedSubscription> resolve(List<TopicSubscription> subscriptions,
                                              Collection<String> deployedTopicArns, String app, String env) {
        List<ResolvedSubscription> resolved = new ArrayList<>();
        if (subscriptions == null || subscriptions.isEmpty()) {
            return resolved;
        }
        Map<String, String> arnByResource = indexByResourceName(deployedTopicArns);
        for (TopicSubscription subscription : subscriptions) {
            String expected = subscription.resourceName(app, env);
            String arn = arnByResource.get(expected);
            if (arn == null) {
                logger.warn("[TopicSubscriptionResolver] Topic 不存在: {}, env={}", expected, env);
                throw new TopicNotFoundException(expected, env);
            }
            resolved.add(new ResolvedSubscription(subscription, arn));
        }
        logger.debug("[TopicSubscriptionResolver] {} 个订阅校验通过, env={}", resolved.size(), env);
        return resolved;
    }

    private static Map<String, String> indexByResourceName(Collection<String> arns) {
        Map<String, String> index = new HashMap<>();
        if (arns == null) {
            return index;
        }
        for (String arn : arns) {
            String resource = TopicArnParser.resourceName(arn);
            if (resource != null) {
                index.putIfAbsent(resource, arn);
            }
        }
        return index;
    }
}
