package xyz.firestige.workload.application.stack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.workload.domain.deploy.DeployOptions;
import xyz.firestige.workload.domain.manifest.WorkerServiceManifest;
import xyz.firestige.workload.domain.shared.vo.WorkloadKind;
import xyz.firestige.workload.domain.stack.StackConfiguration;
import xyz.firestige.workload.domain.stack.StackRuntimeConfiguration;
import xyz.firestige.workload.domain.stack.WorkerServiceSection;
import xyz.firestige.workload.domain.topic.ResolvedSubscription;
import xyz.firestige.workload.domain.topic.Topic;
import xyz.firestige.workload.domain.topic.TopicSubscriptionResolver;
import xyz.firestige.workload.exception.EnvironmentQueryException;
import xyz.firestige.workload.service.environment.TopicLister;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Worker 服务配置构建器
 * <p>
 * 查询目标环境已部署的 Topic，再校验每个订阅都能匹配。
 */
public class WorkerServiceStackBuilder implements StackConfigurationBuilder {

    private static final Logger logger = LoggerFactory.getLogger(WorkerServiceStackBuilder.class);

    private final WorkloadStackContext context;
    private final WorkerServiceManifest manifest;
    private final TopicLister topicLister;
    private final TopicSubscriptionResolver topicResolver;

    public WorkerServiceStackBuilder(WorkloadStackContext context,
                                     WorkerServiceManifest manifest,
                                     TopicLister topicLister,
                                     TopicSubscriptionResolver topicResolver) {
        this.context = context;
        this.manifest = manifest;
        this.topicLister = topicLister;
        this.topicResolver = topicResolver;
    }

    @Override
    public WorkloadKind kind() {
        return WorkloadKind.WORKER_SERVICE;
    }

    @Override
    public StackConfiguration stackConfiguration(StackRuntimeConfiguration runtime, DeployOptions options) {
        String app = context.app().name();
        String env = context.env().name();
        logger.info("[WorkerServiceStackBuilder] 构建配置: {}, env={}", manifest.name(), env);

        String endpoint = context.resolveServiceDiscoveryEndpoint();

        List<Topic> topics;
        try {
            topics = topicLister.listTopics(app, env);
        } catch (Exception e) {
            throw new EnvironmentQueryException(
                    String.format("get SNS topics for app %s and environment %s", app, env), env, e);
        }
        List<String> arns = topics.stream().map(Topic::getArn).collect(Collectors.toList());
        List<ResolvedSubscription> subscriptions = topicResolver.resolve(manifest.subscriptions(), arns, app, env);

        return context.assemble(runtime, options, endpoint, new WorkerServiceSection(subscriptions));
    }
}
