package xyz.firestige.workload.application.stack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.workload.domain.alias.AliasValidator;
import xyz.firestige.workload.domain.discovery.ServiceDiscoveryResolver;
import xyz.firestige.workload.domain.environment.ApplicationInfo;
import xyz.firestige.workload.domain.environment.EnvironmentInfo;
import xyz.firestige.workload.domain.manifest.LoadBalancedWebServiceManifest;
import xyz.firestige.workload.domain.manifest.RequestDrivenWebServiceManifest;
import xyz.firestige.workload.domain.manifest.WorkerServiceManifest;
import xyz.firestige.workload.domain.manifest.WorkloadManifest;
import xyz.firestige.workload.domain.topic.TopicSubscriptionResolver;
import xyz.firestige.workload.service.artifact.CustomResourceUploader;
import xyz.firestige.workload.service.certificate.AliasCertValidator;
import xyz.firestige.workload.service.environment.AppVersionGetter;
import xyz.firestige.workload.service.environment.PublicCidrBlocksGetter;
import xyz.firestige.workload.service.environment.ServiceDiscoveryEndpointGetter;
import xyz.firestige.workload.service.environment.TopicLister;

import java.util.Objects;

/**
 * 配置构建器注册表（工厂 + 依赖注入）
 *
 * 职责：
 * 1. 按清单类型选择构建器
 * 2. 为每次部署创建新的 {@link WorkloadStackContext}
 * 3. 注入各类型需要的环境协作者
 */
public class StackConfigurationBuilderRegistry {

    private static final Logger logger = LoggerFactory.getLogger(StackConfigurationBuilderRegistry.class);

    private final AliasValidator aliasValidator;
    private final TopicSubscriptionResolver topicResolver;
    private final ServiceDiscoveryResolver discoveryResolver;
    private final ServiceDiscoveryEndpointGetter endpointGetter;
    private final AppVersionGetter appVersionGetter;
    private final PublicCidrBlocksGetter publicCidrBlocksGetter;
    private final AliasCertValidator aliasCertValidator;
    private final TopicLister topicLister;
    private final CustomResourceUploader customResourceUploader;

    public StackConfigurationBuilderRegistry(AliasValidator aliasValidator,
                                             TopicSubscriptionResolver topicResolver,
                                             ServiceDiscoveryResolver discoveryResolver,
                                             ServiceDiscoveryEndpointGetter endpointGetter,
                                             AppVersionGetter appVersionGetter,
                                             PublicCidrBlocksGetter publicCidrBlocksGetter,
                                             AliasCertValidator aliasCertValidator,
                                             TopicLister topicLister,
                                             CustomResourceUploader customResourceUploader) {
        this.aliasValidator = Objects.requireNonNull(aliasValidator, "aliasValidator");
        this.topicResolver = Objects.requireNonNull(topicResolver, "topicResolver");
        this.discoveryResolver = Objects.requireNonNull(discoveryResolver, "discoveryResolver");
        this.endpointGetter = Objects.requireNonNull(endpointGetter, "endpointGetter");
        this.appVersionGetter = Objects.requireNonNull(appVersionGetter, "appVersionGetter");
        this.publicCidrBlocksGetter = Objects.requireNonNull(publicCidrBlocksGetter, "publicCidrBlocksGetter");
        this.aliasCertValidator = Objects.requireNonNull(aliasCertValidator, "aliasCertValidator");
        this.topicLister = Objects.requireNonNull(topicLister, "topicLister");
        this.customResourceUploader = Objects.requireNonNull(customResourceUploader, "customResourceUploader");
    }

    /**
     * 基于清单创建构建器
     *
     * @throws IllegalArgumentException 不支持的清单类型
     */
    public StackConfigurationBuilder builderFor(WorkloadManifest manifest, ApplicationInfo app, EnvironmentInfo env) {
        Objects.requireNonNull(manifest, "manifest");
        WorkloadStackContext context = new WorkloadStackContext(manifest.name(), manifest.kind(), app, env,
                aliasValidator, discoveryResolver, endpointGetter, appVersionGetter);
        logger.debug("[StackConfigurationBuilderRegistry] 选择构建器: {} ({})", manifest.name(), manifest.kind());

        if (manifest instanceof LoadBalancedWebServiceManifest) {
            return new LoadBalancedWebServiceStackBuilder(context, (LoadBalancedWebServiceManifest) manifest,
                    publicCidrBlocksGetter, aliasCertValidator);
        }
        if (manifest instanceof RequestDrivenWebServiceManifest) {
            return new RequestDrivenWebServiceStackBuilder(context, (RequestDrivenWebServiceManifest) manifest,
                    customResourceUploader);
        }
        if (manifest instanceof WorkerServiceManifest) {
            return new WorkerServiceStackBuilder(context, (WorkerServiceManifest) manifest,
                    topicLister, topicResolver);
        }
        throw new IllegalArgumentException("unsupported workload manifest type: " + manifest.getClass().getName());
    }
}
