package xyz.firestige.workload.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import xyz.firestige.workload.application.deploy.StabilityWaiter;
import xyz.firestige.workload.application.deploy.StackDeployer;
import xyz.firestige.workload.application.stack.StackConfigurationBuilderRegistry;
import xyz.firestige.workload.config.WorkloadDeployProperties;
import xyz.firestige.workload.domain.alias.AliasValidator;
import xyz.firestige.workload.domain.discovery.ServiceDiscoveryResolver;
import xyz.firestige.workload.domain.topic.TopicSubscriptionResolver;
import xyz.firestige.workload.event.DomainEventPublisher;
import xyz.firestige.workload.event.SpringDomainEventPublisher;
import xyz.firestige.workload.facade.WorkloadDeploymentFacade;
import xyz.firestige.workload.metrics.MetricsRegistry;
import xyz.firestige.workload.metrics.MicrometerMetricsRegistry;
import xyz.firestige.workload.metrics.NoopMetricsRegistry;
import xyz.firestige.workload.service.artifact.CustomResourceUploader;
import xyz.firestige.workload.service.certificate.AliasCertValidator;
import xyz.firestige.workload.service.environment.AppVersionGetter;
import xyz.firestige.workload.service.environment.PublicCidrBlocksGetter;
import xyz.firestige.workload.service.environment.ServiceDiscoveryEndpointGetter;
import xyz.firestige.workload.service.environment.TopicLister;
import xyz.firestige.workload.service.provision.ServiceForceUpdater;
import xyz.firestige.workload.service.provision.ServiceStabilityChecker;
import xyz.firestige.workload.service.provision.StackProvisioner;
import xyz.firestige.workload.service.provision.StackTemplateRenderer;

import java.time.Clock;

/**
 * 工作负载部署自动装配
 *
 * 配置属性见 {@link WorkloadDeployProperties}（workload.deploy.*）。
 * <p>
 * 校验器、解析器、事件发布器和指标始终装配；构建器注册表、部署器和 Facade
 * 需要宿主应用提供全部环境 / 后端协作者 Bean。
 */
@AutoConfiguration(after = ValidationAutoConfiguration.class)
@EnableConfigurationProperties(WorkloadDeployProperties.class)
public class WorkloadDeployAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkloadDeployAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock workloadDeployClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public AliasValidator aliasValidator(WorkloadDeployProperties properties) {
        return new AliasValidator(properties.getAlias().getLeastAppTemplateVersion());
    }

    @Bean
    @ConditionalOnMissingBean
    public TopicSubscriptionResolver topicSubscriptionResolver() {
        return new TopicSubscriptionResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public ServiceDiscoveryResolver serviceDiscoveryResolver() {
        return new ServiceDiscoveryResolver();
    }

    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    public DomainEventPublisher workloadDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        log.info("[WorkloadDeployAutoConfiguration] 使用 SpringDomainEventPublisher");
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    /**
     * 存在 MeterRegistry 时使用 Micrometer，否则 Noop
     */
    @Bean
    @ConditionalOnMissingBean(MetricsRegistry.class)
    public MetricsRegistry workloadMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        MeterRegistry mr = meterRegistryProvider.getIfAvailable();
        if (mr != null) {
            return new MicrometerMetricsRegistry(mr);
        }
        return new NoopMetricsRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ServiceDiscoveryEndpointGetter.class, AppVersionGetter.class, PublicCidrBlocksGetter.class,
            AliasCertValidator.class, TopicLister.class, CustomResourceUploader.class})
    public StackConfigurationBuilderRegistry stackConfigurationBuilderRegistry(
            AliasValidator aliasValidator,
            TopicSubscriptionResolver topicSubscriptionResolver,
            ServiceDiscoveryResolver serviceDiscoveryResolver,
            ServiceDiscoveryEndpointGetter endpointGetter,
            AppVersionGetter appVersionGetter,
            PublicCidrBlocksGetter publicCidrBlocksGetter,
            AliasCertValidator aliasCertValidator,
            TopicLister topicLister,
            CustomResourceUploader customResourceUploader) {
        return new StackConfigurationBuilderRegistry(aliasValidator, topicSubscriptionResolver,
                serviceDiscoveryResolver, endpointGetter,
                appVersionGetter, publicCidrBlocksGetter, aliasCertValidator, topicLister, customResourceUploader);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ServiceStabilityChecker.class)
    public StabilityWaiter stabilityWaiter(ServiceStabilityChecker stabilityChecker,
                                           WorkloadDeployProperties properties) {
        WorkloadDeployProperties.Stability stability = properties.getStability();
        log.info("[WorkloadDeployAutoConfiguration] 稳定等待: interval={}, maxAttempts={}",
                stability.getInterval(), stability.getMaxAttempts());
        return new StabilityWaiter(stabilityChecker, stability.getInterval(), stability.getMaxAttempts(),
                properties.getStatusCommandTemplate());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({StackTemplateRenderer.class, StackProvisioner.class, ServiceForceUpdater.class,
            StabilityWaiter.class})
    public StackDeployer stackDeployer(StackTemplateRenderer templateRenderer,
                                       StackProvisioner provisioner,
                                       ServiceForceUpdater forceUpdater,
                                       StabilityWaiter stabilityWaiter,
                                       Clock clock,
                                       DomainEventPublisher eventPublisher,
                                       MetricsRegistry metricsRegistry) {
        return new StackDeployer(templateRenderer, provisioner, forceUpdater, stabilityWaiter, clock,
                eventPublisher, metricsRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({StackConfigurationBuilderRegistry.class, StackDeployer.class, Validator.class})
    public WorkloadDeploymentFacade workloadDeploymentFacade(StackConfigurationBuilderRegistry builderRegistry,
                                                             StackDeployer stackDeployer,
                                                             Validator validator) {
        return new WorkloadDeploymentFacade(builderRegistry, stackDeployer, validator);
    }
}
