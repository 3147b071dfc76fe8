package xyz.firestige.workload.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import xyz.firestige.workload.application.deploy.StabilityWaiter;
import xyz.firestige.workload.application.deploy.StackDeployer;
import xyz.firestige.workload.application.stack.StackConfigurationBuilderRegistry;
import xyz.firestige.workload.config.WorkloadDeployProperties;
import xyz.firestige.workload.domain.alias.AliasValidator;
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
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * 工作负载部署自动配置测试
 */
class WorkloadDeployAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class,
                WorkloadDeployAutoConfiguration.class));

    private ApplicationContextRunner withCollaborators() {
        return contextRunner
            .withBean(ServiceDiscoveryEndpointGetter.class, () -> mock(ServiceDiscoveryEndpointGetter.class))
            .withBean(AppVersionGetter.class, () -> mock(AppVersionGetter.class))
            .withBean(PublicCidrBlocksGetter.class, () -> mock(PublicCidrBlocksGetter.class))
            .withBean(AliasCertValidator.class, () -> mock(AliasCertValidator.class))
            .withBean(TopicLister.class, () -> mock(TopicLister.class))
            .withBean(CustomResourceUploader.class, () -> mock(CustomResourceUploader.class))
            .withBean(StackTemplateRenderer.class, () -> mock(StackTemplateRenderer.class))
            .withBean(StackProvisioner.class, () -> mock(StackProvisioner.class))
            .withBean(ServiceForceUpdater.class, () -> mock(ServiceForceUpdater.class))
            .withBean(ServiceStabilityChecker.class, () -> mock(ServiceStabilityChecker.class));
    }

    @Test
    void autoConfiguration_withoutCollaborators_createsOnlyDomainBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(AliasValidator.class);
            assertThat(context).hasSingleBean(Clock.class);
            assertThat(context).doesNotHaveBean(StackDeployer.class);
            assertThat(context).doesNotHaveBean(WorkloadDeploymentFacade.class);
            assertThat(context.getBean(DomainEventPublisher.class)).isInstanceOf(SpringDomainEventPublisher.class);
            assertThat(context.getBean(MetricsRegistry.class)).isInstanceOf(NoopMetricsRegistry.class);
        });
    }

    @Test
    void autoConfiguration_withCollaborators_createsFacade() {
        withCollaborators().run(context -> {
            assertThat(context).hasSingleBean(StackConfigurationBuilderRegistry.class);
            assertThat(context).hasSingleBean(StackDeployer.class);
            assertThat(context).hasSingleBean(WorkloadDeploymentFacade.class);
        });
    }

    @Test
    void metrics_withMeterRegistry_usesMicrometer() {
        contextRunner
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .run(context -> {
                MetricsRegistry metrics = context.getBean(MetricsRegistry.class);
                assertThat(metrics).isInstanceOf(MicrometerMetricsRegistry.class);
                metrics.incrementCounter(MetricsRegistry.SUBMITTED);
                assertThat(context.getBean(MeterRegistry.class).counter(MetricsRegistry.SUBMITTED).count())
                        .isEqualTo(1.0);
            });
    }

    @Test
    void properties_defaultValues_loaded() {
        withCollaborators().run(context -> {
            WorkloadDeployProperties properties = context.getBean(WorkloadDeployProperties.class);
            assertThat(properties.getStability().getInterval()).isEqualTo(Duration.ofSeconds(15));
            assertThat(properties.getStability().getMaxAttempts()).isEqualTo(80);
            assertThat(properties.getAlias().getLeastAppTemplateVersion()).isEqualTo("v1.0.0");
            assertThat(properties.getStatusCommandTemplate()).isEqualTo("svc status --name %s --env %s");
        });
    }

    @Test
    void properties_customValues_loaded() {
        withCollaborators()
            .withPropertyValues(
                "workload.deploy.stability.interval=2s",
                "workload.deploy.stability.max-attempts=5",
                "workload.deploy.alias.least-app-template-version=v1.2.0"
            )
            .run(context -> {
                StabilityWaiter waiter = context.getBean(StabilityWaiter.class);
                assertThat(waiter.getInterval()).isEqualTo(Duration.ofSeconds(2));
                assertThat(waiter.getMaxAttempts()).isEqualTo(5);
                assertThat(context.getBean(AliasValidator.class).getLeastAppTemplateVersion()).isEqualTo("v1.2.0");
            });
    }

    @Test
    void properties_invalidMaxAttempts_failsStartup() {
        contextRunner
            .withPropertyValues("workload.deploy.stability.max-attempts=0")
            .run(context -> assertThat(context).hasFailed());
    }
}
