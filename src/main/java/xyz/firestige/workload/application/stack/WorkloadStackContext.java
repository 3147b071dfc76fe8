package xyz.firestige.workload.application.stack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.workload.domain.alias.AliasValidator;
import xyz.firestige.workload.domain.deploy.DeployOptions;
import xyz.firestige.workload.domain.discovery.ServiceDiscoveryResolver;
import xyz.firestige.workload.domain.environment.ApplicationInfo;
import xyz.firestige.workload.domain.environment.EnvironmentInfo;
import xyz.firestige.workload.domain.shared.vo.WorkloadIdentity;
import xyz.firestige.workload.domain.shared.vo.WorkloadKind;
import xyz.firestige.workload.domain.stack.StackConfiguration;
import xyz.firestige.workload.domain.stack.StackExtension;
import xyz.firestige.workload.domain.stack.StackRuntimeConfiguration;
import xyz.firestige.workload.exception.EnvironmentQueryException;
import xyz.firestige.workload.service.environment.AppVersionGetter;
import xyz.firestige.workload.service.environment.ServiceDiscoveryEndpointGetter;

import java.util.Objects;

/**
 * 各类型构建器共享的部署上下文与公共步骤
 *
 * 职责：
 * - 持有工作负载标识、应用和环境记录
 * - 解析服务发现端点（步骤 1）与工作负载自身的服务发现记录
 * - 按需查询应用模板版本，每次构建最多查询一次
 * - 组装公共字段后交给各类型补充配置段
 *
 * 注意：每次部署新建，不跨调用共享
 */
public class WorkloadStackContext {

    private static final Logger logger = LoggerFactory.getLogger(WorkloadStackContext.class);

    private final WorkloadIdentity identity;
    private final ApplicationInfo app;
    private final EnvironmentInfo env;
    private final AliasValidator aliasValidator;
    private final ServiceDiscoveryResolver discoveryResolver;
    private final ServiceDiscoveryEndpointGetter endpointGetter;
    private final AppVersionGetter appVersionGetter;

    private String appVersion;

    public WorkloadStackContext(String workloadName,
                                WorkloadKind kind,
                                ApplicationInfo app,
                                EnvironmentInfo env,
                                AliasValidator aliasValidator,
                                ServiceDiscoveryResolver discoveryResolver,
                                ServiceDiscoveryEndpointGetter endpointGetter,
                                AppVersionGetter appVersionGetter) {
        this.app = Objects.requireNonNull(app, "app");
        this.env = Objects.requireNonNull(env, "env");
        this.identity = new WorkloadIdentity(workloadName, kind, app.name(), env.name());
        this.aliasValidator = Objects.requireNonNull(aliasValidator, "aliasValidator");
        this.discoveryResolver = Objects.requireNonNull(discoveryResolver, "discoveryResolver");
        this.endpointGetter = Objects.requireNonNull(endpointGetter, "endpointGetter");
        this.appVersionGetter = Objects.requireNonNull(appVersionGetter, "appVersionGetter");
    }

    /**
     * 步骤 1：环境的服务发现端点，失败即终止
     */
    public String resolveServiceDiscoveryEndpoint() {
        try {
            String endpoint = endpointGetter.serviceDiscoveryEndpoint(app.name(), env.name());
            logger.debug("[WorkloadStackContext] 服务发现端点: {}, env={}", endpoint, env.name());
            return endpoint;
        } catch (Exception e) {
            throw new EnvironmentQueryException("get service discovery endpoint", env.name(), e);
        }
    }

    /**
     * 工作负载的服务发现记录，未声明端口的服务不注册，返回 null
     */
    public String serviceDiscovery(Integer port) {
        if (port == null) {
            return null;
        }
        return discoveryResolver.resolveDiscovery(identity.name(), app.name(), port);
    }

    /**
     * 应用模板版本，仅在设置了别名时查询
     */
    public String appTemplateVersion() {
        if (appVersion == null) {
            try {
                appVersion = appVersionGetter.version(app.name());
            } catch (Exception e) {
                throw new EnvironmentQueryException("get version for app " + app.name(), env.name(), e);
            }
            logger.debug("[WorkloadStackContext] 应用 {} 模板版本: {}", app.name(), appVersion);
        }
        return appVersion;
    }

    /**
     * 步骤 6：组装，无 I/O，不会失败
     */
    public StackConfiguration assemble(StackRuntimeConfiguration runtime, DeployOptions options,
                                       String serviceDiscoveryEndpoint, StackExtension extension) {
        StackConfiguration configuration = StackConfiguration.builder()
                .identity(identity)
                .runtime(runtime)
                .serviceDiscoveryEndpoint(serviceDiscoveryEndpoint)
                .importedCertArns(env.importCertArns())
                .options(options)
                .extension(extension)
                .build();
        logger.info("[WorkloadStackContext] 配置组装完成: {}", configuration);
        return configuration;
    }

    public WorkloadIdentity identity() {
        return identity;
    }

    public ApplicationInfo app() {
        return app;
    }

    public EnvironmentInfo env() {
        return env;
    }

    public AliasValidator aliasValidator() {
        return aliasValidator;
    }
}
