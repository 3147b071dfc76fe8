package xyz.firestige.workload.application.stack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.workload.domain.alias.AliasValidator;
import xyz.firestige.workload.domain.deploy.DeployOptions;
import xyz.firestige.workload.domain.manifest.RequestDrivenWebServiceManifest;
import xyz.firestige.workload.domain.shared.vo.WorkloadKind;
import xyz.firestige.workload.domain.stack.RequestDrivenWebServiceSection;
import xyz.firestige.workload.domain.stack.StackConfiguration;
import xyz.firestige.workload.domain.stack.StackRuntimeConfiguration;
import xyz.firestige.workload.exception.ArtifactUploadException;
import xyz.firestige.workload.service.artifact.CustomResourceUploader;

import java.util.Map;

/**
 * 请求驱动 Web 服务配置构建器
 * <p>
 * 别名按服务级规则校验；按服务名上传自定义编排资源，上传失败终止部署。
 */
public class RequestDrivenWebServiceStackBuilder implements StackConfigurationBuilder {

    private static final Logger logger = LoggerFactory.getLogger(RequestDrivenWebServiceStackBuilder.class);

    private final WorkloadStackContext context;
    private final RequestDrivenWebServiceManifest manifest;
    private final CustomResourceUploader customResourceUploader;

    public RequestDrivenWebServiceStackBuilder(WorkloadStackContext context,
                                               RequestDrivenWebServiceManifest manifest,
                                               CustomResourceUploader customResourceUploader) {
        this.context = context;
        this.manifest = manifest;
        this.customResourceUploader = customResourceUploader;
    }

    @Override
    public WorkloadKind kind() {
        return WorkloadKind.REQUEST_DRIVEN_WEB_SERVICE;
    }

    @Override
    public StackConfiguration stackConfiguration(StackRuntimeConfiguration runtime, DeployOptions options) {
        logger.info("[RequestDrivenWebServiceStackBuilder] 构建配置: {}, env={}", manifest.name(), context.env().name());

        String endpoint = context.resolveServiceDiscoveryEndpoint();
        String alias = null;
        if (manifest.hasAlias()) {
            AliasValidator validator = context.aliasValidator();
            validator.requireDomain(AliasValidator.HTTP_ALIAS_FIELD, manifest.alias(), context.app());
            alias = validator.validateAlias(manifest.alias(), context.app(), context.env().name(),
                    context.appTemplateVersion()).hostname();
        }

        Map<String, String> urls;
        try {
            urls = customResourceUploader.uploadRequestDrivenWebServiceCustomResources(manifest.name());
        } catch (Exception e) {
            throw new ArtifactUploadException("upload custom resources to bucket " + runtime.artifactBucket(), e);
        }
        logger.debug("[RequestDrivenWebServiceStackBuilder] 自定义资源已上传: {}", urls.keySet());

        return context.assemble(runtime, options, endpoint, new RequestDrivenWebServiceSection(alias, urls,
                context.serviceDiscovery(manifest.port())));
    }
}
