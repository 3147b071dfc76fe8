package xyz.firestige.workload.application.stack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.workload.domain.alias.AliasValidator;
import xyz.firestige.workload.domain.alias.ValidatedAlias;
import xyz.firestige.workload.domain.deploy.DeployOptions;
import xyz.firestige.workload.domain.environment.EnvironmentInfo;
import xyz.firestige.workload.domain.manifest.Alias;
import xyz.firestige.workload.domain.manifest.LoadBalancedWebServiceManifest;
import xyz.firestige.workload.domain.shared.vo.WorkloadKind;
import xyz.firestige.workload.domain.stack.LoadBalancedWebServiceSection;
import xyz.firestige.workload.domain.stack.StackConfiguration;
import xyz.firestige.workload.domain.stack.StackRuntimeConfiguration;
import xyz.firestige.workload.exception.AliasValidationException;
import xyz.firestige.workload.exception.AliasViolation;
import xyz.firestige.workload.exception.EnvironmentQueryException;
import xyz.firestige.workload.service.certificate.AliasCertValidator;
import xyz.firestige.workload.service.environment.PublicCidrBlocksGetter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 负载均衡 Web 服务配置构建器
 *
 * 在公共步骤之外：
 * - 环境导入证书时 http.alias 必填，且别名交给证书校验器，不再按托管 hosted zone 分类
 * - 环境导入证书时禁止 nlb.alias
 * - 启用 NLB 端口时查询环境公网网段
 */
public class LoadBalancedWebServiceStackBuilder implements StackConfigurationBuilder {

    private static final Logger logger = LoggerFactory.getLogger(LoadBalancedWebServiceStackBuilder.class);

    private final WorkloadStackContext context;
    private final LoadBalancedWebServiceManifest manifest;
    private final PublicCidrBlocksGetter publicCidrBlocksGetter;
    private final AliasCertValidator aliasCertValidator;

    public LoadBalancedWebServiceStackBuilder(WorkloadStackContext context,
                                              LoadBalancedWebServiceManifest manifest,
                                              PublicCidrBlocksGetter publicCidrBlocksGetter,
                                              AliasCertValidator aliasCertValidator) {
        this.context = context;
        this.manifest = manifest;
        this.publicCidrBlocksGetter = publicCidrBlocksGetter;
        this.aliasCertValidator = aliasCertValidator;
    }

    @Override
    public WorkloadKind kind() {
        return WorkloadKind.LOAD_BALANCED_WEB_SERVICE;
    }

    @Override
    public StackConfiguration stackConfiguration(StackRuntimeConfiguration runtime, DeployOptions options) {
        EnvironmentInfo env = context.env();
        logger.info("[LoadBalancedWebServiceStackBuilder] 构建配置: {}, env={}", manifest.name(), env.name());

        String endpoint = context.resolveServiceDiscoveryEndpoint();
        List<String> httpAliases = validateHttpAlias(env);
        List<String> nlbAliases = validateNlbAlias(env);
        List<String> cidrBlocks = manifest.nlb().isEnabled() ? publicCidrBlocks(env) : List.of();

        LoadBalancedWebServiceSection section = new LoadBalancedWebServiceSection(
                httpAliases, manifest.nlb().port(), nlbAliases, cidrBlocks,
                context.serviceDiscovery(manifest.port()));
        return context.assemble(runtime, options, endpoint, section);
    }

    private List<String> validateHttpAlias(EnvironmentInfo env) {
        Alias alias = manifest.httpAlias();
        if (env.hasImportedCertificates() && alias.isEmpty()) {
            throw new AliasValidationException(AliasViolation.ALIAS_REQUIRED, null,
                    String.format("cannot deploy service %s without http.alias to environment %s with certificate imported",
                            manifest.name(), env.name()));
        }
        if (alias.isEmpty()) {
            return List.of();
        }
        AliasValidator validator = context.aliasValidator();
        validator.requireDomain(AliasValidator.HTTP_ALIAS_FIELD, alias.toString(), context.app());
        validator.requireCompatibleVersion(context.appTemplateVersion());
        if (env.hasImportedCertificates()) {
            try {
                aliasCertValidator.validateCertAliases(alias.hostnames(), env.importCertArns());
            } catch (Exception e) {
                throw new AliasValidationException(AliasViolation.CERTIFICATE_MISMATCH, alias.toString(),
                        "validate aliases against the imported certificate for env " + env.name(), e);
            }
            return alias.hostnames();
        }
        return hostnames(validator.validateAliases(AliasValidator.HTTP_ALIAS_FIELD, alias, context.app(),
                env.name(), context.appTemplateVersion()));
    }

    private List<String> validateNlbAlias(EnvironmentInfo env) {
        Alias alias = manifest.nlb().aliases();
        if (alias.isEmpty()) {
            return List.of();
        }
        AliasValidator validator = context.aliasValidator();
        validator.rejectNlbAliasWithImportedCertificates(alias, env);
        validator.requireDomain(AliasValidator.NLB_ALIAS_FIELD, alias.toString(), context.app());
        return hostnames(validator.validateAliases(AliasValidator.NLB_ALIAS_FIELD, alias, context.app(),
                env.name(), context.appTemplateVersion()));
    }

    private List<String> publicCidrBlocks(EnvironmentInfo env) {
        try {
            return publicCidrBlocksGetter.publicCidrBlocks(context.app().name(), env.name());
        } catch (Exception e) {
            throw new EnvironmentQueryException(
                    "get public CIDR blocks information from the VPC of environment " + env.name(), env.name(), e);
        }
    }

    private static List<String> hostnames(List<ValidatedAlias> aliases) {
        return aliases.stream().map(ValidatedAlias::hostname).collect(Collectors.toList());
    }
}
