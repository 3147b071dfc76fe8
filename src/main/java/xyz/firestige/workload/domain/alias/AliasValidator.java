package xyz.firestige.workload.domain.alias;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.workload.domain.environment.ApplicationInfo;
import xyz.firestige.workload.domain.environment.EnvironmentInfo;
import xyz.firestige.workload.domain.manifest.Alias;
import xyz.firestige.workload.domain.shared.vo.TemplateVersion;
import xyz.firestige.workload.exception.AliasValidationException;
import xyz.firestige.workload.exception.AliasViolation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 别名/域名校验器
 *
 * 职责：
 * - 校验别名与应用域名、应用模板版本之间的约束
 * - 按相对应用域名的层级对别名分类（服务级 / 环境级 / 应用级 / 根域名）
 * - 校验 NLB 别名与环境导入证书的互斥关系
 *
 * 注意：
 * - 纯函数，无 I/O，无状态，可并发调用
 * - 所有错误都是清单错误，不可重试
 * - 检查顺序固定：域名关联 → 模板版本 → 字符串解析，先失败者胜出
 */
public class AliasValidator {

    private static final Logger logger = LoggerFactory.getLogger(AliasValidator.class);

    public static final String HTTP_ALIAS_FIELD = "http.alias";
    public static final String NLB_ALIAS_FIELD = "nlb.alias";

    private final TemplateVersion leastAppTemplateVersion;

    public AliasValidator(String leastAppTemplateVersion) {
        TemplateVersion version = TemplateVersion.of(leastAppTemplateVersion);
        if (!version.isValid()) {
            throw new IllegalArgumentException("别名最低应用模板版本格式错误: " + leastAppTemplateVersion);
        }
        this.leastAppTemplateVersion = version;
    }

    /**
     * 校验单个别名
     *
     * @param alias              主机名
     * @param app                应用记录
     * @param envName            目标环境名称
     * @param appTemplateVersion 应用模板版本
     * @return 服务级别名
     * @throws AliasValidationException 校验失败
     */
    public ValidatedAlias validateAlias(String alias, ApplicationInfo app, String envName, String appTemplateVersion) {
        return validateAlias(HTTP_ALIAS_FIELD, alias, app, envName, appTemplateVersion);
    }

    /**
     * 校验单个别名，field 用于错误消息（http.alias / nlb.alias）
     */
    public ValidatedAlias validateAlias(String field, String alias, ApplicationInfo app, String envName,
                                       String appTemplateVersion) {
        Objects.requireNonNull(app, "app");
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("alias must not be blank");
        }
        requireDomain(field, alias, app);
        requireCompatibleVersion(appTemplateVersion);
        return new ValidatedAlias(alias, classify(alias, app, envName));
    }

    /**
     * 依次校验每个别名，保持声明顺序
     */
    public List<ValidatedAlias> validateAliases(String field, Alias aliases, ApplicationInfo app, String envName,
                                                String appTemplateVersion) {
        List<ValidatedAlias> result = new ArrayList<>();
        if (aliases == null || aliases.isEmpty()) {
            return result;
        }
        requireDomain(field, aliases.toString(), app);
        requireCompatibleVersion(appTemplateVersion);
        for (String hostname : aliases.hostnames()) {
            result.add(new ValidatedAlias(hostname, classify(hostname, app, envName)));
        }
        logger.debug("[AliasValidator] {} 校验通过: {}", field, aliases);
        return result;
    }

    /**
     * 应用必须关联域名才能设置别名，与环境证书状态无关
     */
    public void requireDomain(String field, String alias, ApplicationInfo app) {
        if (!app.hasDomain()) {
            throw new AliasValidationException(AliasViolation.NO_DOMAIN_ASSOCIATED, alias,
                    String.format("cannot specify %s when application is not associated with a domain", field));
        }
    }

    /**
     * 应用模板版本必须不低于别名支持的最低版本
     */
    public void requireCompatibleVersion(String appTemplateVersion) {
        if (TemplateVersion.of(appTemplateVersion).isBelow(leastAppTemplateVersion)) {
            logger.warn("[AliasValidator] 应用模板版本 {} 低于 {}，不支持别名", appTemplateVersion, leastAppTemplateVersion);
            throw new AliasValidationException(AliasViolation.INCOMPATIBLE_APP_VERSION, null,
                    String.format("alias is not compatible with application versions below %s", leastAppTemplateVersion));
        }
    }

    /**
     * 环境导入证书时禁止 NLB 别名（NLB 无对应证书路径），与别名本身是否合法无关
     */
    public void rejectNlbAliasWithImportedCertificates(Alias nlbAliases, EnvironmentInfo env) {
        if (nlbAliases != null && !nlbAliases.isEmpty() && env.hasImportedCertificates()) {
            throw new AliasValidationException(AliasViolation.NLB_ALIAS_WITH_IMPORTED_CERTIFICATES, nlbAliases.toString(),
                    String.format("cannot specify %s when env %s imports one or more certificates",
                            NLB_ALIAS_FIELD, env.name()));
        }
    }

    /**
     * 按层级对别名分类，只有服务级返回，其余抛出异常
     */
    AliasScope classify(String alias, ApplicationInfo app, String envName) {
        String host = lower(alias);
        String domain = lower(app.domain());
        if (host.equals(domain)) {
            throw unsupportedScope(alias, "a root domain");
        }
        if (!host.endsWith("." + domain)) {
            throw unsupportedHostedZone(alias, app.name());
        }
        String sub = host.substring(0, host.length() - domain.length() - 1);
        String appLabel = lower(app.name());
        if (sub.equals(appLabel)) {
            throw unsupportedScope(alias, "an application-level");
        }
        if (sub.endsWith("." + appLabel)) {
            String prefix = sub.substring(0, sub.length() - appLabel.length() - 1);
            String envLabel = lower(envName);
            if (prefix.equals(envLabel) || prefix.endsWith("." + envLabel)) {
                throw unsupportedScope(alias, "an environment-level");
            }
            throw unsupportedScope(alias, "an application-level");
        }
        if (sub.contains(".")) {
            throw unsupportedHostedZone(alias, app.name());
        }
        if (sub.equals(lower(envName))) {
            // <env>.<domain>，唯一的额外标签是环境名
            throw unsupportedScope(alias, "an environment-level");
        }
        return AliasScope.SERVICE;
    }

    private static AliasValidationException unsupportedScope(String alias, String scope) {
        return new AliasValidationException(AliasViolation.UNSUPPORTED_ALIAS_SCOPE, alias,
                String.format("%s is %s alias, which is not supported yet", alias, scope));
    }

    private static AliasValidationException unsupportedHostedZone(String alias, String appName) {
        return new AliasValidationException(AliasViolation.UNSUPPORTED_HOSTED_ZONE, alias,
                String.format("alias \"%s\" is not supported in hosted zones not managed by application %s",
                        alias, appName));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    public String getLeastAppTemplateVersion() {
        return leastAppTemplateVersion.toString();
    }
}
