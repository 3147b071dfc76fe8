package xyz.firestige.workload.domain.alias;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import xyz.firestige.workload.domain.environment.ApplicationInfo;
import xyz.firestige.workload.domain.manifest.Alias;
import xyz.firestige.workload.exception.AliasValidationException;
import xyz.firestige.workload.exception.AliasViolation;
import xyz.firestige.workload.exception.ErrorType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.firestige.workload.util.TestDataFactory.APP;
import static xyz.firestige.workload.util.TestDataFactory.ENV;
import static xyz.firestige.workload.util.TestDataFactory.appWithDomain;
import static xyz.firestige.workload.util.TestDataFactory.appWithoutDomain;
import static xyz.firestige.workload.util.TestDataFactory.env;
import static xyz.firestige.workload.util.TestDataFactory.envWithImportedCert;

/**
 * AliasValidator 单元测试
 * <p>
 * 域名层级：mockDomain（根）/ mockApp.mockDomain（应用）/ mockEnv.mockApp.mockDomain（环境）
 */
@Tag("unit")
@Tag("fast")
@DisplayName("AliasValidator 单元测试")
class AliasValidatorTest {

    private static final String VERSION = "v1.0.0";

    private AliasValidator validator;

    @BeforeEach
    void setUp() {
        validator = new AliasValidator("v1.0.0");
    }

    @Test
    @DisplayName("场景: 应用域名下一级的别名为服务级，校验通过")
    void serviceLevelAlias_isValid() {
        ValidatedAlias result = validator.validateAlias("v1.mockDomain", appWithDomain(), ENV, VERSION);

        assertThat(result.hostname()).isEqualTo("v1.mockDomain");
        assertThat(result.scope()).isEqualTo(AliasScope.SERVICE);
    }

    @Test
    @DisplayName("场景: 应用未关联域名时禁止设置别名")
    void noDomain_rejected() {
        assertThatThrownBy(() -> validator.validateAlias("v1.mockDomain", appWithoutDomain(), ENV, VERSION))
                .isInstanceOf(AliasValidationException.class)
                .hasMessage("cannot specify http.alias when application is not associated with a domain")
                .satisfies(e -> assertThat(((AliasValidationException) e).getViolation())
                        .isEqualTo(AliasViolation.NO_DOMAIN_ASSOCIATED));
    }

    @Test
    @DisplayName("场景: 域名检查先于版本检查")
    void noDomain_checkedBeforeVersion() {
        assertThatThrownBy(() -> validator.validateAlias("v1.mockDomain", appWithoutDomain(), ENV, "v0.0.1"))
                .isInstanceOf(AliasValidationException.class)
                .hasMessageContaining("not associated with a domain");
    }

    @Test
    @DisplayName("场景: 应用模板版本低于阈值时别名不可用")
    void versionBelowThreshold_rejected() {
        assertThatThrownBy(() -> validator.validateAlias("v1.mockDomain", appWithDomain(), ENV, "v0.0.9"))
                .isInstanceOf(AliasValidationException.class)
                .hasMessage("alias is not compatible with application versions below v1.0.0");
    }

    @Test
    @DisplayName("场景: 无法解析的版本视为低于阈值，且不解析别名")
    void unparsableVersion_rejectedBeforeParsing() {
        assertThatThrownBy(() -> validator.validateAlias("not even a hostname", appWithDomain(), ENV, "latest"))
                .isInstanceOf(AliasValidationException.class)
                .satisfies(e -> assertThat(((AliasValidationException) e).getViolation())
                        .isEqualTo(AliasViolation.INCOMPATIBLE_APP_VERSION));
    }

    @Test
    @DisplayName("场景: 根域名别名暂不支持")
    void rootDomainAlias_rejected() {
        ApplicationInfo app = new ApplicationInfo(APP, "example.com");

        assertThatThrownBy(() -> validator.validateAlias("example.com", app, ENV, VERSION))
                .isInstanceOf(AliasValidationException.class)
                .hasMessage("example.com is a root domain alias, which is not supported yet");
    }

    @Test
    @DisplayName("场景: 环境级别名暂不支持")
    void environmentLevelAlias_rejected() {
        assertThatThrownBy(() -> validator.validateAlias("mockEnv.mockApp.mockDomain", appWithDomain(), ENV, VERSION))
                .isInstanceOf(AliasValidationException.class)
                .hasMessage("mockEnv.mockApp.mockDomain is an environment-level alias, which is not supported yet");
        assertThatThrownBy(() -> validator.validateAlias("api.mockEnv.mockApp.mockDomain", appWithDomain(), ENV, VERSION))
                .hasMessageContaining("environment-level");
    }

    @Test
    @DisplayName("场景: 应用域名下唯一标签为环境名时按环境级拒绝")
    void envNameUnderDomain_rejectedAsEnvironmentLevel() {
        assertThatThrownBy(() -> validator.validateAlias("mockEnv.mockDomain", appWithDomain(), ENV, VERSION))
                .isInstanceOfSatisfying(AliasValidationException.class,
                        e -> assertThat(e.getViolation()).isEqualTo(AliasViolation.UNSUPPORTED_ALIAS_SCOPE))
                .hasMessage("mockEnv.mockDomain is an environment-level alias, which is not supported yet");
    }

    @ParameterizedTest
    @ValueSource(strings = {"mockApp.mockDomain", "v1.mockApp.mockDomain"})
    @DisplayName("场景: 应用级别名暂不支持")
    void applicationLevelAlias_rejected(String alias) {
        assertThatThrownBy(() -> validator.validateAlias(alias, appWithDomain(), ENV, VERSION))
                .isInstanceOf(AliasValidationException.class)
                .hasMessage(alias + " is an application-level alias, which is not supported yet");
    }

    @ParameterizedTest
    @ValueSource(strings = {"v1.someotherdomain", "a.b.mockDomain", "mockDomain.evil"})
    @DisplayName("场景: 不在应用托管 hosted zone 内的别名")
    void unmanagedHostedZone_rejected(String alias) {
        assertThatThrownBy(() -> validator.validateAlias(alias, appWithDomain(), ENV, VERSION))
                .isInstanceOf(AliasValidationException.class)
                .hasMessage("alias \"" + alias + "\" is not supported in hosted zones not managed by application mockApp")
                .satisfies(e -> assertThat(((AliasValidationException) e).getErrorType())
                        .isEqualTo(ErrorType.VALIDATION_ERROR));
    }

    @Test
    @DisplayName("场景: 域名比较不区分大小写")
    void caseInsensitiveMatch() {
        ValidatedAlias result = validator.validateAlias("V1.MockDomain", appWithDomain(), ENV, VERSION);

        assertThat(result.scope()).isEqualTo(AliasScope.SERVICE);
        assertThat(result.hostname()).isEqualTo("V1.MockDomain");
    }

    @Test
    @DisplayName("场景: 多个别名按声明顺序校验，第一个失败即终止")
    void multipleAliases_firstFailureWins() {
        Alias ok = Alias.of(List.of("b.mockDomain", "a.mockDomain", "b.mockDomain"));
        List<ValidatedAlias> result = validator.validateAliases(AliasValidator.HTTP_ALIAS_FIELD, ok,
                appWithDomain(), ENV, VERSION);
        assertThat(result).extracting(ValidatedAlias::hostname).containsExactly("b.mockDomain", "a.mockDomain");

        Alias bad = Alias.of(List.of("a.mockDomain", "mockApp.mockDomain", "x.other"));
        assertThatThrownBy(() -> validator.validateAliases(AliasValidator.HTTP_ALIAS_FIELD, bad,
                appWithDomain(), ENV, VERSION))
                .hasMessageContaining("application-level");
    }

    @Test
    @DisplayName("场景: 环境导入证书时禁止 nlb.alias")
    void nlbAliasWithImportedCertificates_rejected() {
        assertThatThrownBy(() -> validator.rejectNlbAliasWithImportedCertificates(
                Alias.of("v1.mockDomain"), envWithImportedCert()))
                .isInstanceOf(AliasValidationException.class)
                .hasMessage("cannot specify nlb.alias when env mockEnv imports one or more certificates");

        validator.rejectNlbAliasWithImportedCertificates(Alias.of("v1.mockDomain"), env());
        validator.rejectNlbAliasWithImportedCertificates(Alias.empty(), envWithImportedCert());
    }

    @Test
    @DisplayName("场景: 最低版本配置格式错误时构造失败")
    void invalidThreshold_rejected() {
        assertThatThrownBy(() -> new AliasValidator("not-a-version"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
