package xyz.firestige.workload.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 工作负载部署配置
 * prefix: workload.deploy
 */
@Validated
@ConfigurationProperties(prefix = "workload.deploy")
public class WorkloadDeployProperties {

    @Valid
    @NestedConfigurationProperty
    private Stability stability = new Stability();

    @Valid
    @NestedConfigurationProperty
    private AliasSettings alias = new AliasSettings();

    /**
     * 稳定等待超时后提示用户查看服务状态的命令，参数依次为服务名、环境名
     */
    private String statusCommandTemplate = "svc status --name %s --env %s";

    public Stability getStability() { return stability; }
    public void setStability(Stability stability) { this.stability = stability; }

    public AliasSettings getAlias() { return alias; }
    public void setAlias(AliasSettings alias) { this.alias = alias; }

    public String getStatusCommandTemplate() { return statusCommandTemplate; }
    public void setStatusCommandTemplate(String statusCommandTemplate) { this.statusCommandTemplate = statusCommandTemplate; }

    /**
     * 强制更新后的稳定轮询
     */
    public static class Stability {
        @NotNull
        private Duration interval = Duration.ofSeconds(15);

        @Min(1)
        private int maxAttempts = 80;

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class AliasSettings {
        /**
         * 支持别名的最低应用模板版本
         */
        @NotBlank
        private String leastAppTemplateVersion = "v1.0.0";

        public String getLeastAppTemplateVersion() { return leastAppTemplateVersion; }
        public void setLeastAppTemplateVersion(String v) { this.leastAppTemplateVersion = v; }
    }
}
