package xyz.firestige.workload.domain.environment;

import jakarta.validation.constraints.NotBlank;

/**
 * 应用记录
 *
 * @param name   应用名称
 * @param domain 应用关联的域名，未关联时为空字符串
 */
public record ApplicationInfo(
        @NotBlank(message = "应用名称不能为空") String name,
        String domain) {

    public ApplicationInfo {
        domain = domain == null ? "" : domain.trim();
    }

    public static ApplicationInfo withoutDomain(String name) {
        return new ApplicationInfo(name, "");
    }

    public boolean hasDomain() {
        return !domain.isEmpty();
    }
}
