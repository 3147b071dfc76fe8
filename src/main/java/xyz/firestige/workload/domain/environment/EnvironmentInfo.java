package xyz.firestige.workload.domain.environment;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * 环境记录
 *
 * @param name           环境名称
 * @param region         区域
 * @param importCertArns 外部导入的证书 ARN，非空时环境不使用托管的 hosted zone
 */
public record EnvironmentInfo(
        @NotBlank(message = "环境名称不能为空") String name,
        String region,
        List<String> importCertArns) {

    public EnvironmentInfo {
        importCertArns = importCertArns == null ? List.of() : List.copyOf(importCertArns);
    }

    public static EnvironmentInfo of(String name, String region) {
        return new EnvironmentInfo(name, region, List.of());
    }

    public boolean hasImportedCertificates() {
        return !importCertArns.isEmpty();
    }
}
