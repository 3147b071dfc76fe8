package xyz.firestige.workload.service.certificate;

import java.util.List;

/**
 * 校验别名是否被导入证书覆盖
 */
@FunctionalInterface
public interface AliasCertValidator {

    /**
     * @throws Exception 存在未被任何证书覆盖的别名
     */
    void validateCertAliases(List<String> aliases, List<String> certArns) throws Exception;
}
