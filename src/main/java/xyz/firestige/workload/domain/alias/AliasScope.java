package xyz.firestige.workload.domain.alias;

/**
 * 别名所在层级
 */
public enum AliasScope {

    /** svc.domain：服务级，唯一受支持的托管层级 */
    SERVICE,

    /** 环境 hosted zone（env.app.domain 及其下级） */
    ENVIRONMENT,

    /** 应用 hosted zone（app.domain 及其下级） */
    APPLICATION,

    /** 根域名本身 */
    ROOT,

    /** 由导入证书覆盖的别名，不走托管 hosted zone */
    IMPORTED_CERTIFICATE;

    public boolean isSupported() {
        return this == SERVICE || this == IMPORTED_CERTIFICATE;
    }
}
