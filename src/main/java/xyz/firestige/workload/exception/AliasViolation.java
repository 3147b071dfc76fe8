package xyz.firestige.workload.exception;

/**
 * 别名校验失败原因
 */
public enum AliasViolation {

    /** 应用未关联域名 */
    NO_DOMAIN_ASSOCIATED,

    /** 应用模板版本低于别名支持的最低版本 */
    INCOMPATIBLE_APP_VERSION,

    /** 别名不在应用托管的域名之下 */
    UNSUPPORTED_HOSTED_ZONE,

    /** 根域名、环境级或应用级别名，暂不支持 */
    UNSUPPORTED_ALIAS_SCOPE,

    /** 环境导入证书时缺少 http.alias */
    ALIAS_REQUIRED,

    /** 环境导入证书时设置了 nlb.alias */
    NLB_ALIAS_WITH_IMPORTED_CERTIFICATES,

    /** 别名未被导入证书覆盖 */
    CERTIFICATE_MISMATCH
}
