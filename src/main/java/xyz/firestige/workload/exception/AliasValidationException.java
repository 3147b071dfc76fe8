package xyz.firestige.workload.exception;

/**
 * 别名校验异常
 * 清单错误，不可重试，原样返回给调用方
 */
public class AliasValidationException extends WorkloadDeployException {

    private final AliasViolation violation;
    private final String alias;

    public AliasValidationException(AliasViolation violation, String alias, String message) {
        super(message, ErrorType.VALIDATION_ERROR);
        this.violation = violation;
        this.alias = alias;
        addContext("violation", violation);
        if (alias != null) {
            addContext("alias", alias);
        }
    }

    public AliasValidationException(AliasViolation violation, String alias, String operation, Throwable cause) {
        super(describe(operation, cause), ErrorType.VALIDATION_ERROR, cause);
        this.violation = violation;
        this.alias = alias;
        addContext("violation", violation);
        if (alias != null) {
            addContext("alias", alias);
        }
    }

    public AliasViolation getViolation() {
        return violation;
    }

    public String getAlias() {
        return alias;
    }
}
