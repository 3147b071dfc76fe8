package xyz.firestige.workload.domain.alias;

/**
 * 通过校验的别名
 */
public record ValidatedAlias(String hostname, AliasScope scope) {
}
