package xyz.firestige.workload.service.environment;

/**
 * 应用模板版本，如 v1.0.0
 */
@FunctionalInterface
public interface AppVersionGetter {

    String version(String app) throws Exception;
}
