package xyz.firestige.workload.service.environment;

import java.util.List;

/**
 * 环境 VPC 的公网入口网段
 */
@FunctionalInterface
public interface PublicCidrBlocksGetter {

    List<String> publicCidrBlocks(String app, String env) throws Exception;
}
