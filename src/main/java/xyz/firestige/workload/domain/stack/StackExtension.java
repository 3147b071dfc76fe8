package xyz.firestige.workload.domain.stack;

/**
 * 按工作负载类型区分的配置段（网络 / 消息）
 */
public interface StackExtension {
}
