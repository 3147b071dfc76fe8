package xyz.firestige.workload.service.provision;

import xyz.firestige.workload.domain.stack.StackConfiguration;

/**
 * 模板渲染器：配置 → 后端原生的栈定义文档
 * 给定配置时结果确定
 */
@FunctionalInterface
public interface StackTemplateRenderer {

    String render(StackConfiguration configuration) throws Exception;
}
