package xyz.firestige.workload.service.artifact;

import java.util.Map;

/**
 * 上传请求驱动服务所需的自定义编排资源
 */
@FunctionalInterface
public interface CustomResourceUploader {

    /**
     * @return 资源名称 → URL
     */
    Map<String, String> uploadRequestDrivenWebServiceCustomResources(String workload) throws Exception;
}
