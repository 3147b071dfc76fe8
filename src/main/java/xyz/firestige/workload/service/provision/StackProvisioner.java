package xyz.firestige.workload.service.provision;

import xyz.firestige.workload.domain.deploy.DeployOptions;
import xyz.firestige.workload.exception.ChangeSetEmptyException;

/**
 * 部署后端
 * <p>
 * 重试 / 退避策略属于后端客户端自身，调用方不再重试。
 */
public interface StackProvisioner {

    /**
     * 提交栈定义
     *
     * @param stackName      栈名称
     * @param document       渲染后的模板
     * @param artifactBucket 产物桶
     * @param options        部署选项，disableRollback 由后端解释
     * @throws ChangeSetEmptyException 变更集为空
     * @throws Exception               其他后端错误
     */
    void submit(String stackName, String document, String artifactBucket, DeployOptions options) throws Exception;
}
