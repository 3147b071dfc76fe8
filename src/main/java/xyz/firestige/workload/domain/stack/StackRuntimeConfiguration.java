package xyz.firestige.workload.domain.stack;

/**
 * 已上传构建产物的引用
 *
 * @param addonsUrl      附加模板 URL，无附加资源时为空
 * @param envFileArn     环境变量文件 ARN，可为空
 * @param imageDigest    镜像摘要，未构建镜像时为空
 * @param artifactBucket 区域产物桶名称
 */
public record StackRuntimeConfiguration(
        String addonsUrl,
        String envFileArn,
        String imageDigest,
        String artifactBucket) {

    public static StackRuntimeConfiguration empty(String artifactBucket) {
        return new StackRuntimeConfiguration(null, null, null, artifactBucket);
    }
}
