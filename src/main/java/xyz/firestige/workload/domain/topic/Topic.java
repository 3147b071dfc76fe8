package xyz.firestige.workload.domain.topic;

import java.util.Objects;

/**
 * 已部署的 Topic
 * <p>
 * ARN 资源名格式为 app-env-workload-name。
 */
public final class Topic {

    private final String arn;
    private final String application;
    private final String environment;
    private final String workload;
    private final String name;

    private Topic(String arn, String application, String environment, String workload, String name) {
        this.arn = arn;
        this.application = application;
        this.environment = environment;
        this.workload = workload;
        this.name = name;
    }

    /**
     * 由 ARN 和已知的 app/env/workload 构造
     *
     * @throws IllegalArgumentException ARN 资源名不以 app-env-workload- 开头
     */
    public static Topic of(String arn, String application, String environment, String workload) {
        ParsedTopic parsed = TopicArnParser.parse(arn, application, environment, workload);
        if (!parsed.isTopic()) {
            throw new IllegalArgumentException(parsed.reason());
        }
        return parsed.topic();
    }

    static Topic trusted(String arn, String application, String environment, String workload, String name) {
        return new Topic(arn, application, environment, workload, name);
    }

    /**
     * 资源名 app-env-workload-name
     */
    public String resourceName() {
        return String.format("%s-%s-%s-%s", application, environment, workload, name);
    }

    public String getArn() {
        return arn;
    }

    public String getApplication() {
        return application;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getWorkload() {
        return workload;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(arn, ((Topic) o).arn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(arn);
    }

    @Override
    public String toString() {
        return resourceName();
    }
}
