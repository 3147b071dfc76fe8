package xyz.firestige.workload.exception;

/**
 * 订阅的 Topic 未部署在目标环境中
 */
public class TopicNotFoundException extends WorkloadDeployException {

    private final String topicName;
    private final String environment;

    public TopicNotFoundException(String topicName, String environment) {
        super(String.format("SNS topic %s does not exist in environment %s", topicName, environment),
                ErrorType.VALIDATION_ERROR);
        this.topicName = topicName;
        this.environment = environment;
        addContext("topic", topicName);
        addContext("environment", environment);
    }

    public String getTopicName() {
        return topicName;
    }

    public String getEnvironment() {
        return environment;
    }
}
