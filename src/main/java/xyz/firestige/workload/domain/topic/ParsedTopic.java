package xyz.firestige.workload.domain.topic;

/**
 * ARN 解析结果：要么是 Topic，要么说明为什么不是
 */
public final class ParsedTopic {

    private final Topic topic;
    private final String arn;
    private final String reason;

    private ParsedTopic(Topic topic, String arn, String reason) {
        this.topic = topic;
        this.arn = arn;
        this.reason = reason;
    }

    static ParsedTopic topic(Topic topic) {
        return new ParsedTopic(topic, topic.getArn(), null);
    }

    static ParsedTopic notATopic(String arn, String reason) {
        return new ParsedTopic(null, arn, reason);
    }

    public boolean isTopic() {
        return topic != null;
    }

    /**
     * @throws IllegalStateException 不是 Topic
     */
    public Topic topic() {
        if (topic == null) {
            throw new IllegalStateException("not a topic ARN: " + arn);
        }
        return topic;
    }

    public String arn() {
        return arn;
    }

    public String reason() {
        return reason;
    }
}
