package xyz.firestige.workload.domain.topic;

/**
 * Topic ARN 解析器
 * <p>
 * ARN 格式 arn:partition:service:region:account:resource，资源名为 app-env-workload-name。
 * 把字符串格式知识限制在这里，解析器之外只处理 {@link ParsedTopic}。
 */
public final class TopicArnParser {

    private static final int ARN_SECTIONS = 6;

    private TopicArnParser() {
    }

    /**
     * ARN 的资源部分；不是合法 ARN 时返回 null
     */
    public static String resourceName(String arn) {
        if (arn == null || !arn.startsWith("arn:")) {
            return null;
        }
        String[] parts = arn.split(":", ARN_SECTIONS);
        if (parts.length < ARN_SECTIONS || parts[5].isEmpty()) {
            return null;
        }
        return parts[5];
    }

    /**
     * 已知 workload 时的精确解析
     */
    public static ParsedTopic parse(String arn, String app, String env, String workload) {
        String resource = resourceName(arn);
        if (resource == null) {
            return ParsedTopic.notATopic(arn, String.format("invalid ARN %s", arn));
        }
        String prefix = String.format("%s-%s-%s-", app, env, workload);
        if (!resource.startsWith(prefix) || resource.length() == prefix.length()) {
            return ParsedTopic.notATopic(arn,
                    String.format("topic ARN %s is not in the form %s<name>", arn, prefix));
        }
        return ParsedTopic.topic(Topic.trusted(arn, app, env, workload, resource.substring(prefix.length())));
    }

    /**
     * 仅知道 app/env 时的解析，workload 取剩余部分第一个 "-" 之前的内容
     */
    public static ParsedTopic parse(String arn, String app, String env) {
        String resource = resourceName(arn);
        if (resource == null) {
            return ParsedTopic.notATopic(arn, String.format("invalid ARN %s", arn));
        }
        String prefix = String.format("%s-%s-", app, env);
        if (!resource.startsWith(prefix)) {
            return ParsedTopic.notATopic(arn,
                    String.format("topic ARN %s does not belong to app %s and environment %s", arn, app, env));
        }
        String rest = resource.substring(prefix.length());
        int idx = rest.indexOf('-');
        if (idx <= 0 || idx == rest.length() - 1) {
            return ParsedTopic.notATopic(arn,
                    String.format("topic ARN %s is not in the form %s<workload>-<name>", arn, prefix));
        }
        return ParsedTopic.topic(Topic.trusted(arn, app, env, rest.substring(0, idx), rest.substring(idx + 1)));
    }
}
