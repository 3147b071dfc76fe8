package xyz.firestige.workload.service.environment;

import xyz.firestige.workload.domain.topic.Topic;

import java.util.List;

/**
 * 列出环境中已部署的 Topic
 */
@FunctionalInterface
public interface TopicLister {

    List<Topic> listTopics(String app, String env) throws Exception;
}
