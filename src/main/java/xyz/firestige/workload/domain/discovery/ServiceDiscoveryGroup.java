package xyz.firestige.workload.domain.discovery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 共享同一服务发现名称的环境分组
 */
public class ServiceDiscoveryGroup {

    private final List<String> environments;
    private final String namespace;

    @JsonCreator
    public ServiceDiscoveryGroup(@JsonProperty("environment") List<String> environments,
                                 @JsonProperty("namespace") String namespace) {
        this.environments = environments == null ? new ArrayList<>() : new ArrayList<>(environments);
        this.namespace = namespace;
    }

    void addEnvironment(String environment) {
        if (!environments.contains(environment)) {
            environments.add(environment);
        }
    }

    @JsonProperty("environment")
    public List<String> getEnvironments() {
        return Collections.unmodifiableList(environments);
    }

    @JsonProperty("namespace")
    public String getNamespace() {
        return namespace;
    }

    @Override
    public String toString() {
        return String.join(", ", environments) + " -> " + namespace;
    }
}
