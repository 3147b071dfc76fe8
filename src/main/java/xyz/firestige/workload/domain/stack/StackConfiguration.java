package xyz.firestige.workload.domain.stack;

import xyz.firestige.workload.domain.deploy.DeployOptions;
import xyz.firestige.workload.domain.shared.vo.WorkloadIdentity;

import java.util.List;
import java.util.Objects;

/**
 * 可直接交给模板渲染器的部署栈配置
 * <p>
 * 每次部署新建，交给部署后端后不再修改。公共字段在此，
 * 类型相关的网络 / 消息配置放在 {@link StackExtension} 中。
 */
public final class StackConfiguration {

    private final WorkloadIdentity identity;
    private final StackRuntimeConfiguration runtime;
    private final String serviceDiscoveryEndpoint;
    private final List<String> importedCertArns;
    private final DeployOptions options;
    private final StackExtension extension;

    private StackConfiguration(Builder builder) {
        this.identity = Objects.requireNonNull(builder.identity, "identity");
        this.runtime = Objects.requireNonNull(builder.runtime, "runtime");
        this.serviceDiscoveryEndpoint = builder.serviceDiscoveryEndpoint;
        this.importedCertArns = List.copyOf(builder.importedCertArns);
        this.options = builder.options != null ? builder.options : DeployOptions.defaults();
        this.extension = Objects.requireNonNull(builder.extension, "extension");
    }

    public static Builder builder() {
        return new Builder();
    }

    public WorkloadIdentity getIdentity() {
        return identity;
    }

    public StackRuntimeConfiguration getRuntime() {
        return runtime;
    }

    public String getServiceDiscoveryEndpoint() {
        return serviceDiscoveryEndpoint;
    }

    public List<String> getImportedCertArns() {
        return importedCertArns;
    }

    public DeployOptions getOptions() {
        return options;
    }

    public boolean isForceUpdate() {
        return options.forceNewUpdate();
    }

    public boolean isDisableRollback() {
        return options.disableRollback();
    }

    public StackExtension getExtension() {
        return extension;
    }

    /**
     * 取类型相关的配置段
     *
     * @throws IllegalStateException 配置段类型不符
     */
    public <T extends StackExtension> T extension(Class<T> type) {
        if (!type.isInstance(extension)) {
            throw new IllegalStateException(String.format("stack %s carries %s, not %s",
                    identity.stackName(), extension.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(extension);
    }

    public String getStackName() {
        return identity.stackName();
    }

    @Override
    public String toString() {
        return "StackConfiguration{" +
                "stack=" + identity.stackName() +
                ", kind=" + identity.kind() +
                ", discovery=" + serviceDiscoveryEndpoint +
                ", options=" + options +
                '}';
    }

    public static class Builder {
        private WorkloadIdentity identity;
        private StackRuntimeConfiguration runtime;
        private String serviceDiscoveryEndpoint;
        private List<String> importedCertArns = List.of();
        private DeployOptions options;
        private StackExtension extension;

        public Builder identity(WorkloadIdentity identity) {
            this.identity = identity;
            return this;
        }

        public Builder runtime(StackRuntimeConfiguration runtime) {
            this.runtime = runtime;
            return this;
        }

        public Builder serviceDiscoveryEndpoint(String serviceDiscoveryEndpoint) {
            this.serviceDiscoveryEndpoint = serviceDiscoveryEndpoint;
            return this;
        }

        public Builder importedCertArns(List<String> importedCertArns) {
            this.importedCertArns = importedCertArns == null ? List.of() : importedCertArns;
            return this;
        }

        public Builder options(DeployOptions options) {
            this.options = options;
            return this;
        }

        public Builder extension(StackExtension extension) {
            this.extension = extension;
            return this;
        }

        public StackConfiguration build() {
            return new StackConfiguration(this);
        }
    }
}
