package xyz.firestige.workload.domain.manifest;

import xyz.firestige.workload.domain.shared.vo.WorkloadKind;

/**
 * 工作负载清单
 */
public interface WorkloadManifest {

    String name();

    WorkloadKind kind();
}
