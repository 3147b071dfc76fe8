package xyz.firestige.workload.event;

/**
 * 领域事件发布器接口
 *
 * 职责：
 * - 定义部署事件发布的契约
 * - 解耦部署流程与具体的事件传输机制
 */
public interface DomainEventPublisher {

    /**
     * 发布单个领域事件
     *
     * @param event 领域事件对象
     */
    void publish(Object event);
}
