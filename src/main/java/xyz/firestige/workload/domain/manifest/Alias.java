package xyz.firestige.workload.domain.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 别名：工作负载希望响应的主机名集合
 * <p>
 * 清单中可写成单个字符串或有序列表。校验时按集合处理（重复无意义），
 * 输出时保留首次出现的顺序（证书顺序依赖它）。空白项被忽略。
 */
public final class Alias {

    private static final Alias EMPTY = new Alias(List.of());

    private final List<String> hostnames;

    private Alias(List<String> hostnames) {
        this.hostnames = hostnames;
    }

    public static Alias empty() {
        return EMPTY;
    }

    public static Alias of(String hostname) {
        if (hostname == null) {
            return EMPTY;
        }
        return of(List.of(hostname));
    }

    public static Alias of(List<String> hostnames) {
        if (hostnames == null || hostnames.isEmpty()) {
            return EMPTY;
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String h : hostnames) {
            if (h != null && !h.isBlank()) {
                distinct.add(h.trim());
            }
        }
        return distinct.isEmpty() ? EMPTY : new Alias(Collections.unmodifiableList(new ArrayList<>(distinct)));
    }

    public boolean isEmpty() {
        return hostnames.isEmpty();
    }

    /**
     * 去重后的主机名，保持声明顺序
     */
    public List<String> hostnames() {
        return hostnames;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(Set.copyOf(hostnames), Set.copyOf(((Alias) o).hostnames));
    }

    @Override
    public int hashCode() {
        return Set.copyOf(hostnames).hashCode();
    }

    @Override
    public String toString() {
        return hostnames.size() == 1 ? hostnames.get(0) : hostnames.toString();
    }
}
