package xyz.firestige.workload.domain.shared.vo;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TemplateVersion 值对象
 *
 * 职责：
 * 1. 解析应用模板版本号（vMAJOR.MINOR.PATCH，前缀 v 可省略，缺失部分按 0 处理）
 * 2. 提供版本比较能力
 * 3. 不可变对象，线程安全
 *
 * 无法解析的版本视为低于任何合法版本。
 */
public final class TemplateVersion implements Comparable<TemplateVersion> {

    private static final Pattern VERSION_PATTERN =
            Pattern.compile("^v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:[-+].*)?$");

    private static final TemplateVersion UNPARSABLE = new TemplateVersion("", -1, -1, -1);

    private final String raw;
    private final int major;
    private final int minor;
    private final int patch;

    private TemplateVersion(String raw, int major, int minor, int patch) {
        this.raw = raw;
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    /**
     * 解析版本号
     *
     * @param value 版本字符串，如 "v1.0.0"
     * @return TemplateVersion 实例；null、空白或格式错误时返回不可比较的最低版本
     */
    public static TemplateVersion of(String value) {
        if (value == null || value.isBlank()) {
            return UNPARSABLE;
        }
        Matcher m = VERSION_PATTERN.matcher(value.trim());
        if (!m.matches()) {
            return new TemplateVersion(value, -1, -1, -1);
        }
        try {
            return new TemplateVersion(value,
                    Integer.parseInt(m.group(1)),
                    m.group(2) != null ? Integer.parseInt(m.group(2)) : 0,
                    m.group(3) != null ? Integer.parseInt(m.group(3)) : 0);
        } catch (NumberFormatException e) {
            // 数字段超出 int 范围
            return new TemplateVersion(value, -1, -1, -1);
        }
    }

    public boolean isValid() {
        return major >= 0;
    }

    /**
     * 是否低于给定版本
     */
    public boolean isBelow(TemplateVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(TemplateVersion other) {
        if (major != other.major) return Integer.compare(major, other.major);
        if (minor != other.minor) return Integer.compare(minor, other.minor);
        return Integer.compare(patch, other.patch);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemplateVersion that = (TemplateVersion) o;
        return major == that.major && minor == that.minor && patch == that.patch;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch);
    }

    @Override
    public String toString() {
        return raw;
    }
}
