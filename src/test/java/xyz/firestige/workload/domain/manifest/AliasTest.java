package xyz.firestige.workload.domain.manifest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Alias 单元测试")
class AliasTest {

    @Test
    @DisplayName("场景: 去重并忽略空白项，保持首次出现顺序")
    void distinctAndOrdered() {
        Alias alias = Alias.of(Arrays.asList("b.example.com", " ", null, "a.example.com", "b.example.com"));

        assertThat(alias.hostnames()).containsExactly("b.example.com", "a.example.com");
    }

    @Test
    @DisplayName("场景: 相等性按集合语义")
    void setEquality() {
        assertThat(Alias.of(List.of("a", "b"))).isEqualTo(Alias.of(List.of("b", "a", "a")));
        assertThat(Alias.of((String) null).isEmpty()).isTrue();
        assertThat(Alias.of(List.of("", "  "))).isSameAs(Alias.empty());
    }
}
