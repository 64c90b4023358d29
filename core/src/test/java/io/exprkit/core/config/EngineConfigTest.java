package io.exprkit.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.exprkit.core.engine.ExpressionOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

    @Test
    void defaults() {
        EngineConfig config = EngineConfig.DEFAULT;

        assertThat(config.options()).isEmpty();
        assertThat(config.constants()).isEmpty();
        assertThat(config.arrays()).isEmpty();
        assertThat(config.cacheEnabled()).isTrue();
        assertThat(config.maxNestingDepth()).isEqualTo(EngineConfig.DEFAULT_MAX_NESTING_DEPTH);
        assertThat(config.maxTreeDepth()).isEqualTo(EngineConfig.DEFAULT_MAX_TREE_DEPTH);
        assertThat(config.maxSourceLength()).isEqualTo(EngineConfig.DEFAULT_MAX_SOURCE_LENGTH);
    }

    @Test
    void collectionsAreImmutableCopies() {
        List<Double> values = new ArrayList<>(List.of(1.0, 2.0));
        EngineConfig config = EngineConfig.builder().array("a", values).build();
        values.add(3.0);

        assertThat(config.arrays().get("a")).containsExactly(1.0, 2.0);
        assertThatThrownBy(() -> config.options().add(ExpressionOption.NO_OPTIMIZE))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> config.constants().put("x", 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toBuilderRoundTrips() {
        EngineConfig config = EngineConfig.builder()
                .option(ExpressionOption.BOOL_SYMBOLS)
                .constant("e", Math.E)
                .array("a", List.of(1.0))
                .cacheEnabled(false)
                .maxNestingDepth(10)
                .maxTreeDepth(50)
                .maxSourceLength(100)
                .build();

        assertThat(config.toBuilder().build()).isEqualTo(config);
        assertThat(config.toBuilder().options(Set.of()).build().options()).isEmpty();
    }

    @Test
    void quotedNamesAreAccepted() {
        assertThat(EngineConfig.builder().constant("`my var`", 1).build().constants()).containsKey("`my var`");
    }

    @Test
    void rejectsInvalidNames() {
        assertThatThrownBy(() -> EngineConfig.builder().constant("a b", 1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid constant name: 'a b'");
        assertThatThrownBy(() -> EngineConfig.builder().array("+", List.of()).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid array name: '+'");
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThatThrownBy(() -> EngineConfig.builder().maxNestingDepth(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.builder().maxTreeDepth(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("maxTreeDepth must be positive: 0");
        assertThatThrownBy(() -> EngineConfig.builder().maxSourceLength(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
