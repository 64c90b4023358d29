package io.exprkit.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.exprkit.core.config.EngineConfig;
import io.exprkit.core.model.Symbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * A host that binds symbols to live layout state: {@code %} is a percentage of the parent width and
 * {@code auto} is the current content width. Compiled once, such expressions must follow the state
 * on every evaluation.
 */
@DisplayName("LayoutBindingContractTest")
class LayoutBindingContractTest {

    /** Mutable layout state read by the bound symbols. */
    private static final class Frame {
        volatile double parentWidth;
        volatile double contentWidth;
    }

    private Frame frame;
    private ExpressionEngine engine;

    @BeforeEach
    void setUp() {
        frame = new Frame();
        engine = ExpressionEngine.builder()
                .config(EngineConfig.builder().constant("gutter", 8).build())
                .symbol(Symbol.postfix("%"), args -> args[0] / 100 * frame.parentWidth)
                .symbol(Symbol.variable("auto"), args -> frame.contentWidth)
                .build();
    }

    @Test
    @DisplayName("Percentage follows the parent width")
    void percentageTracksParent() {
        Expression width = engine.compile("50%");

        frame.parentWidth = 200;
        assertThat(width.evaluate()).isEqualTo(100.0);
        frame.parentWidth = 300;
        assertThat(width.evaluate()).isEqualTo(150.0);
    }

    @Test
    @DisplayName("Postfix percentage combines with infix arithmetic")
    void percentageInArithmetic() {
        Expression width = engine.compile("100% - gutter * 2");

        frame.parentWidth = 320;
        assertThat(width.evaluate()).isEqualTo(304.0);
        assertThat(width.description()).isEqualTo("100% - 16");
    }

    @Test
    @DisplayName("Auto variable follows the content width")
    void autoTracksContent() {
        Expression width = engine.compile("max(auto, 40)");

        frame.contentWidth = 10;
        assertThat(width.evaluate()).isEqualTo(40.0);
        frame.contentWidth = 75;
        assertThat(width.evaluate()).isEqualTo(75.0);
    }

    @Test
    @DisplayName("Pure-symbols option freezes operators but never variables")
    void pureSymbolsFreezesOperatorsOnly() {
        ExpressionEngine pure = ExpressionEngine.builder()
                .config(EngineConfig.builder().option(ExpressionOption.PURE_SYMBOLS).build())
                .symbols(engine.symbols())
                .build();
        frame.parentWidth = 200;
        frame.contentWidth = 5;
        Expression percent = pure.compile("50%");
        Expression auto = pure.compile("auto");

        frame.parentWidth = 400;
        frame.contentWidth = 9;

        assertThat(percent.evaluate()).isEqualTo(100.0);
        assertThat(auto.evaluate()).isEqualTo(9.0);
    }
}
