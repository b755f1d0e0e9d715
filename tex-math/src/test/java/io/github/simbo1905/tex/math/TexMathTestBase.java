package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.List;
import java.util.logging.Logger;

/// Base class for all TeX math tests.
/// - Emits an INFO banner per test.
/// - Parse and render shortcuts over the standard registry.
public class TexMathTestBase extends TexMathLoggingConfig {

    static final Logger LOG = Logger.getLogger("io.github.simbo1905.tex.math");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static List<ParseNode> parse(String expression) {
        return parse(expression, Settings.defaults());
    }

    static List<ParseNode> parse(String expression, Settings settings) {
        return TexMath.standard().parse(expression, settings);
    }

    static String render(String expression) {
        return TexMath.standard().renderToString(expression);
    }

    static String render(String expression, Settings settings) {
        return TexMath.standard().renderToString(expression, settings);
    }
}
