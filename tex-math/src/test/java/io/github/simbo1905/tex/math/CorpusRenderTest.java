package io.github.simbo1905.tex.math;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/// Renders every formula in `corpus.txt` in both inline and display mode.
class CorpusRenderTest extends TexMathTestBase {

    static Stream<String> formulas() {
        final InputStream in = Objects.requireNonNull(CorpusRenderTest.class.getResourceAsStream("corpus.txt"),
            "corpus.txt missing from test resources");
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return reader.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .toList()
                .stream();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @ParameterizedTest
    @MethodSource("formulas")
    void rendersInline(String formula) {
        final String markup = render(formula);
        LOG.fine(() -> "rendered " + formula + " to " + markup.length() + " chars");
        assertThat(markup).startsWith("<span class=\"katex\">").contains("katex-html").contains("<math");
    }

    @ParameterizedTest
    @MethodSource("formulas")
    void rendersInDisplayMode(String formula) {
        final String markup = render(formula, Settings.defaults().withDisplayMode(true));
        assertThat(markup).startsWith("<span class=\"katex-display\">");
    }
}
