package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamespaceTest extends TexMathTestBase {

    @Test
    void localAssignmentIsUndoneAtGroupEnd() {
        final var ns = new Namespace<String>(Map.of());
        ns.set("x", "outer");
        ns.beginGroup();
        ns.set("x", "inner");
        assertThat(ns.get("x")).isEqualTo("inner");
        ns.endGroup();
        assertThat(ns.get("x")).isEqualTo("outer");
    }

    @Test
    void nameFirstDefinedInGroupDisappearsAfterIt() {
        final var ns = new Namespace<String>(Map.of());
        ns.beginGroup();
        ns.set("y", "temp");
        ns.endGroup();
        assertThat(ns.has("y")).isFalse();
        assertThat(ns.get("y")).isNull();
    }

    @Test
    void globalAssignmentSurvivesEveryGroup() {
        final var ns = new Namespace<String>(Map.of());
        ns.set("g", "before");
        ns.beginGroup();
        ns.beginGroup();
        ns.set("g", "local");
        ns.set("g", "global", true);
        ns.endGroup();
        assertThat(ns.get("g")).isEqualTo("global");
        ns.endGroup();
        assertThat(ns.get("g")).isEqualTo("global");
    }

    @Test
    void onlyFirstLocalAssignmentInAGroupIsRecorded() {
        final var ns = new Namespace<String>(Map.of());
        ns.set("x", "a");
        ns.beginGroup();
        ns.set("x", "b");
        ns.set("x", "c");
        ns.endGroup();
        assertThat(ns.get("x")).isEqualTo("a");
    }

    @Test
    void builtinsShowThroughAndCanBeShadowed() {
        final var ns = new Namespace<>(Map.of("\\b", "builtin"));
        assertThat(ns.get("\\b")).isEqualTo("builtin");
        ns.beginGroup();
        ns.set("\\b", "shadow");
        assertThat(ns.get("\\b")).isEqualTo("shadow");
        ns.endGroup();
        assertThat(ns.get("\\b")).isEqualTo("builtin");
    }

    @Test
    void seededGlobalsAreVisible() {
        final var ns = new Namespace<>(Map.of(), Map.of("\\RR", "reals"));
        assertThat(ns.get("\\RR")).isEqualTo("reals");
        assertThat(ns.currentDefinitions()).containsEntry("\\RR", "reals");
    }

    @Test
    void settingNullUndefinesUntilGroupEnd() {
        final var ns = new Namespace<String>(Map.of());
        ns.set("x", "kept");
        ns.beginGroup();
        ns.set("x", null);
        assertThat(ns.has("x")).isFalse();
        ns.endGroup();
        assertThat(ns.get("x")).isEqualTo("kept");
    }

    @Test
    void endGroupsClosesEverything() {
        final var ns = new Namespace<String>(Map.of());
        ns.beginGroup();
        ns.beginGroup();
        assertThat(ns.depth()).isEqualTo(2);
        ns.endGroups();
        assertThat(ns.depth()).isZero();
    }

    @Test
    void poppingTheGlobalLevelFails() {
        final var ns = new Namespace<String>(Map.of());
        assertThatThrownBy(ns::endGroup)
            .isInstanceOf(TexParseException.class)
            .hasMessageContaining("Unbalanced namespace destruction");
    }
}
