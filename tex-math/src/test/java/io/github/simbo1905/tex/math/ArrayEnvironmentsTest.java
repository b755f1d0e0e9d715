package io.github.simbo1905.tex.math;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArrayEnvironmentsTest extends TexMathTestBase {

    private static final Settings DISPLAY = Settings.defaults().withDisplayMode(true);

    private static ParseNode.Array array(String expression, Settings settings) {
        final List<ParseNode> tree = parse(expression, settings);
        assertThat(tree).hasSize(1);
        ParseNode node = tree.get(0);
        if (node instanceof ParseNode.LeftRight lr) {
            node = lr.body().get(0);
        }
        assertThat(node).isInstanceOf(ParseNode.Array.class);
        return (ParseNode.Array) node;
    }

    private static ParseNode.Array array(String expression) {
        return array(expression, Settings.defaults());
    }

    @Nested
    @DisplayName("Matrices")
    class Matrices {

        @ParameterizedTest
        @CsvSource(delimiter = ';', value = {
            "pmatrix; (; )",
            "bmatrix; [; ]",
            "Bmatrix; \\{; \\}",
            "vmatrix; |; |",
            "Vmatrix; \\Vert; \\Vert"
        })
        void delimitedMatricesWrapTheirArray(String env, String left, String right) {
            final List<ParseNode> tree = parse("\\begin{" + env + "}a&b\\\\c&d\\end{" + env + "}");
            assertThat(tree).singleElement().isInstanceOf(ParseNode.LeftRight.class);
            final var lr = (ParseNode.LeftRight) tree.get(0);
            assertThat(lr.left()).isEqualTo(left);
            assertThat(lr.right()).isEqualTo(right);
            final var table = (ParseNode.Array) lr.body().get(0);
            assertThat(table.body()).hasSize(2);
            assertThat(table.cols()).containsExactly(new ParseNode.Align("c", null, null),
                new ParseNode.Align("c", null, null));
        }

        @Test
        void plainMatrixHasNoDelimiters() {
            assertThat(parse("\\begin{matrix}a\\end{matrix}")).singleElement().isInstanceOf(ParseNode.Array.class);
        }

        @Test
        void trailingRowBreakDoesNotAddARow() {
            assertThat(array("\\begin{matrix}a\\\\b\\\\\\end{matrix}").body()).hasSize(2);
        }

        @Test
        void columnCountFollowsTheWidestRow() {
            final ParseNode.Array table = array("\\begin{matrix}a\\\\b&c&d\\end{matrix}");
            assertThat(table.cols()).hasSize(3);
            assertThat(table.body().get(0)).hasSize(1);
        }

        @Test
        void starredMatrixTakesAnAlignment() {
            final ParseNode.Array table = array("\\begin{pmatrix*}[r]a&b\\end{pmatrix*}");
            assertThat(table.cols()).containsOnly(new ParseNode.Align("r", null, null));
            assertThatThrownBy(() -> parse("\\begin{pmatrix*}[x]a\\end{pmatrix*}"))
                .isInstanceOf(TexParseException.class)
                .hasMessageContaining("Expected l or c or r");
        }

        @Test
        void rowGapIsRecorded() {
            final ParseNode.Array table = array("\\begin{matrix}a\\\\[2pt]b\\end{matrix}");
            assertThat(table.rowGaps()).containsExactly(new Measurement(2, "pt"));
        }

        @Test
        void smallmatrixIsCompact() {
            final ParseNode.Array table = array("\\begin{smallmatrix}a&b\\end{smallmatrix}");
            assertThat(table.colSeparationType()).isEqualTo("small");
            assertThat(table.arraystretch()).isEqualTo(0.5);
        }

        @Test
        void cellsAreStyledOrdGroups() {
            final ParseNode cell = array("\\begin{matrix}x\\end{matrix}").body().get(0).get(0);
            assertThat(cell).isInstanceOf(ParseNode.Styling.class);
            final var styling = (ParseNode.Styling) cell;
            assertThat(styling.style()).isEqualTo(Style.TEXT);
            assertThat(styling.body()).singleElement().isInstanceOf(ParseNode.OrdGroup.class);
        }
    }

    @Nested
    @DisplayName("Array columns and rules")
    class ArrayColumns {

        @Test
        void columnSpecificationReadsAlignmentsAndRules() {
            final ParseNode.Array table = array("\\begin{array}{c|l:r}a&b&c\\end{array}");
            assertThat(table.cols()).containsExactly(
                new ParseNode.Align("c", null, null),
                new ParseNode.Separator("|"),
                new ParseNode.Align("l", null, null),
                new ParseNode.Separator(":"),
                new ParseNode.Align("r", null, null));
            assertThat(table.hskipBeforeAndAfter()).isTrue();
        }

        @Test
        void unknownColumnAlignmentIsRejected() {
            assertThatThrownBy(() -> parse("\\begin{array}{cx}a\\end{array}"))
                .isInstanceOf(TexParseException.class)
                .hasMessageContaining("Unknown column alignment: x");
        }

        @Test
        void hlinesAreRecordedBeforeEachRow() {
            final ParseNode.Array table = array("\\begin{array}{c}\\hline a\\\\\\hdashline\\hline b\\end{array}");
            assertThat(table.hLinesBeforeRow()).containsExactly(List.of(false), List.of(true, false), List.of());
        }

        @Test
        void hlineOutsideAnArrayIsAnError() {
            assertThatThrownBy(() -> parse("a\\hline b"))
                .isInstanceOf(TexParseException.class)
                .hasMessageContaining("\\hline valid only within array environment");
        }

        @Test
        void extraColumnIsToleratedUnlessStrict() {
            assertThat(array("\\begin{array}{c}a&b\\end{array}").body().get(0)).hasSize(2);
            assertThatThrownBy(() -> parse("\\begin{array}{c}a&b\\end{array}",
                Settings.defaults().withStrict(StrictMode.ERROR)))
                .isInstanceOf(TexParseException.class)
                .hasMessageContaining("Too few columns specified in the {array} column argument.");
        }

        @Test
        void darrayCellsAreInDisplayStyle() {
            final var cell = (ParseNode.Styling) array("\\begin{darray}{c}x\\end{darray}").body().get(0).get(0);
            assertThat(cell.style()).isEqualTo(Style.DISPLAY);
        }

        @Test
        void arraystretchMacroStretchesRows() {
            assertThat(array("\\def\\arraystretch{1.5}\\begin{array}{c}a\\end{array}").arraystretch())
                .isEqualTo(1.5);
            assertThatThrownBy(() -> parse("\\def\\arraystretch{x}\\begin{array}{c}a\\end{array}"))
                .isInstanceOf(TexParseException.class)
                .hasMessageContaining("Invalid \\arraystretch: x");
        }

        @Test
        void badRowTerminatorIsReported() {
            assertThatThrownBy(() -> parse("\\begin{matrix}a}\\end{matrix}"))
                .isInstanceOf(TexParseException.class)
                .hasMessageContaining("Expected & or \\\\ or \\cr or \\end");
        }
    }

    @Nested
    @DisplayName("Cases")
    class Cases {

        @Test
        void casesOpensWithABrace() {
            final List<ParseNode> tree = parse("\\begin{cases}a&b\\\\c&d\\end{cases}");
            final var lr = (ParseNode.LeftRight) tree.get(0);
            assertThat(lr.left()).isEqualTo("\\{");
            assertThat(lr.right()).isEqualTo(".");
            final var table = (ParseNode.Array) lr.body().get(0);
            assertThat(table.arraystretch()).isEqualTo(1.2);
            assertThat(table.cols()).containsExactly(new ParseNode.Align("l", 0.0, 1.0),
                new ParseNode.Align("l", 0.0, 0.0));
        }

        @Test
        void rcasesClosesWithABrace() {
            final var lr = (ParseNode.LeftRight) parse("\\begin{rcases}a\\end{rcases}").get(0);
            assertThat(lr.left()).isEqualTo(".");
            assertThat(lr.right()).isEqualTo("\\}");
        }
    }

    @Nested
    @DisplayName("Aligned and gathered rows")
    class Alignment {

        @Test
        void alignedAlternatesRightAndLeftColumns() {
            final ParseNode.Array table = array("\\begin{aligned}a&=b\\\\c&=d\\end{aligned}");
            assertThat(table.colSeparationType()).isEqualTo("align");
            assertThat(table.addJot()).isTrue();
            assertThat(table.cols()).containsExactly(new ParseNode.Align("r", 0.0, 0.0),
                new ParseNode.Align("l", 0.0, 0.0));
            assertThat(table.tags()).isNull();
        }

        @Test
        void leftCellsStartWithAnEmptyGroup() {
            final ParseNode.Array table = array("\\begin{aligned}a&=b\\end{aligned}");
            final var styling = (ParseNode.Styling) table.body().get(0).get(1);
            final var cell = (ParseNode.OrdGroup) styling.body().get(0);
            assertThat(cell.body().get(0)).isEqualTo(new ParseNode.OrdGroup(Mode.MATH, null, List.of()));
        }

        @Test
        void laterColumnPairsGetAGap() {
            final ParseNode.Array table = array("\\begin{aligned}a&b&c&d\\end{aligned}");
            assertThat(table.cols()).hasSize(4);
            assertThat(table.cols().get(2)).isEqualTo(new ParseNode.Align("r", 1.0, 0.0));
        }

        @Test
        void alignatChecksTheNumberOfColumns() {
            final ParseNode.Array table = array("\\begin{alignedat}{2}a&b&c&d\\end{alignedat}");
            assertThat(table.colSeparationType()).isEqualTo("alignat");
            assertThat(table.cols()).hasSize(4);
            assertThatThrownBy(() -> parse("\\begin{alignedat}{1}a&b&c&d\\end{alignedat}"))
                .isInstanceOf(TexParseException.class)
                .hasMessageContaining("Too many math in a row: expected 1, but got 2");
        }

        @ParameterizedTest
        @CsvSource({"align", "align*", "gather", "gather*", "equation", "equation*", "split"})
        void displayOnlyEnvironmentsRejectInlineMode(String env) {
            assertThatThrownBy(() -> parse("\\begin{" + env + "}a\\end{" + env + "}"))
                .isInstanceOf(TexParseException.class)
                .hasMessageContaining("{" + env + "} can be used only in display mode.");
        }

        @Test
        void splitAllowsTwoColumns() {
            assertThatThrownBy(() -> parse("\\begin{split}a&b&c\\end{split}", DISPLAY))
                .isInstanceOf(TexParseException.class)
                .hasMessageContaining("Too many tab characters: &");
        }

        @Test
        void alignNumbersEveryRowUnlessSuppressed() {
            final ParseNode.Array table = array("\\begin{align}a&=b\\\\c&=d\\nonumber\\\\e&=f\\end{align}", DISPLAY);
            assertThat(table.tags()).hasSize(3);
            assertThat(table.tags().get(0)).isEqualTo(new ParseNode.RowTag(true, null));
            assertThat(table.tags().get(1)).isNull();
            assertThat(table.tags().get(2)).isEqualTo(new ParseNode.RowTag(true, null));
        }

        @Test
        void starredAlignHasNoNumbers() {
            final ParseNode.Array table = array("\\begin{align*}a\\\\b\\end{align*}", DISPLAY);
            assertThat(table.tags()).hasSize(2).containsOnlyNulls();
        }

        @Test
        void explicitTagReplacesTheNumber() {
            final ParseNode.Array table = array("\\begin{align}a\\tag{x}\\\\b\\end{align}", DISPLAY);
            final ParseNode.RowTag tag = table.tags().get(0);
            assertThat(tag.numbered()).isFalse();
            assertThat(tag.body()).isNotEmpty();
            assertThat(table.tags().get(1)).isEqualTo(new ParseNode.RowTag(true, null));
        }

        @Test
        void gatherCentresOneColumn() {
            final ParseNode.Array table = array("\\begin{gather}a\\\\b\\end{gather}", DISPLAY);
            assertThat(table.colSeparationType()).isEqualTo("gather");
            assertThat(table.cols()).containsExactly(new ParseNode.Align("c", null, null));
        }

        @Test
        void leqnoIsCarriedOnTheTable() {
            assertThat(array("\\begin{align}a\\end{align}", DISPLAY.withLeqno(true)).leqno()).isTrue();
        }
    }

    @Test
    void renderedMatrixIsAnMtable() {
        final String markup = render("\\begin{pmatrix}1&0\\\\0&1\\end{pmatrix}");
        assertThat(markup).contains("<mtable").contains("class=\"mtable\"");
    }
}
