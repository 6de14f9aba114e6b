package dev.smellscope.domain.valueobject;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SourceLocationTest {

    @Test
    @DisplayName("overlap ratio is measured against the shorter span")
    void overlapRatio() {
        SourceLocation outer = SourceLocation.lines("A.java", 10, 29);
        SourceLocation inner = SourceLocation.lines("A.java", 12, 13);
        SourceLocation straddling = SourceLocation.lines("A.java", 28, 31);

        assertThat(outer.overlapRatio(inner)).isEqualTo(1.0);
        assertThat(inner.overlapRatio(outer)).isEqualTo(1.0);
        assertThat(outer.overlapRatio(straddling)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("disjoint ranges and different files do not overlap")
    void noOverlap() {
        assertThat(SourceLocation.lines("A.java", 1, 5).overlapRatio(SourceLocation.lines("A.java", 6, 9)))
                .isZero();
        assertThat(SourceLocation.lines("A.java", 1, 5).overlapRatio(SourceLocation.lines("B.java", 1, 5)))
                .isZero();
    }

    @Test
    @DisplayName("columns decide overlap on a shared boundary line; column 0 spans the whole line")
    void columnsOnBoundaryLines() {
        SourceLocation left = new SourceLocation("A.java", 5, 3, 5, 5);
        SourceLocation right = new SourceLocation("A.java", 5, 20, 5, 22);
        SourceLocation wholeLine = SourceLocation.lines("A.java", 5, 5);
        SourceLocation endsAtColumn8 = new SourceLocation("A.java", 2, 1, 5, 8);
        SourceLocation startsAtColumn8 = new SourceLocation("A.java", 5, 8, 9, 0);

        assertThat(left.overlapRatio(right)).isZero();
        assertThat(right.overlapRatio(left)).isZero();
        assertThat(left.overlapRatio(wholeLine)).isEqualTo(1.0);
        assertThat(wholeLine.overlapRatio(right)).isEqualTo(1.0);
        assertThat(endsAtColumn8.overlapRatio(startsAtColumn8)).isCloseTo(0.25, within(1e-9));
        assertThat(endsAtColumn8.overlapRatio(new SourceLocation("A.java", 5, 9, 9, 0))).isZero();
    }

    @Test
    @DisplayName("a range fits only when it is well formed and inside the source")
    void isWithin() {
        assertThat(SourceLocation.lines("A.java", 1, 10).isWithin(10)).isTrue();
        assertThat(SourceLocation.lines("A.java", 0, 3).isWithin(10)).isFalse();
        assertThat(SourceLocation.lines("A.java", 5, 11).isWithin(10)).isFalse();
        assertThat(SourceLocation.lines("A.java", 7, 6).isWithin(10)).isFalse();
    }

    @Test
    @DisplayName("a missing file name is filled in, an existing one kept")
    void defaultFile() {
        assertThat(new SourceLocation(null, 1, 0, 1, 0).withDefaultFile("input").file()).isEqualTo("input");
        assertThat(SourceLocation.lines("A.java", 1, 1).withDefaultFile("input").file()).isEqualTo("A.java");
    }

    @Test
    @DisplayName("tightness prefers fewer lines, then narrower columns")
    void tightness() {
        SourceLocation wide = new SourceLocation("A.java", 3, 1, 3, 80);
        SourceLocation narrow = new SourceLocation("A.java", 3, 5, 3, 20);
        SourceLocation twoLines = new SourceLocation("A.java", 3, 5, 4, 6);

        assertThat(SourceLocation.TIGHTNESS_ORDER.compare(narrow, wide)).isNegative();
        assertThat(SourceLocation.TIGHTNESS_ORDER.compare(wide, twoLines)).isNegative();
    }
}
