package app.lexis.core.review.algorithm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntervalPreviewTest {

    @Test
    void describe_usesMinutesBelowOneDay() {
        assertThat(IntervalPreview.describe(0.0)).isEqualTo("1m");
        assertThat(IntervalPreview.describe(10.0 / 1440)).isEqualTo("10m");
    }

    @Test
    void describe_usesDaysBelowOneYear() {
        assertThat(IntervalPreview.describe(1.0)).isEqualTo("1d");
        assertThat(IntervalPreview.describe(12.5)).isEqualTo("13d");
        assertThat(IntervalPreview.describe(364.0)).isEqualTo("364d");
    }

    @Test
    void describe_usesYearsWithOneDecimal() {
        assertThat(IntervalPreview.describe(365.0)).isEqualTo("1.0y");
        assertThat(IntervalPreview.describe(438.0)).isEqualTo("1.2y");
    }
}
