package com.phillippitts.selfconsistency.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(5_000_000L)).isEqualTo(5L);
        assertThat(TimeUtils.nanosToMillis(999_999L)).isZero();
    }

    @Test
    void elapsedMillisIsNonNegative() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(5);
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(4L);
    }
}
