package com.phillippitts.selfconsistency.util;

import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DeadlineTest {

    @Test
    void freshDeadlineIsNotExpired() {
        Deadline deadline = Deadline.after(60_000);

        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remainingMillis()).isBetween(1L, 60_000L);
        assertThat(deadline.budgetMs()).isEqualTo(60_000L);
    }

    @Test
    void expiresAfterBudget() {
        Deadline deadline = Deadline.after(20);

        await().atMost(2, SECONDS).until(deadline::isExpired);
        assertThat(deadline.remainingMillis()).isZero();
    }

    @Test
    void rejectsNonPositiveBudget() {
        assertThatThrownBy(() -> Deadline.after(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
