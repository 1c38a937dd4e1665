package com.ryuqq.reconciler.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void calculate_지터없이_지수_증가_후_상한_적용() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(3_000, 10_000, 0.0);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(3_000);
        assertThat(calculator.calculate(2)).isEqualTo(6_000);
        assertThat(calculator.calculate(3)).isEqualTo(10_000);
        assertThat(calculator.calculate(10)).isEqualTo(10_000);
    }

    @Test
    void calculate_지터는_지수값에_비례하여_추가() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1_000, 60_000, 0.5, () -> 0.5);

        // when
        long delay = calculator.calculate(2);

        // then
        assertThat(delay).isEqualTo(2_000 + 500);
    }

    @Test
    void calculate_지터_포함해도_상한_초과하지_않음() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1_000, 1_500, 1.0, () -> 0.99);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(1_500);
    }

    @Test
    void calculate_매우_큰_시도횟수도_overflow_없음() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(3_000, Long.MAX_VALUE / 2, 0.0);

        // when
        long delay = calculator.calculate(Integer.MAX_VALUE);

        // then
        assertThat(delay).isEqualTo(Long.MAX_VALUE / 2);
    }

    @Test
    void calculate_시도횟수_0이하_예외() {
        BackoffCalculator calculator = new BackoffCalculator(3_000, 10_000, 0.0);

        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attemptCount must be positive");
    }

    @Test
    void 생성자_잘못된_파라미터_예외() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 10_000, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs must be positive");
        assertThatThrownBy(() -> new BackoffCalculator(3_000, 1_000, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs must be >= baseDelayMs");
        assertThatThrownBy(() -> new BackoffCalculator(3_000, 10_000, 1.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jitterFactor");
        assertThatThrownBy(() -> new BackoffCalculator(3_000, 10_000, 0.1, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("random cannot be null");
    }
}
