package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.EvaluationStatus;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class ConditionEvaluatorRegistryTest {

    private static final EvaluationContext CTX =
            new EvaluationContext(1L, LocalDate.of(2026, 3, 10), null, ZoneOffset.UTC);

    @Test
    void unknown_type_returns_zero_progress() {
        ConditionEvaluatorRegistry registry = new ConditionEvaluatorRegistry(List.of());

        TaskEvaluation e = registry.evaluate(
                new TaskCondition("DRINK_WATER", 8.0, null, null, null, null, null), CTX);

        assertThat(e.canComplete()).isFalse();
        assertThat(e.progress()).isZero();
        assertThat(e.status()).isEqualTo(EvaluationStatus.UNKNOWN_TYPE);
    }

    @Test
    void query_failure_is_reported_as_safe_default() {
        ActivityQueryClient q = mock(ActivityQueryClient.class);
        when(q.countMealsOn(any(), any())).thenThrow(new QueryTimeoutException("db down"));
        ConditionEvaluatorRegistry registry = new ConditionEvaluatorRegistry(List.of(new LogMealsTodayEvaluator(q)));

        TaskEvaluation e = registry.evaluate(TaskCondition.of(ConditionType.LOG_MEALS_TODAY), CTX);

        assertThat(e.canComplete()).isFalse();
        assertThat(e.progress()).isZero();
        assertThat(e.status()).isEqualTo(EvaluationStatus.QUERY_FAILED);
    }

    @Test
    void dispatches_case_insensitively() {
        ActivityQueryClient q = mock(ActivityQueryClient.class);
        when(q.hasAnyWeighIn(1L)).thenReturn(true);
        ConditionEvaluatorRegistry registry = new ConditionEvaluatorRegistry(List.of(new FirstWeighInEvaluator(q)));

        TaskEvaluation e = registry.evaluate(new TaskCondition("first_weigh_in", null, null, null, null, null, null), CTX);

        assertThat(e.canComplete()).isTrue();
    }

    @Test
    void duplicate_evaluators_fail_fast() {
        ActivityQueryClient q = mock(ActivityQueryClient.class);

        assertThatThrownBy(() -> new ConditionEvaluatorRegistry(List.of(new FirstWeighInEvaluator(q), new FirstWeighInEvaluator(q))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("DUPLICATE_CONDITION_EVALUATOR");
    }
}
