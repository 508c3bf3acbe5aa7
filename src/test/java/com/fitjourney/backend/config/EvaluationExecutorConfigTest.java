package com.fitjourney.backend.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluationExecutorConfigTest {

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    void decorator_carries_request_id_into_worker_and_restores_previous() throws Exception {
        MDC.put("rid", "req-1");
        Runnable decorated = EvaluationExecutorConfig.mdcPropagating().decorate(() -> {});
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable probe = EvaluationExecutorConfig.mdcPropagating().decorate(() -> seen.set(MDC.get("rid")));

        Thread worker = new Thread(() -> {
            MDC.put("rid", "stale");
            probe.run();
            decorated.run();
            seen.set(seen.get() + "|" + MDC.get("rid"));
        });
        worker.start();
        worker.join();

        assertThat(seen.get()).isEqualTo("req-1|stale");
    }
}
