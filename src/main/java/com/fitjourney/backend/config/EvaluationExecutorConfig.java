package com.fitjourney.backend.config;

import com.fitjourney.backend.journey.config.JourneyProperties;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class EvaluationExecutorConfig {

    /**
     * 條件評估 fan-out 用（ConditionSetEvaluator / 批次 completion map）。
     * 只做讀取查詢，queue 滿了就由呼叫端執行緒自己跑（不丟棄）。
     */
    @Bean("evaluationExecutor")
    public TaskExecutor evaluationExecutor(JourneyProperties props) {
        JourneyProperties.Executor cfg = props.getExecutor();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(cfg.getCorePoolSize());
        ex.setMaxPoolSize(Math.max(cfg.getCorePoolSize(), cfg.getMaxPoolSize()));
        ex.setQueueCapacity(cfg.getQueueCapacity());
        ex.setThreadNamePrefix("journey-eval-");
        ex.setTaskDecorator(mdcPropagating());
        ex.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        ex.initialize();
        return ex;
    }

    /** ✅ worker thread 也帶著 rid，log 才串得起同一個 request */
    static TaskDecorator mdcPropagating() {
        return task -> {
            Map<String, String> captured = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> prev = MDC.getCopyOfContextMap();
                if (captured == null) MDC.clear(); else MDC.setContextMap(captured);
                try {
                    task.run();
                } finally {
                    if (prev == null) MDC.clear(); else MDC.setContextMap(prev);
                }
            };
        };
    }
}
