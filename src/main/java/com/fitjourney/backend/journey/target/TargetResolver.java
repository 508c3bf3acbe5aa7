package com.fitjourney.backend.journey.target;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.config.JourneyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 決定任務「實際」要用的 target。
 *
 * <p>決策順序（第一個有效值勝出）：</p>
 * <ol>
 *   <li>live plan 的值（&gt; 0），且 {@link PersonalizationPolicy} 允許</li>
 *   <li>condition_json.target（任務建立時凍結的值，&gt; 0）</li>
 *   <li>預設值：蛋白質 120g；熱量依任務類型 deficit 2000 / surplus 2500 / balanced 2200</li>
 * </ol>
 *
 * <p>拿不到 live plan 不是錯誤，直接往下一層。WEEKLY_BALANCED 的 target 是容許誤差，
 * 不是熱量，所以它沒有凍結層。</p>
 */
@Slf4j
@Component
public class TargetResolver {

    private final JourneyProperties.Targets cfg;

    public TargetResolver(JourneyProperties props) {
        this.cfg = props.getTargets();
    }

    public ResolvedTarget resolve(TargetKind kind, TaskCondition condition, Optional<UserNutritionTargets> live) {
        ConditionType type = condition.conditionType().orElse(null);

        // 1) live plan
        if (live.isPresent() && personalizationAllowed(condition)) {
            double v = live.get().valueOf(kind);
            if (v > 0) {
                log.debug("target resolved from live plan. kind={} type={} value={}", kind, condition.type(), v);
                return new ResolvedTarget(v, TargetSource.LIVE_PLAN);
            }
        }

        // 2) 凍結值
        if (type != ConditionType.WEEKLY_BALANCED) {
            Optional<Double> frozen = condition.positiveTarget();
            if (frozen.isPresent()) {
                log.debug("target resolved from condition. kind={} type={} value={}", kind, condition.type(), frozen.get());
                return new ResolvedTarget(frozen.get(), TargetSource.FROZEN_CONDITION);
            }
        }

        // 3) 預設
        double dft = defaultFor(kind, type);
        log.debug("target fell back to default. kind={} type={} value={}", kind, condition.type(), dft);
        return new ResolvedTarget(dft, TargetSource.DEFAULT);
    }

    private boolean personalizationAllowed(TaskCondition condition) {
        return switch (cfg.getPersonalization()) {
            case ALWAYS -> true;
            case FLAG_GATED -> condition.prefersUserTarget();
        };
    }

    double defaultFor(TargetKind kind, ConditionType type) {
        if (kind == TargetKind.PROTEIN) return cfg.getDefaultProteinGrams();
        if (type == ConditionType.WEEKLY_SURPLUS) return cfg.getDefaultSurplusCalories();
        if (type == ConditionType.WEEKLY_BALANCED) return cfg.getDefaultBalancedCalories();
        return cfg.getDefaultDeficitCalories();
    }
}
