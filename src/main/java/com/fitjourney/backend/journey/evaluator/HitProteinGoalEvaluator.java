package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import com.fitjourney.backend.journey.target.ResolvedTarget;
import com.fitjourney.backend.journey.target.TargetKind;
import com.fitjourney.backend.journey.target.TargetResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 今天吃到的蛋白質總量 >= 目標。
 * 判斷用原始總量，current 只是顯示用（四捨五入到整數克）。
 */
@Slf4j
@Component
public class HitProteinGoalEvaluator implements ConditionEvaluator {

    private final ActivityQueryClient queries;
    private final TargetResolver targets;

    public HitProteinGoalEvaluator(ActivityQueryClient queries, TargetResolver targets) {
        this.queries = queries;
        this.targets = targets;
    }

    @Override
    public ConditionType type() {
        return ConditionType.HIT_PROTEIN_GOAL;
    }

    @Override
    public TaskEvaluation evaluate(TaskCondition condition, EvaluationContext ctx) {
        ResolvedTarget target = targets.resolve(TargetKind.PROTEIN, condition, queries.liveTargets(ctx.userId()));
        double total = queries.sumProteinOn(ctx.userId(), ctx.today());

        log.debug("protein goal evaluated. userId={} current={} target={} source={}",
                ctx.userId(), total, target.value(), target.source());

        return TaskEvaluation.atLeast(total, target.value(), target.source())
                .withCurrent((double) Math.round(total));
    }
}
