package com.fitjourney.backend.healthplan.service;

import com.fitjourney.backend.healthplan.dto.HealthPlanResponse;
import com.fitjourney.backend.healthplan.dto.SaveHealthPlanRequest;
import com.fitjourney.backend.healthplan.entity.UserHealthPlan;
import com.fitjourney.backend.healthplan.repo.UserHealthPlanRepo;
import com.fitjourney.backend.journey.cache.ProgressCacheInvalidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
public class HealthPlanService {

    private final UserHealthPlanRepo repo;
    private final ProgressCacheInvalidator invalidator;

    public HealthPlanService(UserHealthPlanRepo repo, ProgressCacheInvalidator invalidator) {
        this.repo = repo;
        this.invalidator = invalidator;
    }

    @Transactional
    public HealthPlanResponse upsert(Long userId, SaveHealthPlanRequest req) {
        validate(req);

        UserHealthPlan e = repo.findById(userId).orElseGet(UserHealthPlan::new);
        e.setUserId(userId);

        // meta
        e.setSource(nz(req.source(), "ONBOARDING"));
        e.setCalcVersion(nz(req.calcVersion(), "healthcalc_v1"));

        // results
        e.setKcal(req.kcal());
        e.setCarbsG(req.carbsG());
        e.setProteinG(req.proteinG());
        e.setFatG(req.fatG());
        e.setTdee(req.tdee());

        repo.save(e);

        // 目標變了：蛋白質 / 每週熱量任務的進度要重算
        invalidator.invalidateUserAfterCommit(userId);

        log.info("health plan saved. userId={} kcal={} proteinG={}", userId, e.getKcal(), e.getProteinG());
        return toResponse(e);
    }

    @Transactional(readOnly = true)
    public HealthPlanResponse get(Long userId) {
        UserHealthPlan e = repo.findById(userId)
                .orElseThrow(() -> new IllegalArgumentException("health_plan_not_found"));
        return toResponse(e);
    }

    private static HealthPlanResponse toResponse(UserHealthPlan e) {
        return new HealthPlanResponse(
                e.getUserId(),
                e.getSource(),
                e.getCalcVersion(),
                e.getKcal(),
                e.getCarbsG(),
                e.getProteinG(),
                e.getFatG(),
                e.getTdee(),
                e.getUpdatedAt()
        );
    }

    private void validate(SaveHealthPlanRequest req) {
        requireNotNull(req.kcal(), "kcal");
        requireNotNull(req.carbsG(), "carbsG");
        requireNotNull(req.proteinG(), "proteinG");
        requireNotNull(req.fatG(), "fatG");

        if (req.kcal() < 800 || req.kcal() > 6000) throw bad("kcal_out_of_range");
        if (req.carbsG() < 0 || req.carbsG() > 1200) throw bad("carbs_out_of_range");
        if (req.proteinG() < 0 || req.proteinG() > 600) throw bad("protein_out_of_range");
        if (req.fatG() < 0 || req.fatG() > 400) throw bad("fat_out_of_range");
        if (req.tdee() != null && (req.tdee() < 800 || req.tdee() > 8000)) throw bad("tdee_out_of_range");
    }

    private static void requireNotNull(Object v, String field) {
        if (v == null) throw bad(field + "_required");
    }
    private static IllegalArgumentException bad(String msg) {
        return new IllegalArgumentException(msg);
    }
    private static String nz(String v, String dft) {
        return (v == null || v.isBlank()) ? dft : v;
    }
}
