package com.fitjourney.backend.healthplan.controller;

import com.fitjourney.backend.auth.security.AuthContext;
import com.fitjourney.backend.healthplan.dto.HealthPlanResponse;
import com.fitjourney.backend.healthplan.dto.SaveHealthPlanRequest;
import com.fitjourney.backend.healthplan.service.HealthPlanService;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import com.fitjourney.backend.journey.target.UserNutritionTargets;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/health-plan")
public class HealthPlanController {

    private final AuthContext auth;
    private final HealthPlanService svc;
    private final ActivityQueryClient activity;

    public HealthPlanController(AuthContext auth, HealthPlanService svc, ActivityQueryClient activity) {
        this.auth = auth;
        this.svc = svc;
        this.activity = activity;
    }

    /** 存檔後 journey 的蛋白質 / 熱量任務會改用新目標（after commit 清快取） */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<HealthPlanResponse> upsert(@RequestBody SaveHealthPlanRequest req) {
        return ResponseEntity.ok(svc.upsert(auth.requireUserId(), req));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public HealthPlanResponse get() {
        return svc.get(auth.requireUserId());
    }

    /** journey 評估實際會拿到的 live target（kcal / protein / tdee） */
    @GetMapping(value = "/targets", produces = MediaType.APPLICATION_JSON_VALUE)
    public UserNutritionTargets targets() {
        Long uid = auth.requireUserId();
        return activity.liveTargets(uid)
                .orElseThrow(() -> new IllegalArgumentException("health_plan_not_found"));
    }
}
