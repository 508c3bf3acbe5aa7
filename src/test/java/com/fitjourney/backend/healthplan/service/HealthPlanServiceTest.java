package com.fitjourney.backend.healthplan.service;

import com.fitjourney.backend.healthplan.dto.HealthPlanResponse;
import com.fitjourney.backend.healthplan.dto.SaveHealthPlanRequest;
import com.fitjourney.backend.healthplan.entity.UserHealthPlan;
import com.fitjourney.backend.healthplan.repo.UserHealthPlanRepo;
import com.fitjourney.backend.journey.cache.ProgressCacheInvalidator;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthPlanServiceTest {

    @Test
    void upsert_saves_plan_and_invalidates_progress() {
        UserHealthPlanRepo repo = mock(UserHealthPlanRepo.class);
        ProgressCacheInvalidator invalidator = mock(ProgressCacheInvalidator.class);
        when(repo.findById(5L)).thenReturn(Optional.empty());

        HealthPlanResponse res = new HealthPlanService(repo, invalidator)
                .upsert(5L, new SaveHealthPlanRequest(null, null, 2100, 250, 150, 70, 2400));

        assertEquals(5L, res.userId());
        assertEquals("ONBOARDING", res.source());
        assertEquals(150, res.proteinG());
        verify(repo).save(any(UserHealthPlan.class));
        verify(invalidator).invalidateUserAfterCommit(5L);
    }

    @Test
    void out_of_range_kcal_is_rejected() {
        UserHealthPlanRepo repo = mock(UserHealthPlanRepo.class);
        HealthPlanService svc = new HealthPlanService(repo, mock(ProgressCacheInvalidator.class));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> svc.upsert(5L, new SaveHealthPlanRequest(null, null, 300, 250, 150, 70, null)));
        assertEquals("kcal_out_of_range", ex.getMessage());
        verify(repo, never()).save(any());
    }

    @Test
    void missing_plan_is_not_found() {
        UserHealthPlanRepo repo = mock(UserHealthPlanRepo.class);
        when(repo.findById(5L)).thenReturn(Optional.empty());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new HealthPlanService(repo, mock(ProgressCacheInvalidator.class)).get(5L));
        assertEquals("health_plan_not_found", ex.getMessage());
    }
}
