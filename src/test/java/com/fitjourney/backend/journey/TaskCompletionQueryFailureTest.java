package com.fitjourney.backend.journey;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitjourney.backend.journey.stage.entity.UserStage;
import com.fitjourney.backend.journey.stage.entity.UserStageTask;
import com.fitjourney.backend.journey.stage.repo.UserStageRepo;
import com.fitjourney.backend.journey.stage.repo.UserStageTaskRepo;
import com.fitjourney.backend.meal.repo.MealEntryRepo;
import com.fitjourney.backend.testsupport.TestAuthConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureMockMvc(addFilters = false)
@Import(TestAuthConfig.class)
public class TaskCompletionQueryFailureTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;
    @Autowired UserStageRepo stages;
    @Autowired UserStageTaskRepo tasks;

    // ✅ meals 查詢一律失敗（模擬 DB 暫時掛掉）
    @MockBean MealEntryRepo meals;

    @Test
    void meal_query_failure_returns_503_evaluation_failed() throws Exception {
        when(meals.countByUserIdAndMealDate(any(), any()))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        UserStage stage = new UserStage();
        stage.setUserId(TestAuthConfig.USER_ID);
        stage.setStageIndex(50);
        stage.setCode("STAGE_50");
        stage.setTitle("Stage 50");
        stage.setUnlocked(true);
        stage.setUnlockedAt(Instant.now());
        stage = stages.save(stage);

        UserStageTask task = new UserStageTask();
        task.setUserStageId(stage.getId());
        task.setOrderIndex(1);
        task.setKeyCode("LOG_TWO_MEALS");
        task.setTitle("Log two meals today");
        task.setConditionJson(om.readTree("{\"type\":\"LOG_MEALS_TODAY\",\"target\":2}"));
        task = tasks.save(task);

        mvc.perform(post("/api/v1/journey/stages/{sid}/tasks/{tid}/complete", stage.getId(), task.getId()))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("EVALUATION_FAILED"));

        assertThat(tasks.findById(task.getId()).orElseThrow().isCompleted()).isFalse();
    }
}
