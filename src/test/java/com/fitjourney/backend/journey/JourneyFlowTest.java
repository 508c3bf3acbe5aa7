package com.fitjourney.backend.journey;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitjourney.backend.journey.stage.entity.UserStage;
import com.fitjourney.backend.journey.stage.entity.UserStageTask;
import com.fitjourney.backend.journey.stage.repo.UserPointsRepo;
import com.fitjourney.backend.journey.stage.repo.UserStageRepo;
import com.fitjourney.backend.journey.stage.repo.UserStageTaskRepo;
import com.fitjourney.backend.testsupport.TestAuthConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureMockMvc(addFilters = false) // ✅ 不走 Security / token filter
@Import(TestAuthConfig.class)             // ✅ 固定 auth.requireUserId() = 1L
public class JourneyFlowTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;
    @Autowired UserStageRepo stages;
    @Autowired UserStageTaskRepo tasks;
    @Autowired UserPointsRepo points;

    @Test
    void log_meals_then_complete_task_unlocks_next_stage() throws Exception {
        UserStage first = stage(1, true);
        UserStage second = stage(2, false);
        UserStageTask task = task(first.getId(), "{\"type\":\"LOG_MEALS_TODAY\",\"target\":2}");

        String completeUrl = "/api/v1/journey/stages/{sid}/tasks/{tid}/complete";

        // 1) 還沒記錄 → 409 CONDITIONS_NOT_MET
        mvc.perform(post(completeUrl, first.getId(), task.getId()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONDITIONS_NOT_MET"))
                .andExpect(jsonPath("$.missing[0]").value("LOG_MEALS_TODAY"));

        // 2) 記兩餐
        for (int i = 0; i < 2; i++) {
            mvc.perform(post("/api/v1/meals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"meal\",\"calories\":500,\"proteinG\":30}"))
                    .andExpect(status().isOk());
        }

        // 3) 進度
        String progressResp = mvc.perform(get("/api/v1/journey/stages/{sid}/tasks/{tid}/progress",
                        first.getId(), task.getId()))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode progress = om.readTree(progressResp);
        assertThat(progress.path("canComplete").asBoolean()).isTrue();
        assertThat(progress.path("progress").asDouble()).isEqualTo(1.0);

        // 4) 完成 → 加分 + 關卡完成 + 解鎖下一關
        mvc.perform(post(completeUrl, first.getId(), task.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.pointsAwarded").value(10))
                .andExpect(jsonPath("$.stageCompleted").value(true))
                .andExpect(jsonPath("$.unlockedNext").value(true));

        // 5) 再按一次：不重複加分
        mvc.perform(post(completeUrl, first.getId(), task.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alreadyCompleted").value(true));

        assertThat(points.count()).isEqualTo(1);
        UserStage reloaded = stages.findById(second.getId()).orElseThrow();
        assertThat(reloaded.isUnlocked()).isTrue();
        assertThat(reloaded.getUnlockedAt()).isNotNull();

        // 6) 已完成的關卡 completion map
        mvc.perform(get("/api/v1/journey/stages/{sid}/completion", first.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tasks['" + task.getId() + "']").value(true));
    }

    @Test
    void unknown_stage_is_404() throws Exception {
        mvc.perform(get("/api/v1/journey/stages/{sid}/completion", 999_999L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("STAGE_NOT_FOUND"));
    }

    private UserStage stage(int index, boolean unlocked) {
        UserStage s = new UserStage();
        s.setUserId(TestAuthConfig.USER_ID);
        s.setStageIndex(index);
        s.setCode("STAGE_" + index);
        s.setTitle("Stage " + index);
        s.setUnlocked(unlocked);
        s.setUnlockedAt(unlocked ? Instant.now() : null);
        return stages.save(s);
    }

    private UserStageTask task(Long stageId, String conditionJson) throws Exception {
        UserStageTask t = new UserStageTask();
        t.setUserStageId(stageId);
        t.setOrderIndex(1);
        t.setKeyCode("LOG_TWO_MEALS");
        t.setTitle("Log two meals today");
        t.setConditionJson(om.readTree(conditionJson));
        return tasks.save(t);
    }
}
