package com.fitjourney.backend.journey.controller;

import com.fitjourney.backend.auth.security.AuthContext;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.dto.CompletionResponse;
import com.fitjourney.backend.journey.dto.EvaluateRequest;
import com.fitjourney.backend.journey.dto.EvaluateResponse;
import com.fitjourney.backend.journey.dto.StageCompletionResponse;
import com.fitjourney.backend.journey.dto.TaskProgressResponse;
import com.fitjourney.backend.journey.evaluator.ConditionSetEvaluator;
import com.fitjourney.backend.journey.service.TaskCompletionService;
import com.fitjourney.backend.journey.service.TaskProgressService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/journey")
public class JourneyController {

    private final AuthContext auth;
    private final TaskProgressService progress;
    private final TaskCompletionService completion;

    public JourneyController(AuthContext auth, TaskProgressService progress, TaskCompletionService completion) {
        this.auth = auth;
        this.progress = progress;
        this.completion = completion;
    }

    @PostMapping(value = "/evaluate", produces = MediaType.APPLICATION_JSON_VALUE)
    public EvaluateResponse evaluate(@Valid @RequestBody EvaluateRequest req) {
        Long uid = auth.requireUserId();
        List<TaskEvaluation> each = progress.evaluateEach(uid, req.conditions(), req.stageUnlockedAt());
        return new EvaluateResponse(ConditionSetEvaluator.combine(each), each);
    }

    @GetMapping(value = "/stages/{stageId}/tasks/{taskId}/progress", produces = MediaType.APPLICATION_JSON_VALUE)
    public TaskProgressResponse taskProgress(@PathVariable Long stageId, @PathVariable Long taskId) {
        Long uid = auth.requireUserId();
        return progress.evaluateTask(uid, stageId, taskId);
    }

    @GetMapping(value = "/stages/{stageId}/completion", produces = MediaType.APPLICATION_JSON_VALUE)
    public StageCompletionResponse stageCompletion(@PathVariable Long stageId) {
        Long uid = auth.requireUserId();
        return progress.completionMap(uid, stageId);
    }

    @PostMapping(value = "/stages/{stageId}/tasks/{taskId}/complete", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CompletionResponse> complete(@PathVariable Long stageId, @PathVariable Long taskId) {
        Long uid = auth.requireUserId();
        CompletionResponse res = completion.complete(uid, stageId, taskId);
        if (res.ok()) return ResponseEntity.ok(res);

        HttpStatus status = CompletionResponse.EVALUATION_FAILED.equals(res.error())
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(res);
    }
}
