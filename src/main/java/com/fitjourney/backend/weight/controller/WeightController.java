package com.fitjourney.backend.weight.controller;

import com.fitjourney.backend.auth.security.AuthContext;
import com.fitjourney.backend.weight.dto.LogWeightRequest;
import com.fitjourney.backend.weight.dto.WeightItemDto;
import com.fitjourney.backend.weight.service.WeightService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/weights")
public class WeightController {
    private final AuthContext auth;
    private final WeightService svc;

    public WeightController(AuthContext auth, WeightService svc) {
        this.auth = auth; this.svc = svc;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WeightItemDto> logWeight(@Valid @RequestBody LogWeightRequest req) {
        Long uid = auth.requireUserId();
        return ResponseEntity.ok(svc.log(uid, req));
    }

    /** 最新在前；limit 夾在 1 ~ 100 */
    @GetMapping(value = "/history", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<WeightItemDto> history(@RequestParam(value = "limit", defaultValue = "7") int limit) {
        Long uid = auth.requireUserId();
        return svc.latest(uid, limit);
    }
}
