package com.fitjourney.backend.meal.controller;

import com.fitjourney.backend.auth.security.AuthContext;
import com.fitjourney.backend.meal.dto.LogMealRequest;
import com.fitjourney.backend.meal.dto.MealItemDto;
import com.fitjourney.backend.meal.service.MealService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/meals")
public class MealController {

    private final AuthContext auth;
    private final MealService svc;

    public MealController(AuthContext auth, MealService svc) {
        this.auth = auth;
        this.svc = svc;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MealItemDto> log(@Valid @RequestBody LogMealRequest req) {
        Long uid = auth.requireUserId();
        return ResponseEntity.ok(svc.log(uid, req));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<MealItemDto> list(
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        Long uid = auth.requireUserId();
        return svc.listByDate(uid, date);
    }
}
