package com.fitjourney.backend.weight.service;

import com.fitjourney.backend.journey.cache.ProgressCacheInvalidator;
import com.fitjourney.backend.weight.dto.LogWeightRequest;
import com.fitjourney.backend.weight.dto.WeightItemDto;
import com.fitjourney.backend.weight.entity.WeighIn;
import com.fitjourney.backend.weight.repo.WeighInRepo;
import com.fitjourney.backend.weight.support.Units;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
public class WeightService {

    static final double MIN_KG = 20.0;
    static final double MAX_KG = 400.0;

    private final WeighInRepo weighIns;
    private final ProgressCacheInvalidator invalidator;
    private final Clock clock;

    public WeightService(WeighInRepo weighIns, ProgressCacheInvalidator invalidator, Clock clock) {
        this.weighIns = weighIns;
        this.invalidator = invalidator;
        this.clock = clock;
    }

    /** 同一天只留一筆：再量一次就覆寫 */
    @Transactional
    public WeightItemDto log(Long uid, LogWeightRequest req) {
        LocalDate today = LocalDate.now(clock);
        LocalDate logDate = (req.logDate() != null) ? req.logDate() : today;
        if (logDate.isAfter(today)) throw new IllegalArgumentException("LOG_DATE_IN_FUTURE");

        if (req.weightKg() == null && req.weightLbs() == null) {
            throw new IllegalArgumentException("WEIGHT_REQUIRED");
        }

        Double kgD = (req.weightKg() != null) ? Units.floor(req.weightKg(), 1) : Units.lbsToKg1(req.weightLbs());
        if (kgD == null || kgD < MIN_KG || kgD > MAX_KG) {
            throw new IllegalArgumentException("WEIGHT_OUT_OF_RANGE");
        }
        BigDecimal kg = BigDecimal.valueOf(kgD).setScale(1, RoundingMode.HALF_UP);

        WeighIn w = weighIns.findByUserIdAndLogDate(uid, logDate).orElseGet(WeighIn::new);
        w.setUserId(uid);
        w.setLogDate(logDate);
        w.setWeightKg(kg);
        weighIns.save(w);

        invalidator.invalidateUserAfterCommit(uid);
        log.info("weigh-in logged. userId={} logDate={} kg={}", uid, logDate, kg);
        return toItem(w);
    }

    public List<WeightItemDto> latest(Long uid, int limit) {
        int size = Math.max(1, Math.min(limit, 100));
        return weighIns.findLatest(uid, PageRequest.of(0, size)).stream()
                .map(WeightService::toItem)
                .toList();
    }

    static WeightItemDto toItem(WeighIn w) {
        Double lbs = Units.kgToLbs1(w.getWeightKg());
        return new WeightItemDto(
                w.getLogDate(),
                w.getWeightKg(),
                (lbs == null) ? null : BigDecimal.valueOf(lbs).setScale(1, RoundingMode.HALF_UP)
        );
    }
}
