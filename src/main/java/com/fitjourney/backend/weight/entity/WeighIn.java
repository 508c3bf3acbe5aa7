package com.fitjourney.backend.weight.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

@Getter @Setter @NoArgsConstructor
@Entity
@Table(
        name = "weigh_ins",
        uniqueConstraints = @UniqueConstraint(name = "uq_weigh_ins_user_date", columnNames = {"user_id", "log_date"})
)
public class WeighIn {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /** UTC 日曆日，一天一筆（同日再量就覆寫） */
    @Column(name = "log_date", nullable = false)
    private LocalDate logDate;

    /** 唯一真實來源（kg, 保留一位小數） */
    @Column(name = "weight_kg", nullable = false, precision = 6, scale = 1)
    private BigDecimal weightKg;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now(ZoneOffset.UTC);

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now(ZoneOffset.UTC);

    @PreUpdate void onUpdate() { updatedAt = OffsetDateTime.now(ZoneOffset.UTC); }
}
