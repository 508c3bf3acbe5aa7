package com.fitjourney.backend.journey.stage.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(
        name = "user_stages",
        uniqueConstraints = @UniqueConstraint(name = "uq_user_stage_index", columnNames = {"user_id", "stage_index"}),
        indexes = @Index(name = "idx_user_stages_state", columnList = "user_id,is_unlocked,is_completed")
)
public class UserStage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /** 1, 2, 3...（線性關卡） */
    @Column(name = "stage_index", nullable = false)
    private Integer stageIndex;

    @Column(nullable = false, length = 32)
    private String code;

    @Column(nullable = false, length = 128)
    private String title;

    @Column(name = "is_unlocked", nullable = false)
    private boolean unlocked;

    @Column(name = "is_completed", nullable = false)
    private boolean completed;

    /** 解鎖時間；streak / 累計類條件只算這之後的紀錄 */
    @Column(name = "unlocked_at")
    private Instant unlockedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
