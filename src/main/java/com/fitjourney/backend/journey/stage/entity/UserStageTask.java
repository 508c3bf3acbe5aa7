package com.fitjourney.backend.journey.stage.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(
        name = "user_stage_tasks",
        uniqueConstraints = @UniqueConstraint(name = "uq_stage_task_order", columnNames = {"user_stage_id", "order_index"})
)
public class UserStageTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_stage_id", nullable = false)
    private Long userStageId;

    @Column(name = "order_index", nullable = false)
    private Integer orderIndex;

    @Column(name = "key_code", nullable = false, length = 64)
    private String keyCode;

    @Column(nullable = false, length = 128)
    private String title;

    @Column(nullable = false)
    private Integer points = 10;

    /** 單一條件物件，或條件陣列（AND） */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "condition_json", columnDefinition = "json")
    private JsonNode conditionJson;

    @Column(name = "is_completed", nullable = false)
    private boolean completed;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
