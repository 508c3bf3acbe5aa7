package com.fitjourney.backend.healthplan.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * 使用者目前的營養計畫（一人一筆）。journey 任務的 live target 從這裡讀。
 */
@Entity
@Table(name = "user_health_plan")
public class UserHealthPlan {

    @Id
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 32)
    private String source;

    @Column(name = "calc_version", nullable = false, length = 32)
    private String calcVersion;

    @Column(nullable = false)
    private Integer kcal;

    @Column(name = "protein_g", nullable = false)
    private Integer proteinG;

    @Column(name = "carbs_g", nullable = false)
    private Integer carbsG;

    @Column(name = "fat_g", nullable = false)
    private Integer fatG;

    /** 可為 null（舊計畫沒算 TDEE） */
    private Integer tdee;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist @PreUpdate
    void touch() { updatedAt = Instant.now(); }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getCalcVersion() { return calcVersion; }
    public void setCalcVersion(String calcVersion) { this.calcVersion = calcVersion; }

    public Integer getKcal() { return kcal; }
    public void setKcal(Integer kcal) { this.kcal = kcal; }

    public Integer getProteinG() { return proteinG; }
    public void setProteinG(Integer proteinG) { this.proteinG = proteinG; }

    public Integer getCarbsG() { return carbsG; }
    public void setCarbsG(Integer carbsG) { this.carbsG = carbsG; }

    public Integer getFatG() { return fatG; }
    public void setFatG(Integer fatG) { this.fatG = fatG; }

    public Integer getTdee() { return tdee; }
    public void setTdee(Integer tdee) { this.tdee = tdee; }

    public Instant getUpdatedAt() { return updatedAt; }
}
