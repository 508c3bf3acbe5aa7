package com.fitjourney.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * 帳號服務簽發的 access token（本服務只讀，不簽發）。
 */
@Data
@Entity @Table(name = "auth_tokens")
public class AuthToken {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(nullable = false, unique = true, length = 64) private String token;
    @Column(name = "user_id", nullable = false) private Long userId;
    @Column(nullable = false) private Instant expiresAt;
    @Column(nullable = false) private boolean revoked = false;
}
