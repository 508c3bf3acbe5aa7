package com.fitjourney.backend.auth.security;

import com.fitjourney.backend.auth.entity.AuthToken;
import com.fitjourney.backend.auth.repo.AuthTokenRepo;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class AccessTokenFilterTest {

    private static final Instant NOW = Instant.parse("2026-03-10T08:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @AfterEach
    void clear() {
        SecurityContextHolder.clearContext();
    }

    private static AuthToken token(Instant expiresAt, boolean revoked) {
        AuthToken t = new AuthToken();
        t.setToken("abc");
        t.setUserId(7L);
        t.setExpiresAt(expiresAt);
        t.setRevoked(revoked);
        return t;
    }

    @Test
    void valid_token_sets_user_id_principal() throws Exception {
        AuthTokenRepo repo = mock(AuthTokenRepo.class);
        when(repo.findByToken("abc")).thenReturn(Optional.of(token(NOW.plusSeconds(60), false)));
        FilterChain chain = mock(FilterChain.class);

        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/v1/meals");
        req.addHeader("Authorization", "Bearer abc");
        MockHttpServletResponse res = new MockHttpServletResponse();

        new AccessTokenFilter(repo, CLOCK).doFilter(req, res, chain);

        verify(chain).doFilter(req, res);
        assertThat(new AuthContext().requireUserId()).isEqualTo(7L);
    }

    @Test
    void expired_token_is_rejected_with_json_401() throws Exception {
        AuthTokenRepo repo = mock(AuthTokenRepo.class);
        when(repo.findByToken("abc")).thenReturn(Optional.of(token(NOW.minusSeconds(1), false)));
        FilterChain chain = mock(FilterChain.class);

        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/v1/meals");
        req.addHeader("Authorization", "Bearer abc");
        MockHttpServletResponse res = new MockHttpServletResponse();

        new AccessTokenFilter(repo, CLOCK).doFilter(req, res, chain);

        assertThat(res.getStatus()).isEqualTo(401);
        assertThat(res.getContentAsString()).contains("UNAUTHORIZED");
        verifyNoInteractions(chain);
    }

    @Test
    void missing_header_passes_through_without_authentication() throws Exception {
        AuthTokenRepo repo = mock(AuthTokenRepo.class);
        FilterChain chain = mock(FilterChain.class);
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/v1/meals");
        MockHttpServletResponse res = new MockHttpServletResponse();

        new AccessTokenFilter(repo, CLOCK).doFilter(req, res, chain);

        verify(chain).doFilter(req, res);
        verifyNoInteractions(repo);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }
}
