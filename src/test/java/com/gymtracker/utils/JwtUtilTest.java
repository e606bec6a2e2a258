package com.gymtracker.utils;

import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtUtilTest {

    private JwtUtil jwtUtil;

    @BeforeEach
    void setUp() {
        jwtUtil = newJwtUtil("test-secret-key-with-at-least-32-bytes!!", 60_000L);
    }

    @Test
    void shouldReadUserIdFromBearerHeader() {
        String token = jwtUtil.generateToken(42L, "lifter");

        assertThat(jwtUtil.getUserIdFromHeader("Bearer " + token)).isEqualTo(42L);
        assertThat(jwtUtil.parseToken(token).get("username", String.class)).isEqualTo("lifter");
    }

    @Test
    void shouldRejectMissingOrMalformedHeader() {
        assertThatThrownBy(() -> jwtUtil.getUserIdFromHeader(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> jwtUtil.getUserIdFromHeader("Token abc"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectTokenSignedWithAnotherKey() {
        String foreign = newJwtUtil("another-secret-key-with-at-least-32-bytes", 60_000L)
                .generateToken(42L, "lifter");

        assertThat(jwtUtil.validateToken(foreign)).isFalse();
        assertThatThrownBy(() -> jwtUtil.getUserIdFromToken(foreign))
                .isInstanceOf(JwtException.class);
    }

    @Test
    void shouldRejectExpiredToken() {
        String expired = newJwtUtil("test-secret-key-with-at-least-32-bytes!!", -1_000L)
                .generateToken(42L, "lifter");

        assertThat(jwtUtil.validateToken(expired)).isFalse();
    }

    private JwtUtil newJwtUtil(String secret, long expiration) {
        JwtUtil util = new JwtUtil();
        ReflectionTestUtils.setField(util, "secret", secret);
        ReflectionTestUtils.setField(util, "expiration", expiration);
        util.init();
        return util;
    }
}
