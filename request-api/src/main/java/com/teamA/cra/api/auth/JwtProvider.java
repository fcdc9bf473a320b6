package com.teamA.cra.api.auth;

import com.teamA.cra.common.time.Clock;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

@Component
public class JwtProvider {

    static final String CLAIM_ROLE = "role";
    static final String CLAIM_NAME = "name";

    private final SecretKey key;
    private final long ttlMillis;
    private final Clock clock;

    public JwtProvider(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.ttl-seconds}") long ttlSeconds,
            Clock clock
    ) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlMillis = ttlSeconds * 1000L;
        this.clock = clock;
    }

    public String issue(String userId, String role, String name) {
        long now = clock.nowMillis();
        return Jwts.builder()
                .subject(userId)               // ✅ userId는 sub에
                .claim(CLAIM_ROLE, role)
                .claim(CLAIM_NAME, name == null ? "" : name)
                .issuedAt(new Date(now))
                .expiration(new Date(now + ttlMillis))
                .signWith(key)
                .compact();
    }

    /** 서명/만료가 틀리면 JwtException */
    public AuthenticatedUser parse(String token) {
        JwtParser parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> new Date(clock.nowMillis()))
                .build();
        Jws<Claims> jws = parser.parseSignedClaims(token);
        Claims claims = jws.getPayload();
        return new AuthenticatedUser(
                claims.getSubject(),
                claims.get(CLAIM_NAME, String.class),
                claims.get(CLAIM_ROLE, String.class)
        );
    }
}
