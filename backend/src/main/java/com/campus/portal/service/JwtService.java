package com.campus.portal.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

@Slf4j
@Service
public class JwtService {

    @Value("${portal.jwt.secret}")
    private String secretBase64;

    @Value("${portal.jwt.exp-min:60}")
    private long expMinutes;

    private final Clock clock;

    private SecretKey key;

    public JwtService(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        byte[] bytes = Decoders.BASE64.decode(secretBase64);
        this.key = Keys.hmacShaKeyFor(bytes);
    }

    public String generateToken(Long userId, String role) {
        Instant now = clock.instant();
        Instant exp = now.plusSeconds(expMinutes * 60);
        return Jwts.builder()
                .setSubject(String.valueOf(userId))
                .addClaims(Map.of("role", role))
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(key)
                .compact();
    }

    public boolean validate(String token) {
        try {
            Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("rejected token: {}", e.getMessage());
            return false;
        }
    }

    public String extractUserId(String token) {
        return getAllClaims(token).getSubject();
    }

    private Claims getAllClaims(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build()
                .parseClaimsJws(token).getBody();
    }
}
