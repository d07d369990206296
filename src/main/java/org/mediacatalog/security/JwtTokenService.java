package org.mediacatalog.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.mediacatalog.config.CatalogProperties;
import org.mediacatalog.exception.AuthException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Выпуск и проверка JWT (HS256). В subject хранится логин пользователя.
 */
@Slf4j
@Service
public class JwtTokenService {
    private final SecretKey key;
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public JwtTokenService(CatalogProperties properties) {
        this(properties, Clock.systemUTC());
    }

    JwtTokenService(CatalogProperties properties, Clock clock) {
        this.key = Keys.hmacShaKeyFor(properties.getSecurity().getJwtSecret().getBytes(StandardCharsets.UTF_8));
        this.ttl = Duration.ofMinutes(properties.getSecurity().getTokenTtlMinutes());
        this.clock = clock;
    }

    public String issueToken(String username) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(username)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * @return логин из проверенного токена
     * @throws AuthException если подпись неверна, токен просрочен или поврежден
     */
    public String validateToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                throw new AuthException("Не удалось проверить учетные данные");
            }
            return subject;
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Отклонен токен: {}", e.getMessage());
            throw new AuthException("Не удалось проверить учетные данные", e);
        }
    }
}
