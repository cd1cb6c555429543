package com.taskboard.servicebackend.security;

import com.taskboard.servicebackend.user.AppUser;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

@Component
public class JwtService {
    private final JwtProperties properties;
    private final Key signingKey;
    private final Clock clock;

    public JwtService(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.signingKey = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
    }

    public String issue(AppUser user) {
        return issue(user.getId(), user.getName(), user.getEmail());
    }

    public String issue(long userId, String name, String email) {
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plusMillis(properties.expiration());

        return Jwts.builder()
                .setSubject(Long.toString(userId))
                .claim("name", name)
                .claim("email", email)
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Checks signature and expiry and decodes the identity.
     *
     * @throws TokenVerificationException with reason {@code EXPIRED} for an outdated but otherwise
     *                                    genuine token, {@code INVALID} for anything else
     */
    public TokenIdentity verify(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return new TokenIdentity(
                    Long.parseLong(claims.getSubject()),
                    claims.get("name", String.class),
                    claims.get("email", String.class),
                    claims.getExpiration().toInstant());
        } catch (ExpiredJwtException e) {
            throw new TokenVerificationException(TokenVerificationException.Reason.EXPIRED, e);
        } catch (JwtException | IllegalArgumentException e) {
            // NumberFormatException for a non-numeric subject lands here too
            throw new TokenVerificationException(TokenVerificationException.Reason.INVALID, e);
        }
    }

    public boolean isExpiringSoon(TokenIdentity identity) {
        Instant threshold = clock.instant().plusMillis(properties.refreshThreshold());
        return identity.expiresAt().isBefore(threshold);
    }
}
