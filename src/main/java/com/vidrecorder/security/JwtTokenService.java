package com.vidrecorder.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Issues and verifies HS256 bearer tokens. The subject is the user id, {@code name} the display
 * name and {@code roles} an optional list of role names.
 */
@Service
@Slf4j
public class JwtTokenService {

    static final String NAME_CLAIM = "name";
    static final String ROLES_CLAIM = "roles";

    private final JwtConfig jwtConfig;
    private final SecretKey key;

    public JwtTokenService(JwtConfig jwtConfig) {
        this.jwtConfig = jwtConfig;
        this.key = Keys.hmacShaKeyFor(jwtConfig.getSecret().getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(String userId, String displayName, Collection<String> roles) {
        Date now = new Date();
        return Jwts.builder()
                .subject(userId)
                .claim(NAME_CLAIM, displayName)
                .claim(ROLES_CLAIM, List.copyOf(roles))
                .issuedAt(now)
                .expiration(new Date(now.getTime() + jwtConfig.getExpiration().toMillis()))
                .signWith(key)
                .compact();
    }

    /**
     * @return the verified claims, or empty when the token is malformed, forged or expired
     */
    public Optional<Claims> parse(String token) {
        try {
            return Optional.of(Jwts.parser().verifyWith(key).build().parseSignedClaims(token).getPayload());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public RecordingUser toUser(Claims claims) {
        String name = claims.get(NAME_CLAIM, String.class);
        return new RecordingUser(claims.getSubject(), name != null ? name : claims.getSubject());
    }

    public List<String> roles(Claims claims) {
        Object raw = claims.get(ROLES_CLAIM);
        if (raw instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
