package com.gatekeeper.authgovernor.config;

import com.gatekeeper.authgovernor.domain.PhoneNumbers;
import com.gatekeeper.authgovernor.domain.UserType;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    public static final String CLAIM_USER_ID = "uid";
    public static final String CLAIM_ROLES = "roles";
    public static final String CLAIM_USER_TYPE = "user_type";
    public static final String CLAIM_SESSION_TOKEN = "session_token";

    private final Key key;
    private final long ttlSeconds;
    private final Clock clock;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.ttl-seconds:3600}") long ttlSeconds,
            Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlSeconds = ttlSeconds;
        this.clock = clock;
        log.info("JWT service initialized with TTL: {} seconds", ttlSeconds);
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    /* ------------------------ token creation ------------------------ */

    /**
     * Issues a bearer token. {@code sessionToken} ties it to one device session
     * and is omitted when null.
     */
    public String generateToken(String phoneNumber, UUID userId, Set<String> roles,
                                UserType userType, String sessionToken) {
        Instant now = clock.instant();
        Date iat = Date.from(now);
        Date exp = Date.from(now.plusSeconds(ttlSeconds));

        log.debug("Generating JWT token for user: {}, type: {}, roles: {}, device-bound: {}",
                PhoneNumbers.mask(phoneNumber), userType, roles, sessionToken != null);

        JwtBuilder builder = Jwts.builder()
                .setSubject(phoneNumber)
                .setIssuedAt(iat)
                .setExpiration(exp)
                .claim(CLAIM_USER_ID, userId == null ? null : userId.toString())
                .claim(CLAIM_ROLES, roles == null ? List.of() : new ArrayList<>(roles))
                .claim(CLAIM_USER_TYPE, userType == null ? null : userType.name());
        if (sessionToken != null) {
            builder.claim(CLAIM_SESSION_TOKEN, sessionToken);
        }
        return builder.signWith(key, SignatureAlgorithm.HS256).compact();
    }

    /* ------------------------ token parsing ------------------------ */

    public Jws<Claims> parse(String token) {
        try {
            return Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token);
        } catch (Exception e) {
            log.debug("Failed to parse JWT token: {}", e.getMessage());
            throw e;
        }
    }

    public Optional<String> getSubject(String token) {
        try {
            return Optional.ofNullable(parse(token).getBody().getSubject());
        } catch (Exception e) {
            log.warn("Failed to extract subject from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Set<String> getRoles(String token) {
        try {
            return rolesFrom(parse(token).getBody());
        } catch (Exception e) {
            log.warn("Failed to extract roles from token: {}", e.getMessage());
            return Set.of();
        }
    }

    public Optional<UUID> getUserId(String token) {
        try {
            return userIdFrom(parse(token).getBody());
        } catch (Exception e) {
            log.warn("Failed to extract user id from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<UserType> getUserType(String token) {
        try {
            return userTypeFrom(parse(token).getBody());
        } catch (Exception e) {
            log.warn("Failed to extract user type from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Empty for credentials issued before device binding existed. */
    public Optional<String> getSessionToken(String token) {
        try {
            return sessionTokenFrom(parse(token).getBody());
        } catch (Exception e) {
            log.warn("Failed to extract session token claim: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isTokenExpired(String token) {
        try {
            Claims claims = parse(token).getBody();
            return claims.getExpiration().before(Date.from(clock.instant()));
        } catch (Exception e) {
            log.debug("Token validation failed: {}", e.getMessage());
            return true;
        }
    }

    /* ------------------------ claim readers ------------------------ */

    static Set<String> rolesFrom(Claims claims) {
        Object rolesObj = claims.get(CLAIM_ROLES);
        if (rolesObj instanceof Collection<?> col) {
            Set<String> roles = new HashSet<>();
            for (Object o : col) {
                roles.add(String.valueOf(o));
            }
            return roles;
        }
        return Set.of();
    }

    static Optional<UUID> userIdFrom(Claims claims) {
        Object uid = claims.get(CLAIM_USER_ID);
        if (uid == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(String.valueOf(uid)));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid user id claim in JWT token");
            return Optional.empty();
        }
    }

    static Optional<UserType> userTypeFrom(Claims claims) {
        Object type = claims.get(CLAIM_USER_TYPE);
        if (type == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UserType.valueOf(String.valueOf(type)));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown user type claim in JWT token: {}", type);
            return Optional.empty();
        }
    }

    static Optional<String> sessionTokenFrom(Claims claims) {
        Object value = claims.get(CLAIM_SESSION_TOKEN);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }
}
