package com.jijue.hospital_api.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Service;

import com.jijue.hospital_api.model.User;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;

@Service
public class JwtService {

    private static final Logger logger = LoggerFactory.getLogger(JwtService.class);

    public static final String ROLE_CLAIM = "role";
    public static final String PROFILE_CLAIM = "profileId";
    public static final String CODE_CLAIM = "code";

    private static final long EXPIRATION_TIME_MS = 1000 * 60 * 60 * 24; // 24 hours

    @Value("${jwt.secret}")
    private String secretKeyString;

    // --- Core JWT Methods ---

    public String extractUsername(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    public String extractRole(String token) {
        return extractClaim(token, claims -> claims.get(ROLE_CLAIM, String.class));
    }

    public <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
        final Claims claims = extractAllClaims(token);
        return claimsResolver.apply(claims);
    }

    /**
     * Token for a hospital account: the role claim plus the linked profile id and
     * PAT/DOC code when the account has them, so clients can route without a lookup.
     */
    public String generateAccountToken(User user) {
        Map<String, Object> claims = new HashMap<>();
        if (user.getProfileId() != null) {
            claims.put(PROFILE_CLAIM, user.getProfileId());
        }
        if (user.getCode() != null) {
            claims.put(CODE_CLAIM, user.getCode());
        }
        return generateToken(claims, user);
    }

    public String generateToken(UserDetails userDetails) {
        return generateToken(new HashMap<>(), userDetails);
    }

    public String generateToken(Map<String, Object> extraClaims, UserDetails userDetails) {
        Map<String, Object> claims = new HashMap<>(extraClaims);
        String roles = userDetails.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .collect(Collectors.joining(","));
        claims.put(ROLE_CLAIM, roles);

        long now = System.currentTimeMillis();
        return Jwts.builder()
                .claims(claims)
                .subject(userDetails.getUsername())
                .issuedAt(new Date(now))
                .expiration(new Date(now + EXPIRATION_TIME_MS))
                .signWith(getSigningKey(), Jwts.SIG.HS256)
                .compact();
    }

    public boolean isTokenValid(String token, UserDetails userDetails) {
        try {
            final String username = extractUsername(token);
            boolean isValid = username.equals(userDetails.getUsername()) && !isTokenExpired(token);
            if (!isValid) {
                logger.warn("Token validation failed for user '{}'.", userDetails.getUsername());
            }
            return isValid;
        } catch (SignatureException e) {
            logger.error("Invalid JWT signature: {}", e.getMessage());
        } catch (MalformedJwtException e) {
            logger.error("Invalid JWT token format: {}", e.getMessage());
        } catch (ExpiredJwtException e) {
            logger.warn("Expired JWT token: {}", e.getMessage());
        } catch (UnsupportedJwtException e) {
            logger.error("Unsupported JWT token: {}", e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.error("JWT claims string is empty or argument is invalid: {}", e.getMessage());
        }
        return false;
    }

    // --- Helper Methods ---

    private boolean isTokenExpired(String token) {
        return extractClaim(token, Claims::getExpiration).before(new Date());
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parser()
                .verifyWith(getSigningKey())
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /**
     * Any configured string is turned into a 256-bit HMAC key by hashing it with SHA-256.
     */
    private SecretKey getSigningKey() {
        if (secretKeyString == null || secretKeyString.isEmpty()) {
            logger.error("FATAL: JWT Secret Key (jwt.secret) is not configured!");
            throw new IllegalStateException("JWT Secret Key is missing. Please set JWT_SECRET environment variable.");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(secretKeyString.getBytes(StandardCharsets.UTF_8));
            return Keys.hmacShaKeyFor(hash);
        } catch (NoSuchAlgorithmException e) {
            logger.error("FATAL: SHA-256 algorithm not available: {}", e.getMessage());
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
