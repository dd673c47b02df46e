package com.jdc.foodgram.jwt;

import com.jdc.foodgram.domain.entity.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import java.util.UUID;

@Slf4j
@Component
public class JwtTokenProvider {

    private final Key key;
    private final long tokenValidityInMilliseconds;

    public JwtTokenProvider(
            @Value("${jwt.secret}") String secret,
            @Value("${jwt.token-validity-in-ms}") long tokenValidityInMilliseconds
    ) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenValidityInMilliseconds = tokenValidityInMilliseconds;
    }

    /**
     * jti 는 로그아웃 시 폐기 여부를 확인하기 위한 토큰 식별자로, auth_tokens 에 함께 저장된다.
     */
    public IssuedToken createToken(User user) {
        Date now = new Date();
        Date expiry = new Date(now.getTime() + tokenValidityInMilliseconds);
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .setId(tokenId)
                .setSubject(String.valueOf(user.getId()))
                .claim("role", user.getRole().name())
                .setIssuedAt(now)
                .setExpiration(expiry)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();

        return new IssuedToken(token, tokenId,
                LocalDateTime.ofInstant(expiry.toInstant(), ZoneId.systemDefault()));
    }

    public Claims parseClaims(String token) {
        try {
            return Jwts.parserBuilder().setSigningKey(key).build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (ExpiredJwtException e) {
            log.debug("JWT 토큰이 만료되었습니다.");
            throw new JwtException("토큰이 만료되었습니다.");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("JWT 토큰이 유효하지 않습니다: {}", e.getMessage());
            throw new JwtException("유효하지 않은 토큰입니다.");
        }
    }

    public record IssuedToken(String token, String tokenId, LocalDateTime expiredAt) {
    }
}
