package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.auth.LoginRequestDto;
import com.jdc.foodgram.domain.dto.auth.TokenResponseDto;
import com.jdc.foodgram.domain.entity.AuthToken;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.AuthTokenRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.jwt.JwtTokenProvider;
import com.jdc.foodgram.jwt.JwtTokenProvider.IssuedToken;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final AuthTokenRepository authTokenRepository;
    private final JwtTokenProvider jwtTokenProvider;
    private final PasswordEncoder passwordEncoder;

    /**
     * 이메일/비밀번호 확인 후 토큰을 발급하고 jti 를 저장한다.
     */
    @Transactional
    public TokenResponseDto login(LoginRequestDto dto) {
        User user = userRepository.findByEmail(dto.getEmail())
                .filter(u -> passwordEncoder.matches(dto.getPassword(), u.getPassword()))
                .orElseThrow(() -> new CustomException(ErrorCode.INVALID_CREDENTIALS));

        IssuedToken issued = jwtTokenProvider.createToken(user);
        authTokenRepository.save(AuthToken.builder()
                .tokenId(issued.tokenId())
                .user(user)
                .expiredAt(issued.expiredAt())
                .build());
        log.info("로그인: userId={}", user.getId());

        return new TokenResponseDto(issued.token());
    }

    /**
     * 토큰의 jti 를 삭제해 이후 같은 토큰으로는 인증되지 않게 한다.
     */
    @Transactional
    public void logout(String token) {
        if (token == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        Claims claims;
        try {
            claims = jwtTokenProvider.parseClaims(token);
        } catch (JwtException e) {
            throw new CustomException(ErrorCode.INVALID_TOKEN, e.getMessage());
        }

        int deleted = authTokenRepository.deleteByTokenId(claims.getId());
        log.info("로그아웃: userId={}, revoked={}", claims.getSubject(), deleted);
    }
}
