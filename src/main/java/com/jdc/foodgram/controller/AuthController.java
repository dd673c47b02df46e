package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.auth.LoginRequestDto;
import com.jdc.foodgram.domain.dto.auth.TokenResponseDto;
import com.jdc.foodgram.jwt.JwtAuthenticationFilter;
import com.jdc.foodgram.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth/token")
@Tag(name = "인증 API", description = "이메일/비밀번호 로그인으로 토큰을 발급하고 로그아웃 시 폐기합니다.")
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    @Operation(summary = "로그인", description = "이메일과 비밀번호로 인증 토큰을 발급합니다. 이후 Authorization: Token <토큰> 헤더로 사용합니다.")
    public ResponseEntity<TokenResponseDto> login(@Valid @RequestBody LoginRequestDto request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/logout")
    @Operation(summary = "로그아웃", description = "현재 요청에 사용된 토큰을 폐기합니다.")
    public ResponseEntity<Void> logout(HttpServletRequest request) {
        authService.logout(JwtAuthenticationFilter.resolveToken(request));
        return ResponseEntity.noContent().build();
    }
}
