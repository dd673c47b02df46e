package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.user.AvatarRequestDto;
import com.jdc.foodgram.domain.dto.user.AvatarResponseDto;
import com.jdc.foodgram.domain.dto.user.PasswordChangeRequestDto;
import com.jdc.foodgram.domain.dto.user.UserDto;
import com.jdc.foodgram.domain.dto.user.UserSignupRequestDto;
import com.jdc.foodgram.domain.dto.user.UserSignupResponseDto;
import com.jdc.foodgram.domain.dto.user.UserWithRecipesDto;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.security.CustomUserDetails;
import com.jdc.foodgram.service.SubscriptionService;
import com.jdc.foodgram.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/users")
@Tag(name = "사용자 API", description = "회원 가입, 프로필, 아바타, 비밀번호, 구독 관련 API입니다.")
public class UserController {

    private final UserService userService;
    private final SubscriptionService subscriptionService;

    @PostMapping
    @Operation(summary = "회원 가입")
    public ResponseEntity<UserSignupResponseDto> signup(@Valid @RequestBody UserSignupRequestDto request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.signup(request));
    }

    @GetMapping
    @Operation(summary = "사용자 목록 조회", description = "page, limit 파라미터로 페이지를 지정합니다.")
    public ResponseEntity<Page<UserDto>> getUsers(
            @AuthenticationPrincipal CustomUserDetails userDetails,
            @Parameter(hidden = true) Pageable pageable
    ) {
        Long userId = userDetails != null ? userDetails.getUserId() : null;
        return ResponseEntity.ok(userService.getUsers(pageable, userId));
    }

    @GetMapping("/me")
    @Operation(summary = "내 정보 조회")
    public ResponseEntity<UserDto> getMe(@AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.ok(userService.getMe(userDetails.getUserId()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "사용자 프로필 조회")
    public ResponseEntity<UserDto> getUser(
            @Parameter(description = "사용자 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long userId = userDetails != null ? userDetails.getUserId() : null;
        return ResponseEntity.ok(userService.getUser(id, userId));
    }

    @PutMapping("/me/avatar")
    @Operation(summary = "아바타 변경", description = "data:image/<확장자>;base64, 형식의 이미지를 저장하고 URL을 돌려줍니다.")
    public ResponseEntity<AvatarResponseDto> updateAvatar(
            @Valid @RequestBody AvatarRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.ok(userService.updateAvatar(userDetails.getUserId(), request.getAvatar()));
    }

    @DeleteMapping("/me/avatar")
    @Operation(summary = "아바타 삭제")
    public ResponseEntity<Void> deleteAvatar(@AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        userService.deleteAvatar(userDetails.getUserId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/set_password")
    @Operation(summary = "비밀번호 변경")
    public ResponseEntity<Void> setPassword(
            @Valid @RequestBody PasswordChangeRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        userService.changePassword(userDetails.getUserId(), request);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/subscriptions")
    @Operation(summary = "내 구독 목록", description = "구독한 작성자와 각 작성자의 레시피(recipes_limit 개까지)를 조회합니다.")
    public ResponseEntity<Page<UserWithRecipesDto>> getSubscriptions(
            @Parameter(description = "작성자별 레시피 최대 개수") @RequestParam(name = "recipes_limit", required = false) Integer recipesLimit,
            @AuthenticationPrincipal CustomUserDetails userDetails,
            @Parameter(hidden = true) Pageable pageable
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.ok(subscriptionService.getSubscriptions(userDetails.getUserId(), pageable, recipesLimit));
    }

    @PostMapping("/{id}/subscribe")
    @Operation(summary = "구독")
    public ResponseEntity<UserWithRecipesDto> subscribe(
            @Parameter(description = "구독할 작성자 ID") @PathVariable Long id,
            @RequestParam(name = "recipes_limit", required = false) Integer recipesLimit,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(subscriptionService.subscribe(userDetails.getUserId(), id, recipesLimit));
    }

    @DeleteMapping("/{id}/subscribe")
    @Operation(summary = "구독 취소")
    public ResponseEntity<Void> unsubscribe(
            @Parameter(description = "구독 취소할 작성자 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        subscriptionService.unsubscribe(userDetails.getUserId(), id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "사용자 삭제 (관리자)", description = "작성한 레시피와 모든 관계를 함께 삭제합니다.")
    public ResponseEntity<Void> deleteUser(@Parameter(description = "사용자 ID") @PathVariable Long id) {
        userService.deleteUser(id);
        return ResponseEntity.noContent().build();
    }
}
