package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.recipe.RecipeShortDto;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.security.CustomUserDetails;
import com.jdc.foodgram.service.RecipeFavoriteService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@Tag(name = "레시피 즐겨찾기 API", description = "레시피를 즐겨찾기에 추가하거나 제거합니다.")
public class RecipeFavoriteController {

    private final RecipeFavoriteService favoriteService;

    @PostMapping("/{id}/favorite")
    @Operation(summary = "즐겨찾기 추가", description = "이미 즐겨찾기한 레시피면 400을 반환합니다.")
    public ResponseEntity<RecipeShortDto> addFavorite(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(favoriteService.addFavorite(userDetails.getUserId(), id));
    }

    @DeleteMapping("/{id}/favorite")
    @Operation(summary = "즐겨찾기 제거", description = "즐겨찾기에 없는 레시피면 400을 반환합니다.")
    public ResponseEntity<Void> removeFavorite(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        favoriteService.removeFavorite(userDetails.getUserId(), id);
        return ResponseEntity.noContent().build();
    }
}
