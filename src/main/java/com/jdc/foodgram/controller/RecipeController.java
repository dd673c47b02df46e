package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeDetailDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeUpdateRequestDto;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.security.CustomUserDetails;
import com.jdc.foodgram.service.RecipeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/recipes")
@RequiredArgsConstructor
@Tag(name = "레시피 API", description = "레시피 생성, 수정, 삭제 API입니다.")
public class RecipeController {

    private final RecipeService recipeService;

    @PostMapping
    @Operation(summary = "레시피 생성", description = "이미지는 data:image/<확장자>;base64, 형식, 태그는 ID 목록, 재료는 {id, amount} 목록입니다.")
    public ResponseEntity<RecipeDetailDto> createRecipe(
            @Valid @RequestBody RecipeCreateRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(recipeService.createRecipe(request, userDetails.getUserId()));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "레시피 수정", description = "작성자만 수정할 수 있으며 태그와 재료는 전체 교체됩니다. 이미지를 생략하면 기존 이미지가 유지됩니다.")
    public ResponseEntity<RecipeDetailDto> updateRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @Valid @RequestBody RecipeUpdateRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.ok(recipeService.updateRecipe(id, request, userDetails.getUserId()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "레시피 삭제", description = "작성자만 삭제할 수 있습니다.")
    public ResponseEntity<Void> deleteRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        recipeService.deleteRecipe(id, userDetails.getUserId());
        return ResponseEntity.noContent().build();
    }
}
