package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.recipe.RecipeDetailDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeSearchCondition;
import com.jdc.foodgram.security.CustomUserDetails;
import com.jdc.foodgram.service.RecipeSearchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/recipes")
@RequiredArgsConstructor
@Tag(name = "레시피 검색 API", description = "레시피 목록 필터링과 상세 조회 API입니다.")
public class RecipeSearchController {

    private final RecipeSearchService recipeSearchService;

    @GetMapping("/{id:\\d+}")
    @Operation(summary = "레시피 상세 조회", description = "레시피 ID를 기반으로 상세 정보를 조회합니다.")
    public ResponseEntity<RecipeDetailDto> getRecipeDetail(
            @PathVariable("id") Long recipeId,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long currentUserId = userDetails != null ? userDetails.getUserId() : null;
        return ResponseEntity.ok(recipeSearchService.getRecipeDetail(recipeId, currentUserId));
    }

    @GetMapping
    @Operation(summary = "레시피 목록 조회",
            description = "tags(slug, 여러 개면 OR), author, is_favorited, is_in_shopping_cart 조건을 AND 로 조합합니다. 최신순.")
    public ResponseEntity<Page<RecipeDetailDto>> search(
            @Parameter(description = "태그 slug") @RequestParam(name = "tags", required = false) List<String> tags,
            @Parameter(description = "작성자 ID") @RequestParam(name = "author", required = false) Long author,
            @Parameter(description = "0/1 또는 true/false") @RequestParam(name = "is_favorited", required = false) Boolean isFavorited,
            @Parameter(description = "0/1 또는 true/false") @RequestParam(name = "is_in_shopping_cart", required = false) Boolean isInShoppingCart,
            @AuthenticationPrincipal CustomUserDetails userDetails,
            @Parameter(hidden = true) Pageable pageable
    ) {
        Long currentUserId = userDetails != null ? userDetails.getUserId() : null;
        RecipeSearchCondition condition = new RecipeSearchCondition(tags, author, isFavorited, isInShoppingCart);
        return ResponseEntity.ok(recipeSearchService.search(condition, pageable, currentUserId));
    }
}
