package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.ingredient.IngredientDto;
import com.jdc.foodgram.service.IngredientService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/ingredients")
@RequiredArgsConstructor
@Tag(name = "재료 API", description = "재료 카탈로그 조회 API입니다.")
public class IngredientController {

    private final IngredientService ingredientService;

    @GetMapping
    @Operation(summary = "재료 검색", description = "name 을 포함하는 재료를 돌려줍니다 (대소문자 무시, 앞부분 일치가 먼저).")
    public ResponseEntity<List<IngredientDto>> search(
            @Parameter(description = "검색어") @RequestParam(required = false) String name
    ) {
        return ResponseEntity.ok(ingredientService.search(name));
    }

    @GetMapping("/{id}")
    @Operation(summary = "재료 단건 조회")
    public ResponseEntity<IngredientDto> get(@Parameter(description = "재료 ID") @PathVariable Long id) {
        return ResponseEntity.ok(ingredientService.get(id));
    }
}
