package com.jdc.foodgram.mapper;

import com.jdc.foodgram.domain.dto.ingredient.IngredientDto;
import com.jdc.foodgram.domain.dto.recipe.ingredient.RecipeIngredientDto;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.RecipeIngredient;

public class IngredientMapper {

    public static IngredientDto toDto(Ingredient ingredient) {
        return IngredientDto.builder()
                .id(ingredient.getId())
                .name(ingredient.getName())
                .measurementUnit(ingredient.getMeasurementUnit())
                .build();
    }

    // 레시피에 포함된 재료: 카탈로그 정보 + 수량
    public static RecipeIngredientDto toRecipeIngredientDto(RecipeIngredient ri) {
        Ingredient ingredient = ri.getIngredient();
        return RecipeIngredientDto.builder()
                .id(ingredient.getId())
                .name(ingredient.getName())
                .measurementUnit(ingredient.getMeasurementUnit())
                .amount(ri.getAmount())
                .build();
    }
}
