package com.jdc.foodgram.domain.dto.recipe;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "레시피 간략 정보 DTO")
public class RecipeShortDto {
    private Long id;
    private String name;
    private String image;
    private Integer cookingTime;
}
