package com.jdc.foodgram.domain.dto.recipe;

import com.jdc.foodgram.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.List;

/**
 * 레시피 수정용. image 가 없으면 기존 이미지를 유지하고, 태그와 재료는 전체 교체한다.
 */
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeUpdateRequestDto {

    @NotBlank(message = "레시피 이름은 필수입니다.")
    @Size(max = 256, message = "레시피 이름은 256자 이하여야 합니다.")
    private String name;

    @NotBlank(message = "레시피 설명은 필수입니다.")
    private String text;

    @NotNull(message = "조리 시간은 필수입니다.")
    private Integer cookingTime;

    private String image;

    private List<Long> tags;

    @Valid
    private List<RecipeIngredientRequestDto> ingredients;
}
