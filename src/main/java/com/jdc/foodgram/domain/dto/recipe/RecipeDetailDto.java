package com.jdc.foodgram.domain.dto.recipe;

import com.jdc.foodgram.domain.dto.recipe.ingredient.RecipeIngredientDto;
import com.jdc.foodgram.domain.dto.tag.TagDto;
import com.jdc.foodgram.domain.dto.user.UserDto;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "레시피 상세 정보 DTO")
public class RecipeDetailDto {

    private Long id;
    private List<TagDto> tags;
    private UserDto author;
    private List<RecipeIngredientDto> ingredients;

    @Schema(description = "현재 사용자의 즐겨찾기 여부 (비로그인 시 false)")
    private Boolean isFavorited;

    @Schema(description = "현재 사용자의 장바구니 포함 여부 (비로그인 시 false)")
    private Boolean isInShoppingCart;

    private String name;

    @Schema(description = "레시피 이미지 URL")
    private String image;

    private String text;

    @Schema(description = "조리 시간 (분)")
    private Integer cookingTime;
}
