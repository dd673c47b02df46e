package com.jdc.foodgram.domain.dto.user;

import com.jdc.foodgram.domain.dto.recipe.RecipeShortDto;
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
@Schema(description = "구독한 작성자와 그 레시피")
public class UserWithRecipesDto {
    private String email;
    private Long id;
    private String username;
    private String firstName;
    private String lastName;
    private Boolean isSubscribed;
    private String avatar;

    @Schema(description = "recipes_limit 만큼 잘린 레시피 목록")
    private List<RecipeShortDto> recipes;

    @Schema(description = "작성자의 전체 레시피 수")
    private Long recipesCount;
}
