package com.jdc.foodgram.mapper;

import com.jdc.foodgram.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeDetailDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeShortDto;
import com.jdc.foodgram.domain.dto.tag.TagDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.User;

import java.util.Comparator;

public class RecipeMapper {

    public static Recipe toEntity(RecipeCreateRequestDto dto, User author, String imageUrl) {
        return Recipe.builder()
                .author(author)
                .name(dto.getName())
                .text(dto.getText())
                .cookingTime(dto.getCookingTime())
                .image(imageUrl)
                .build();
    }

    public static RecipeShortDto toShortDto(Recipe recipe) {
        return RecipeShortDto.builder()
                .id(recipe.getId())
                .name(recipe.getName())
                .image(recipe.getImage())
                .cookingTime(recipe.getCookingTime())
                .build();
    }

    /**
     * 태그/재료 컬렉션은 지연 로딩이므로 트랜잭션 안에서 호출해야 한다.
     */
    public static RecipeDetailDto toDetailDto(Recipe recipe,
                                              boolean favorited,
                                              boolean inShoppingCart,
                                              boolean authorSubscribed) {
        return RecipeDetailDto.builder()
                .id(recipe.getId())
                .tags(recipe.getTags().stream()
                        .map(rt -> TagMapper.toDto(rt.getTag()))
                        .sorted(Comparator.comparing(TagDto::getId))
                        .toList())
                .author(UserMapper.toDto(recipe.getAuthor(), authorSubscribed))
                .ingredients(recipe.getIngredients().stream()
                        .map(IngredientMapper::toRecipeIngredientDto)
                        .toList())
                .isFavorited(favorited)
                .isInShoppingCart(inShoppingCart)
                .name(recipe.getName())
                .image(recipe.getImage())
                .text(recipe.getText())
                .cookingTime(recipe.getCookingTime())
                .build();
    }
}
