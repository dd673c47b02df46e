package com.jdc.foodgram.domain.dto.recipe;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RecipeSearchCondition {

    @Schema(description = "태그 slug 목록 (하나라도 일치하면 포함)", example = "breakfast")
    private List<String> tags;

    @Schema(description = "작성자 ID", example = "1")
    private Long author;

    @Schema(description = "true 이면 내가 즐겨찾기한 레시피만")
    private Boolean isFavorited;

    @Schema(description = "true 이면 내 장바구니에 담긴 레시피만")
    private Boolean isInShoppingCart;

    public boolean favoritedOnly() {
        return Boolean.TRUE.equals(isFavorited);
    }

    public boolean inShoppingCartOnly() {
        return Boolean.TRUE.equals(isInShoppingCart);
    }
}
