package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto;
import com.jdc.foodgram.domain.repository.RecipeIngredientRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ShoppingListService {

    public static final String FILE_NAME = "shopping_list.txt";

    private final RecipeIngredientRepository recipeIngredientRepository;

    /**
     * 장바구니 레시피들의 재료를 재료별로 합산한다. 이름, 단위 오름차순.
     */
    @Transactional(readOnly = true)
    public List<ShoppingListItemDto> aggregate(Long userId) {
        return recipeIngredientRepository.sumIngredientsInShoppingCart(userId);
    }

    @Transactional(readOnly = true)
    public String renderText(Long userId) {
        return render(aggregate(userId));
    }

    public static String render(List<ShoppingListItemDto> items) {
        return items.stream()
                .map(ShoppingListItemDto::toLine)
                .collect(Collectors.joining("\n"));
    }
}
