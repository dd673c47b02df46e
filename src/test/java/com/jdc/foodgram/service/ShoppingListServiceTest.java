package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto;
import com.jdc.foodgram.domain.repository.RecipeIngredientRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShoppingListServiceTest {

    @Mock
    private RecipeIngredientRepository recipeIngredientRepository;

    @InjectMocks
    private ShoppingListService shoppingListService;

    @Test
    @DisplayName("renderText: 재료마다 \"이름 (단위) — 합계\" 한 줄")
    void renderText_oneLinePerIngredient() {
        when(recipeIngredientRepository.sumIngredientsInShoppingCart(1L)).thenReturn(List.of(
                new ShoppingListItemDto("лук", "г", 100L),
                new ShoppingListItemDto("картофель", "г", 700L),
                new ShoppingListItemDto("соль", "г", 10L)));

        String text = shoppingListService.renderText(1L);

        assertEquals("лук (г) — 100\nкартофель (г) — 700\nсоль (г) — 10", text);
    }

    @Test
    @DisplayName("renderText: 장바구니가 비어 있으면 빈 문자열")
    void renderText_emptyCart() {
        when(recipeIngredientRepository.sumIngredientsInShoppingCart(1L)).thenReturn(List.of());

        assertEquals("", shoppingListService.renderText(1L));
    }
}
