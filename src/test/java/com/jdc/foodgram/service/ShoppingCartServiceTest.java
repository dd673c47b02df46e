package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.RecipeShortDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.ShoppingCartItem;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.ShoppingCartItemRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShoppingCartServiceTest {

    @Mock
    private ShoppingCartItemRepository cartItemRepository;
    @Mock
    private RecipeRepository recipeRepository;
    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private ShoppingCartService shoppingCartService;

    private User user;
    private Recipe recipe;

    @BeforeEach
    void setUp() {
        user = User.builder().id(1L).build();
        recipe = Recipe.builder().id(20L).name("Плов").cookingTime(90).build();
    }

    @Test
    @DisplayName("addToCart: 장바구니에 담고 레시피 요약을 반환")
    void addToCart_success() {
        when(recipeRepository.findById(20L)).thenReturn(Optional.of(recipe));
        when(cartItemRepository.existsByUserIdAndRecipeId(1L, 20L)).thenReturn(false);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(cartItemRepository.saveAndFlush(any(ShoppingCartItem.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        RecipeShortDto result = shoppingCartService.addToCart(1L, 20L);

        assertEquals(20L, result.getId());
        verify(cartItemRepository).saveAndFlush(any(ShoppingCartItem.class));
    }

    @Test
    @DisplayName("addToCart: 이미 담긴 레시피면 ALREADY_IN_SHOPPING_CART 예외")
    void addToCart_duplicate_throwsException() {
        when(recipeRepository.findById(20L)).thenReturn(Optional.of(recipe));
        when(cartItemRepository.existsByUserIdAndRecipeId(1L, 20L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class,
                () -> shoppingCartService.addToCart(1L, 20L));

        assertEquals(ErrorCode.ALREADY_IN_SHOPPING_CART, ex.getErrorCode());
        verify(cartItemRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("removeFromCart: 장바구니에 없으면 CART_ITEM_NOT_FOUND 예외")
    void removeFromCart_missing_throwsException() {
        when(recipeRepository.existsById(20L)).thenReturn(true);
        when(cartItemRepository.findByUserIdAndRecipeId(1L, 20L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class,
                () -> shoppingCartService.removeFromCart(1L, 20L));

        assertEquals(ErrorCode.CART_ITEM_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    @DisplayName("removeFromCart: 담긴 레시피면 삭제")
    void removeFromCart_existing_deletes() {
        ShoppingCartItem item = ShoppingCartItem.builder().id(5L).user(user).recipe(recipe).build();
        when(recipeRepository.existsById(20L)).thenReturn(true);
        when(cartItemRepository.findByUserIdAndRecipeId(1L, 20L)).thenReturn(Optional.of(item));

        shoppingCartService.removeFromCart(1L, 20L);

        verify(cartItemRepository).delete(item);
    }
}
