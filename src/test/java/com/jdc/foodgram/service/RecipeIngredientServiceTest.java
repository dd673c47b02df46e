package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.RecipeIngredient;
import com.jdc.foodgram.domain.repository.IngredientRepository;
import com.jdc.foodgram.domain.repository.RecipeIngredientRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeIngredientServiceTest {

    @Mock
    private IngredientRepository ingredientRepository;
    @Mock
    private RecipeIngredientRepository recipeIngredientRepository;

    @InjectMocks
    private RecipeIngredientService recipeIngredientService;

    private final Ingredient onion = Ingredient.builder().id(1L).name("лук репчатый").measurementUnit("г").build();
    private final Ingredient salt = Ingredient.builder().id(2L).name("соль").measurementUnit("г").build();

    @Test
    @DisplayName("validate: 모든 재료가 유효하면 ID → 재료 맵을 돌려준다")
    void validate_success() {
        when(ingredientRepository.findAllById(Set.of(1L, 2L))).thenReturn(List.of(onion, salt));

        Map<Long, Ingredient> result = recipeIngredientService.validate(List.of(
                new RecipeIngredientRequestDto(1L, 100),
                new RecipeIngredientRequestDto(2L, 5)));

        assertEquals(onion, result.get(1L));
        assertEquals(salt, result.get(2L));
    }

    @Test
    @DisplayName("validate: 빈 목록이면 EMPTY_INGREDIENTS 예외")
    void validate_empty_throwsException() {
        CustomException ex = assertThrows(CustomException.class,
                () -> recipeIngredientService.validate(List.of()));

        assertEquals(ErrorCode.EMPTY_INGREDIENTS, ex.getErrorCode());
        assertEquals("ingredients", ex.getField());
    }

    @Test
    @DisplayName("validate: 같은 재료가 두 번 오면 DUPLICATE_INGREDIENT 예외")
    void validate_duplicate_throwsException() {
        CustomException ex = assertThrows(CustomException.class,
                () -> recipeIngredientService.validate(List.of(
                        new RecipeIngredientRequestDto(1L, 100),
                        new RecipeIngredientRequestDto(1L, 200))));

        assertEquals(ErrorCode.DUPLICATE_INGREDIENT, ex.getErrorCode());
        verifyNoInteractions(ingredientRepository);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -5, 32001})
    @DisplayName("validate: 수량이 1~32000 범위를 벗어나면 INVALID_INGREDIENT_AMOUNT 예외")
    void validate_amountOutOfRange_throwsException(int amount) {
        CustomException ex = assertThrows(CustomException.class,
                () -> recipeIngredientService.validate(List.of(new RecipeIngredientRequestDto(1L, amount))));

        assertEquals(ErrorCode.INVALID_INGREDIENT_AMOUNT, ex.getErrorCode());
    }

    @Test
    @DisplayName("validate: 카탈로그에 없는 재료면 INGREDIENT_NOT_FOUND_IN_REQUEST 예외")
    void validate_unknownIngredient_throwsException() {
        when(ingredientRepository.findAllById(Set.of(1L, 77L))).thenReturn(List.of(onion));

        CustomException ex = assertThrows(CustomException.class,
                () -> recipeIngredientService.validate(List.of(
                        new RecipeIngredientRequestDto(1L, 100),
                        new RecipeIngredientRequestDto(77L, 1))));

        assertEquals(ErrorCode.INGREDIENT_NOT_FOUND_IN_REQUEST, ex.getErrorCode());
    }

    @Test
    @DisplayName("saveAll: 요청 수량으로 연결을 저장하고 레시피 컬렉션을 맞춘다")
    void saveAll_savesAmounts() {
        Recipe recipe = Recipe.builder().id(10L).build();
        when(recipeIngredientRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        List<RecipeIngredient> saved = recipeIngredientService.saveAll(recipe,
                List.of(new RecipeIngredientRequestDto(1L, 300)),
                Map.of(1L, onion));

        assertEquals(1, saved.size());
        assertEquals(300, saved.get(0).getAmount());
        assertSame(onion, saved.get(0).getIngredient());
        assertEquals(saved, recipe.getIngredients());
    }
}
