package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.RecipeIngredient;
import com.jdc.foodgram.domain.repository.IngredientRepository;
import com.jdc.foodgram.domain.repository.RecipeIngredientRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class RecipeIngredientService {

    public static final int MIN_AMOUNT = 1;
    public static final int MAX_AMOUNT = 32000;
    private static final String FIELD = "ingredients";

    private final IngredientRepository ingredientRepository;
    private final RecipeIngredientRepository recipeIngredientRepository;

    /**
     * 재료 목록을 검증한다: 비어 있지 않고, 중복이 없고, 수량이 범위 안이며, 모두 카탈로그에 존재해야 한다.
     *
     * @return 재료 ID → 재료 엔티티
     */
    @Transactional(readOnly = true)
    public Map<Long, Ingredient> validate(List<RecipeIngredientRequestDto> dtos) {
        if (dtos == null || dtos.isEmpty()) {
            throw new CustomException(ErrorCode.EMPTY_INGREDIENTS, ErrorCode.EMPTY_INGREDIENTS.getMessage(), FIELD);
        }

        Set<Long> seen = new HashSet<>();
        for (RecipeIngredientRequestDto dto : dtos) {
            if (dto == null || dto.getId() == null) {
                throw new CustomException(ErrorCode.INGREDIENT_NOT_FOUND_IN_REQUEST,
                        ErrorCode.INGREDIENT_NOT_FOUND_IN_REQUEST.getMessage(), FIELD);
            }
            if (!seen.add(dto.getId())) {
                throw new CustomException(ErrorCode.DUPLICATE_INGREDIENT,
                        "재료가 중복되었습니다: " + dto.getId(), FIELD);
            }
            Integer amount = dto.getAmount();
            if (amount == null || amount < MIN_AMOUNT || amount > MAX_AMOUNT) {
                throw new CustomException(ErrorCode.INVALID_INGREDIENT_AMOUNT,
                        "재료 " + dto.getId() + "의 수량 " + amount + "이(가) 범위(1~32000)를 벗어났습니다.", FIELD);
            }
        }

        Map<Long, Ingredient> found = ingredientRepository.findAllById(seen).stream()
                .collect(Collectors.toMap(Ingredient::getId, Function.identity()));

        for (Long id : seen) {
            if (!found.containsKey(id)) {
                throw new CustomException(ErrorCode.INGREDIENT_NOT_FOUND_IN_REQUEST,
                        "존재하지 않는 재료입니다: " + id, FIELD);
            }
        }
        return found;
    }

    public List<RecipeIngredient> saveAll(Recipe recipe,
                                          List<RecipeIngredientRequestDto> dtos,
                                          Map<Long, Ingredient> ingredients) {
        List<RecipeIngredient> entities = dtos.stream()
                .map(dto -> RecipeIngredient.builder()
                        .recipe(recipe)
                        .ingredient(ingredients.get(dto.getId()))
                        .amount(dto.getAmount())
                        .build())
                .toList();

        List<RecipeIngredient> saved = recipeIngredientRepository.saveAll(entities);
        recipe.replaceIngredients(saved);
        return saved;
    }

    public List<RecipeIngredient> replaceIngredients(Recipe recipe,
                                                     List<RecipeIngredientRequestDto> dtos,
                                                     Map<Long, Ingredient> ingredients) {
        recipeIngredientRepository.deleteByRecipeId(recipe.getId());
        return saveAll(recipe, dtos, ingredients);
    }

    @Transactional
    public void deleteAllByRecipeId(Long recipeId) {
        recipeIngredientRepository.deleteByRecipeId(recipeId);
    }
}
