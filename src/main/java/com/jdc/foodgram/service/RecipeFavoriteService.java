package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.RecipeShortDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.RecipeFavorite;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.RecipeFavoriteRepository;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class RecipeFavoriteService {

    private final RecipeFavoriteRepository favoriteRepository;
    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;

    @Transactional
    public RecipeShortDto addFavorite(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        if (favoriteRepository.existsByUserIdAndRecipeId(userId, recipeId)) {
            throw new CustomException(ErrorCode.ALREADY_FAVORITED_RECIPE);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        try {
            favoriteRepository.saveAndFlush(RecipeFavorite.builder().user(user).recipe(recipe).build());
        } catch (DataIntegrityViolationException e) {
            // 동시에 들어온 중복 요청이 유니크 제약에 걸린 경우
            throw new CustomException(ErrorCode.ALREADY_FAVORITED_RECIPE);
        }
        return RecipeMapper.toShortDto(recipe);
    }

    @Transactional
    public void removeFavorite(Long userId, Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }

        RecipeFavorite favorite = favoriteRepository.findByUserIdAndRecipeId(userId, recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.FAVORITE_NOT_FOUND));
        favoriteRepository.delete(favorite);
    }

    @Transactional
    public void deleteByRecipeId(Long recipeId) {
        favoriteRepository.deleteByRecipeId(recipeId);
    }
}
