package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.RecipeShortDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.ShoppingCartItem;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.ShoppingCartItemRepository;
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
public class ShoppingCartService {

    private final ShoppingCartItemRepository cartItemRepository;
    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;

    @Transactional
    public RecipeShortDto addToCart(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        if (cartItemRepository.existsByUserIdAndRecipeId(userId, recipeId)) {
            throw new CustomException(ErrorCode.ALREADY_IN_SHOPPING_CART);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        try {
            cartItemRepository.saveAndFlush(ShoppingCartItem.builder().user(user).recipe(recipe).build());
        } catch (DataIntegrityViolationException e) {
            // 동시에 들어온 중복 요청이 유니크 제약에 걸린 경우
            throw new CustomException(ErrorCode.ALREADY_IN_SHOPPING_CART);
        }
        return RecipeMapper.toShortDto(recipe);
    }

    @Transactional
    public void removeFromCart(Long userId, Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }

        ShoppingCartItem cartItem = cartItemRepository.findByUserIdAndRecipeId(userId, recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.CART_ITEM_NOT_FOUND));
        cartItemRepository.delete(cartItem);
    }

    @Transactional
    public void deleteByRecipeId(Long recipeId) {
        cartItemRepository.deleteByRecipeId(recipeId);
    }
}
