package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.RecipeDetailDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeSearchCondition;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.repository.RecipeFavoriteRepository;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.ShoppingCartItemRepository;
import com.jdc.foodgram.domain.repository.SubscriptionRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeSearchService {

    private final RecipeRepository recipeRepository;
    private final RecipeFavoriteRepository recipeFavoriteRepository;
    private final ShoppingCartItemRepository shoppingCartItemRepository;
    private final SubscriptionRepository subscriptionRepository;

    @Transactional(readOnly = true)
    public RecipeDetailDto getRecipeDetail(Long recipeId, Long currentUserId) {
        Recipe recipe = recipeRepository.findWithAuthorById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        return buildDetail(recipe, currentUserId);
    }

    /**
     * 즐겨찾기/장바구니 필터는 true 일 때만 적용되며, 비로그인 사용자가 true 를 보내면 401.
     */
    @Transactional(readOnly = true)
    public Page<RecipeDetailDto> search(RecipeSearchCondition condition, Pageable pageable, Long currentUserId) {
        if (currentUserId == null && (condition.favoritedOnly() || condition.inShoppingCartOnly())) {
            throw new CustomException(ErrorCode.UNAUTHORIZED,
                    "즐겨찾기/장바구니 필터는 로그인 후 사용할 수 있습니다.");
        }

        Page<Recipe> page = recipeRepository.search(condition, pageable, currentUserId);
        if (currentUserId == null || page.isEmpty()) {
            return page.map(recipe -> RecipeMapper.toDetailDto(recipe, false, false, false));
        }

        List<Long> recipeIds = page.getContent().stream()
                .map(Recipe::getId)
                .toList();
        List<Long> authorIds = page.getContent().stream()
                .map(recipe -> recipe.getAuthor().getId())
                .distinct()
                .toList();

        Set<Long> favoritedIds = recipeFavoriteRepository
                .findRecipeIdsByUserIdAndRecipeIdIn(currentUserId, recipeIds);
        Set<Long> cartIds = shoppingCartItemRepository
                .findRecipeIdsByUserIdAndRecipeIdIn(currentUserId, recipeIds);
        Set<Long> subscribedAuthorIds = subscriptionRepository
                .findAuthorIdsByFollowerIdAndAuthorIdIn(currentUserId, authorIds);

        return page.map(recipe -> RecipeMapper.toDetailDto(
                recipe,
                favoritedIds.contains(recipe.getId()),
                cartIds.contains(recipe.getId()),
                subscribedAuthorIds.contains(recipe.getAuthor().getId())
        ));
    }

    /**
     * 단건 응답용. 현재 사용자 기준 즐겨찾기/장바구니/구독 여부를 채운다.
     */
    public RecipeDetailDto buildDetail(Recipe recipe, Long currentUserId) {
        if (currentUserId == null) {
            return RecipeMapper.toDetailDto(recipe, false, false, false);
        }
        Long recipeId = recipe.getId();
        Long authorId = recipe.getAuthor().getId();
        return RecipeMapper.toDetailDto(
                recipe,
                recipeFavoriteRepository.existsByUserIdAndRecipeId(currentUserId, recipeId),
                shoppingCartItemRepository.existsByUserIdAndRecipeId(currentUserId, recipeId),
                subscriptionRepository.existsByFollowerIdAndAuthorId(currentUserId, authorId)
        );
    }
}
