package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.RecipeDetailDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeSearchCondition;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.RecipeFavoriteRepository;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.ShoppingCartItemRepository;
import com.jdc.foodgram.domain.repository.SubscriptionRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeSearchServiceTest {

    @Mock
    private RecipeRepository recipeRepository;
    @Mock
    private RecipeFavoriteRepository recipeFavoriteRepository;
    @Mock
    private ShoppingCartItemRepository shoppingCartItemRepository;
    @Mock
    private SubscriptionRepository subscriptionRepository;

    @InjectMocks
    private RecipeSearchService recipeSearchService;

    private final Pageable pageable = PageRequest.of(0, 6);
    private final User author = User.builder().id(2L).username("chef").build();

    @Test
    @DisplayName("search: 비로그인 사용자가 is_favorited=true 를 보내면 UNAUTHORIZED")
    void search_anonymousFavoritedFilter_unauthorized() {
        RecipeSearchCondition condition = new RecipeSearchCondition(null, null, true, null);

        CustomException ex = assertThrows(CustomException.class,
                () -> recipeSearchService.search(condition, pageable, null));

        assertEquals(ErrorCode.UNAUTHORIZED, ex.getErrorCode());
        verifyNoInteractions(recipeRepository);
    }

    @Test
    @DisplayName("search: 비로그인 사용자가 is_in_shopping_cart=true 를 보내면 UNAUTHORIZED")
    void search_anonymousCartFilter_unauthorized() {
        RecipeSearchCondition condition = new RecipeSearchCondition(null, null, null, true);

        CustomException ex = assertThrows(CustomException.class,
                () -> recipeSearchService.search(condition, pageable, null));

        assertEquals(ErrorCode.UNAUTHORIZED, ex.getErrorCode());
    }

    @Test
    @DisplayName("search: 비로그인 사용자가 false 필터를 보내면 필터 없이 조회하고 플래그는 모두 false")
    void search_anonymousFalseFilter_ignored() {
        RecipeSearchCondition condition = new RecipeSearchCondition(null, null, false, false);
        Recipe recipe = Recipe.builder().id(10L).author(author).name("Суп").build();
        when(recipeRepository.search(condition, pageable, null))
                .thenReturn(new PageImpl<>(List.of(recipe), pageable, 1));

        Page<RecipeDetailDto> result = recipeSearchService.search(condition, pageable, null);

        RecipeDetailDto dto = result.getContent().get(0);
        assertFalse(dto.getIsFavorited());
        assertFalse(dto.getIsInShoppingCart());
        assertFalse(dto.getAuthor().getIsSubscribed());
        verifyNoInteractions(recipeFavoriteRepository, shoppingCartItemRepository, subscriptionRepository);
    }

    @Test
    @DisplayName("search: 로그인 사용자는 페이지 단위로 즐겨찾기/장바구니/구독 여부를 채운다")
    void search_authenticated_fillsFlags() {
        RecipeSearchCondition condition = new RecipeSearchCondition();
        Recipe first = Recipe.builder().id(10L).author(author).build();
        Recipe second = Recipe.builder().id(11L).author(author).build();
        when(recipeRepository.search(condition, pageable, 1L))
                .thenReturn(new PageImpl<>(List.of(first, second), pageable, 2));
        when(recipeFavoriteRepository.findRecipeIdsByUserIdAndRecipeIdIn(1L, List.of(10L, 11L)))
                .thenReturn(Set.of(10L));
        when(shoppingCartItemRepository.findRecipeIdsByUserIdAndRecipeIdIn(1L, List.of(10L, 11L)))
                .thenReturn(Set.of(11L));
        when(subscriptionRepository.findAuthorIdsByFollowerIdAndAuthorIdIn(1L, List.of(2L)))
                .thenReturn(Set.of(2L));

        List<RecipeDetailDto> result = recipeSearchService.search(condition, pageable, 1L).getContent();

        assertTrue(result.get(0).getIsFavorited());
        assertFalse(result.get(0).getIsInShoppingCart());
        assertFalse(result.get(1).getIsFavorited());
        assertTrue(result.get(1).getIsInShoppingCart());
        assertTrue(result.get(0).getAuthor().getIsSubscribed());
    }

    @Test
    @DisplayName("getRecipeDetail: 존재하지 않는 레시피면 RECIPE_NOT_FOUND")
    void getRecipeDetail_notFound() {
        when(recipeRepository.findWithAuthorById(99L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class,
                () -> recipeSearchService.getRecipeDetail(99L, null));

        assertEquals(ErrorCode.RECIPE_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    @DisplayName("getRecipeDetail: 로그인 사용자 기준 플래그를 채운다")
    void getRecipeDetail_authenticated() {
        Recipe recipe = Recipe.builder().id(10L).author(author).name("Суп").build();
        when(recipeRepository.findWithAuthorById(10L)).thenReturn(Optional.of(recipe));
        when(recipeFavoriteRepository.existsByUserIdAndRecipeId(1L, 10L)).thenReturn(true);
        when(shoppingCartItemRepository.existsByUserIdAndRecipeId(1L, 10L)).thenReturn(false);
        when(subscriptionRepository.existsByFollowerIdAndAuthorId(1L, 2L)).thenReturn(true);

        RecipeDetailDto dto = recipeSearchService.getRecipeDetail(10L, 1L);

        assertEquals("Суп", dto.getName());
        assertTrue(dto.getIsFavorited());
        assertFalse(dto.getIsInShoppingCart());
        assertTrue(dto.getAuthor().getIsSubscribed());
    }
}
