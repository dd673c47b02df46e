package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto;
import com.jdc.foodgram.domain.entity.RecipeIngredient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface RecipeIngredientRepository extends JpaRepository<RecipeIngredient, Long> {

    List<RecipeIngredient> findByRecipeId(Long recipeId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM RecipeIngredient ri WHERE ri.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);

    /**
     * 장바구니에 담긴 모든 레시피의 재료를 재료 단위로 묶어 수량을 합산한다.
     * 한 번의 쿼리로 실행되므로 집계 도중 장바구니가 바뀌어도 부분 합계가 섞이지 않는다.
     */
    @Query("""
            SELECT new com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto(
                i.name, i.measurementUnit, SUM(ri.amount)
            )
            FROM RecipeIngredient ri
            JOIN ri.ingredient i
            WHERE ri.recipe.id IN (
                SELECT c.recipe.id FROM ShoppingCartItem c WHERE c.user.id = :userId
            )
            GROUP BY i.id, i.name, i.measurementUnit
            ORDER BY i.name ASC, i.measurementUnit ASC
            """)
    List<ShoppingListItemDto> sumIngredientsInShoppingCart(@Param("userId") Long userId);
}
