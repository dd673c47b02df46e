package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.entity.ShoppingCartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

@Repository
public interface ShoppingCartItemRepository extends JpaRepository<ShoppingCartItem, Long> {

    Optional<ShoppingCartItem> findByUserIdAndRecipeId(Long userId, Long recipeId);

    boolean existsByUserIdAndRecipeId(Long userId, Long recipeId);

    @Query("SELECT c.recipe.id FROM ShoppingCartItem c WHERE c.user.id = :userId AND c.recipe.id IN :recipeIds")
    Set<Long> findRecipeIdsByUserIdAndRecipeIdIn(@Param("userId") Long userId,
                                                 @Param("recipeIds") Collection<Long> recipeIds);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ShoppingCartItem c WHERE c.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ShoppingCartItem c WHERE c.user.id = :userId")
    void deleteByUserId(@Param("userId") Long userId);
}
