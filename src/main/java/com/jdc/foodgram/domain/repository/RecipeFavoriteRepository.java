package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.entity.RecipeFavorite;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

@Repository
public interface RecipeFavoriteRepository extends JpaRepository<RecipeFavorite, Long> {

    Optional<RecipeFavorite> findByUserIdAndRecipeId(Long userId, Long recipeId);

    boolean existsByUserIdAndRecipeId(Long userId, Long recipeId);

    @Query("SELECT f.recipe.id FROM RecipeFavorite f WHERE f.user.id = :userId AND f.recipe.id IN :recipeIds")
    Set<Long> findRecipeIdsByUserIdAndRecipeIdIn(@Param("userId") Long userId,
                                                 @Param("recipeIds") Collection<Long> recipeIds);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM RecipeFavorite f WHERE f.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM RecipeFavorite f WHERE f.user.id = :userId")
    void deleteByUserId(@Param("userId") Long userId);
}
