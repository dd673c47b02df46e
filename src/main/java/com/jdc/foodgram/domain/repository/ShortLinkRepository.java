package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.entity.ShortLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ShortLinkRepository extends JpaRepository<ShortLink, Long> {

    Optional<ShortLink> findByRecipeId(Long recipeId);

    Optional<ShortLink> findByHash(String hash);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ShortLink s WHERE s.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);
}
