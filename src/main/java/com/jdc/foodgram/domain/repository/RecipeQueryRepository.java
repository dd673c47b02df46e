package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.dto.recipe.RecipeSearchCondition;
import com.jdc.foodgram.domain.entity.Recipe;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface RecipeQueryRepository {

    /**
     * 태그(OR), 작성자, 즐겨찾기, 장바구니 조건을 AND 로 묶어 최신순으로 조회한다.
     * 즐겨찾기/장바구니 조건은 currentUserId 가 있을 때만 적용된다.
     */
    Page<Recipe> search(RecipeSearchCondition condition, Pageable pageable, Long currentUserId);
}
