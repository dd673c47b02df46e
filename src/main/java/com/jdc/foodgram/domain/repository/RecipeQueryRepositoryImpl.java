package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.dto.recipe.RecipeSearchCondition;
import com.jdc.foodgram.domain.entity.QRecipe;
import com.jdc.foodgram.domain.entity.QRecipeFavorite;
import com.jdc.foodgram.domain.entity.QRecipeTag;
import com.jdc.foodgram.domain.entity.QShoppingCartItem;
import com.jdc.foodgram.domain.entity.Recipe;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.JPAExpressions;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.util.CollectionUtils;

import java.util.List;

@RequiredArgsConstructor
public class RecipeQueryRepositoryImpl implements RecipeQueryRepository {

    private final JPAQueryFactory queryFactory;

    private static final QRecipe recipe = QRecipe.recipe;

    @Override
    public Page<Recipe> search(RecipeSearchCondition cond, Pageable pageable, Long currentUserId) {
        BooleanExpression[] conditions = {
                authorEq(cond.getAuthor()),
                tagSlugIn(cond.getTags()),
                favoritedBy(cond.favoritedOnly() ? currentUserId : null),
                inShoppingCartOf(cond.inShoppingCartOnly() ? currentUserId : null)
        };

        List<Recipe> content = queryFactory
                .selectFrom(recipe)
                .join(recipe.author).fetchJoin()
                .where(conditions)
                .orderBy(recipe.createdAt.desc(), recipe.id.desc())
                .offset(pageable.getOffset())
                .limit(pageable.getPageSize())
                .fetch();

        Long total = queryFactory
                .select(recipe.count())
                .from(recipe)
                .where(conditions)
                .fetchOne();

        return new PageImpl<>(content, pageable, total != null ? total : 0);
    }

    private BooleanExpression authorEq(Long authorId) {
        return authorId == null ? null : recipe.author.id.eq(authorId);
    }

    private BooleanExpression tagSlugIn(List<String> slugs) {
        if (CollectionUtils.isEmpty(slugs)) {
            return null;
        }
        QRecipeTag recipeTag = QRecipeTag.recipeTag;
        return recipe.id.in(
                JPAExpressions.select(recipeTag.recipe.id)
                        .from(recipeTag)
                        .where(recipeTag.tag.slug.in(slugs))
        );
    }

    private BooleanExpression favoritedBy(Long userId) {
        if (userId == null) {
            return null;
        }
        QRecipeFavorite favorite = QRecipeFavorite.recipeFavorite;
        return recipe.id.in(
                JPAExpressions.select(favorite.recipe.id)
                        .from(favorite)
                        .where(favorite.user.id.eq(userId))
        );
    }

    private BooleanExpression inShoppingCartOf(Long userId) {
        if (userId == null) {
            return null;
        }
        QShoppingCartItem cartItem = QShoppingCartItem.shoppingCartItem;
        return recipe.id.in(
                JPAExpressions.select(cartItem.recipe.id)
                        .from(cartItem)
                        .where(cartItem.user.id.eq(userId))
        );
    }
}
