package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.entity.Recipe;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public interface RecipeRepository extends JpaRepository<Recipe, Long>, RecipeQueryRepository {

    @Query("""
                SELECT r FROM Recipe r
                JOIN FETCH r.author
                WHERE r.id = :recipeId
            """)
    Optional<Recipe> findWithAuthorById(@Param("recipeId") Long recipeId);

    List<Recipe> findByAuthorId(Long authorId);

    Page<Recipe> findByAuthorIdOrderByCreatedAtDescIdDesc(Long authorId, Pageable pageable);

    @Query("SELECT r.author.id, COUNT(r) FROM Recipe r WHERE r.author.id IN :authorIds GROUP BY r.author.id")
    List<Object[]> countByAuthorIdInRaw(@Param("authorIds") Collection<Long> authorIds);

    default Map<Long, Long> countByAuthorIdIn(Collection<Long> authorIds) {
        return countByAuthorIdInRaw(authorIds).stream()
                .collect(Collectors.toMap(row -> (Long) row[0], row -> (Long) row[1]));
    }

    long countByAuthorId(Long authorId);
}
