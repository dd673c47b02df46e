package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.RecipeTag;
import com.jdc.foodgram.domain.entity.Tag;
import com.jdc.foodgram.domain.repository.RecipeTagRepository;
import com.jdc.foodgram.domain.repository.TagRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class RecipeTagService {

    private static final String FIELD = "tags";

    private final RecipeTagRepository recipeTagRepository;
    private final TagRepository tagRepository;

    /**
     * 요청한 태그 ID 를 검증하고 태그 엔티티를 요청 순서대로 돌려준다. 아무것도 저장하지 않는다.
     */
    @Transactional(readOnly = true)
    public List<Tag> resolveTags(List<Long> tagIds) {
        if (tagIds == null || tagIds.isEmpty()) {
            throw new CustomException(ErrorCode.EMPTY_TAGS, ErrorCode.EMPTY_TAGS.getMessage(), FIELD);
        }

        Set<Long> seen = new HashSet<>();
        for (Long tagId : tagIds) {
            if (tagId == null) {
                throw new CustomException(ErrorCode.TAG_NOT_FOUND_IN_REQUEST,
                        ErrorCode.TAG_NOT_FOUND_IN_REQUEST.getMessage(), FIELD);
            }
            if (!seen.add(tagId)) {
                throw new CustomException(ErrorCode.DUPLICATE_TAG, "태그가 중복되었습니다: " + tagId, FIELD);
            }
        }

        Map<Long, Tag> found = tagRepository.findAllById(tagIds).stream()
                .collect(Collectors.toMap(Tag::getId, Function.identity()));

        return tagIds.stream()
                .map(id -> {
                    Tag tag = found.get(id);
                    if (tag == null) {
                        throw new CustomException(ErrorCode.TAG_NOT_FOUND_IN_REQUEST,
                                "존재하지 않는 태그입니다: " + id, FIELD);
                    }
                    return tag;
                })
                .toList();
    }

    public List<RecipeTag> saveAll(Recipe recipe, List<Tag> tags) {
        List<RecipeTag> recipeTags = tags.stream()
                .map(tag -> RecipeTag.builder()
                        .recipe(recipe)
                        .tag(tag)
                        .build())
                .toList();

        List<RecipeTag> saved = recipeTagRepository.saveAll(recipeTags);
        recipe.replaceTags(saved);
        return saved;
    }

    /**
     * 기존 태그 연결을 모두 지우고 새 목록으로 교체한다.
     */
    public List<RecipeTag> replaceTags(Recipe recipe, List<Tag> tags) {
        recipeTagRepository.deleteByRecipeId(recipe.getId());
        return saveAll(recipe, tags);
    }

    @Transactional
    public void deleteAllByRecipeId(Long recipeId) {
        recipeTagRepository.deleteByRecipeId(recipeId);
    }
}
