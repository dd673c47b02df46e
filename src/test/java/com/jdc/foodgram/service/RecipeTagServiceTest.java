package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.RecipeTag;
import com.jdc.foodgram.domain.entity.Tag;
import com.jdc.foodgram.domain.repository.RecipeTagRepository;
import com.jdc.foodgram.domain.repository.TagRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeTagServiceTest {

    @Mock
    private RecipeTagRepository recipeTagRepository;
    @Mock
    private TagRepository tagRepository;

    @InjectMocks
    private RecipeTagService recipeTagService;

    private final Tag breakfast = Tag.builder().id(1L).name("Завтрак").slug("breakfast").color("#E26C2D").build();
    private final Tag dinner = Tag.builder().id(3L).name("Ужин").slug("dinner").color("#8775D2").build();

    @Test
    @DisplayName("resolveTags: 요청 순서대로 태그를 돌려준다")
    void resolveTags_success() {
        when(tagRepository.findAllById(List.of(3L, 1L))).thenReturn(List.of(breakfast, dinner));

        List<Tag> result = recipeTagService.resolveTags(List.of(3L, 1L));

        assertEquals(List.of(dinner, breakfast), result);
    }

    @Test
    @DisplayName("resolveTags: 빈 목록이면 EMPTY_TAGS 예외")
    void resolveTags_empty_throwsException() {
        CustomException ex = assertThrows(CustomException.class,
                () -> recipeTagService.resolveTags(List.of()));

        assertEquals(ErrorCode.EMPTY_TAGS, ex.getErrorCode());
        assertEquals("tags", ex.getField());
        verifyNoInteractions(tagRepository);
    }

    @Test
    @DisplayName("resolveTags: 같은 태그가 두 번 오면 DUPLICATE_TAG 예외")
    void resolveTags_duplicate_throwsException() {
        CustomException ex = assertThrows(CustomException.class,
                () -> recipeTagService.resolveTags(List.of(1L, 1L)));

        assertEquals(ErrorCode.DUPLICATE_TAG, ex.getErrorCode());
    }

    @Test
    @DisplayName("resolveTags: null ID 가 섞여 있으면 TAG_NOT_FOUND_IN_REQUEST 예외")
    void resolveTags_nullId_throwsException() {
        CustomException ex = assertThrows(CustomException.class,
                () -> recipeTagService.resolveTags(Arrays.asList(1L, null)));

        assertEquals(ErrorCode.TAG_NOT_FOUND_IN_REQUEST, ex.getErrorCode());
    }

    @Test
    @DisplayName("resolveTags: 존재하지 않는 태그면 TAG_NOT_FOUND_IN_REQUEST 예외")
    void resolveTags_unknown_throwsException() {
        when(tagRepository.findAllById(List.of(1L, 99L))).thenReturn(List.of(breakfast));

        CustomException ex = assertThrows(CustomException.class,
                () -> recipeTagService.resolveTags(List.of(1L, 99L)));

        assertEquals(ErrorCode.TAG_NOT_FOUND_IN_REQUEST, ex.getErrorCode());
        assertTrue(ex.getMessage().contains("99"));
    }

    @Test
    @DisplayName("replaceTags: 기존 연결을 지운 뒤 새로 저장하고 레시피 컬렉션을 맞춘다")
    void replaceTags_deletesThenSaves() {
        Recipe recipe = Recipe.builder().id(10L).build();
        when(recipeTagRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        List<RecipeTag> saved = recipeTagService.replaceTags(recipe, List.of(breakfast, dinner));

        InOrder inOrder = inOrder(recipeTagRepository);
        inOrder.verify(recipeTagRepository).deleteByRecipeId(10L);
        inOrder.verify(recipeTagRepository).saveAll(anyList());
        assertEquals(2, saved.size());
        assertEquals(2, recipe.getTags().size());
    }
}
