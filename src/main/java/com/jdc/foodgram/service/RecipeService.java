package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeDetailDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeUpdateRequestDto;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.Tag;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.RecipeMapper;
import com.jdc.foodgram.service.image.Base64ImageDecoder;
import com.jdc.foodgram.service.image.Base64ImageDecoder.DecodedImage;
import com.jdc.foodgram.service.image.ImageStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeService {

    public static final int MIN_COOKING_TIME = 1;
    public static final int MAX_COOKING_TIME = 32000;
    static final String IMAGE_DIRECTORY = "recipes";

    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;

    private final RecipeIngredientService recipeIngredientService;
    private final RecipeTagService recipeTagService;
    private final RecipeFavoriteService recipeFavoriteService;
    private final ShoppingCartService shoppingCartService;
    private final ShortLinkService shortLinkService;
    private final RecipeSearchService recipeSearchService;

    private final Base64ImageDecoder imageDecoder;
    private final ImageStorage imageStorage;

    /**
     * 모든 검증을 마친 뒤에 이미지를 저장하고 레시피/태그/재료를 저장한다.
     */
    @Transactional
    public RecipeDetailDto createRecipe(RecipeCreateRequestDto dto, Long userId) {
        User author = getUserOrThrow(userId);

        validateCookingTime(dto.getCookingTime());
        List<Tag> tags = recipeTagService.resolveTags(dto.getTags());
        Map<Long, Ingredient> ingredients = recipeIngredientService.validate(dto.getIngredients());
        if (dto.getImage() == null || dto.getImage().isBlank()) {
            throw new CustomException(ErrorCode.IMAGE_REQUIRED, ErrorCode.IMAGE_REQUIRED.getMessage(), "image");
        }
        DecodedImage image = imageDecoder.decode(dto.getImage(), "image");

        String imageUrl = storeImage(image);
        Recipe recipe = recipeRepository.save(RecipeMapper.toEntity(dto, author, imageUrl));

        recipeTagService.saveAll(recipe, tags);
        recipeIngredientService.saveAll(recipe, dto.getIngredients(), ingredients);

        log.info("레시피 생성: id={}, author={}", recipe.getId(), userId);
        return RecipeMapper.toDetailDto(recipe, false, false, false);
    }

    /**
     * 작성자만 수정할 수 있다. 태그와 재료는 요청 내용으로 전부 교체되고, 이미지는 보냈을 때만 바뀐다.
     */
    @Transactional
    public RecipeDetailDto updateRecipe(Long recipeId, RecipeUpdateRequestDto dto, Long userId) {
        Recipe recipe = getRecipeOrThrow(recipeId);
        validateOwnership(recipe, userId);

        validateCookingTime(dto.getCookingTime());
        List<Tag> tags = recipeTagService.resolveTags(dto.getTags());
        Map<Long, Ingredient> ingredients = recipeIngredientService.validate(dto.getIngredients());
        DecodedImage image = (dto.getImage() == null || dto.getImage().isBlank())
                ? null
                : imageDecoder.decode(dto.getImage(), "image");

        recipe.update(dto.getName(), dto.getText(), dto.getCookingTime());
        if (image != null) {
            String previousImage = recipe.getImage();
            recipe.updateImage(storeImage(image));
            deleteImageAfterCommit(previousImage);
        }

        recipeTagService.replaceTags(recipe, tags);
        recipeIngredientService.replaceIngredients(recipe, dto.getIngredients(), ingredients);

        return recipeSearchService.buildDetail(recipe, userId);
    }

    @Transactional
    public Long deleteRecipe(Long recipeId, Long userId) {
        Recipe recipe = getRecipeOrThrow(recipeId);
        validateOwnership(recipe, userId);

        deleteRecipeWithRelations(recipe);
        log.info("레시피 삭제: id={}, by={}", recipeId, userId);
        return recipeId;
    }

    /**
     * 즐겨찾기, 장바구니, 태그, 재료, 단축 링크를 지운 뒤 레시피를 지운다. 이미지 파일은 커밋 후 삭제.
     */
    @Transactional
    public void deleteRecipeWithRelations(Recipe recipe) {
        Long recipeId = recipe.getId();

        recipeFavoriteService.deleteByRecipeId(recipeId);
        shoppingCartService.deleteByRecipeId(recipeId);
        recipeTagService.deleteAllByRecipeId(recipeId);
        recipeIngredientService.deleteAllByRecipeId(recipeId);
        shortLinkService.deleteByRecipeId(recipeId);

        recipeRepository.delete(recipe);
        deleteImageAfterCommit(recipe.getImage());
    }

    private String storeImage(DecodedImage image) {
        String url = imageStorage.store(image.content(), image.extension(), IMAGE_DIRECTORY);

        // 롤백되면 방금 저장한 파일은 고아가 되므로 지운다
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status == STATUS_ROLLED_BACK) {
                        imageStorage.delete(url);
                    }
                }
            });
        }
        return url;
    }

    private void deleteImageAfterCommit(String url) {
        if (url == null) {
            return;
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            imageStorage.delete(url);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                imageStorage.delete(url);
            }
        });
    }

    private void validateCookingTime(Integer cookingTime) {
        if (cookingTime == null || cookingTime < MIN_COOKING_TIME || cookingTime > MAX_COOKING_TIME) {
            throw new CustomException(ErrorCode.INVALID_COOKING_TIME,
                    ErrorCode.INVALID_COOKING_TIME.getMessage(), "cooking_time");
        }
    }

    private Recipe getRecipeOrThrow(Long recipeId) {
        return recipeRepository.findWithAuthorById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
    }

    private User getUserOrThrow(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
    }

    private void validateOwnership(Recipe recipe, Long userId) {
        if (!recipe.isAuthor(userId)) {
            throw new CustomException(ErrorCode.RECIPE_ACCESS_DENIED);
        }
    }
}
