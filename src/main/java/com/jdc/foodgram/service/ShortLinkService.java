package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.ShortLinkDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.ShortLink;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.ShortLinkRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

@Slf4j
@Service
@RequiredArgsConstructor
public class ShortLinkService {

    static final int HASH_LENGTH = 6;
    static final String PATH_PREFIX = "/s/";

    private final ShortLinkRepository shortLinkRepository;
    private final RecipeRepository recipeRepository;

    @Value("${app.short-link.base-url}")
    private String baseUrl;

    /**
     * 레시피의 단축 링크를 돌려준다. 처음 요청될 때 만들어진다.
     */
    @Transactional
    public ShortLinkDto getOrCreateShortLink(Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        ShortLink shortLink = shortLinkRepository.findByRecipeId(recipeId)
                .orElseGet(() -> create(recipe));

        return new ShortLinkDto(trimTrailingSlash(baseUrl) + PATH_PREFIX + shortLink.getHash());
    }

    @Transactional(readOnly = true)
    public Long resolveRecipeId(String hash) {
        return shortLinkRepository.findByHash(hash)
                .map(link -> link.getRecipe().getId())
                .orElseThrow(() -> new CustomException(ErrorCode.SHORT_LINK_NOT_FOUND));
    }

    @Transactional
    public void deleteByRecipeId(Long recipeId) {
        shortLinkRepository.deleteByRecipeId(recipeId);
    }

    /**
     * 레시피 ID 문자열의 SHA-256 을 URL-safe Base64 로 인코딩한 앞 6글자. 같은 ID 는 항상 같은 해시.
     */
    public static String generateHash(Long recipeId) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(String.valueOf(recipeId).getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().encodeToString(digest).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 알고리즘을 사용할 수 없습니다.", e);
        }
    }

    private ShortLink create(Recipe recipe) {
        String hash = generateHash(recipe.getId());
        try {
            ShortLink saved = shortLinkRepository.saveAndFlush(
                    ShortLink.builder().recipe(recipe).hash(hash).build());
            log.debug("단축 링크 생성: recipe={}, hash={}", recipe.getId(), hash);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // 해시 충돌 또는 동시 생성
            log.warn("단축 링크 생성 실패: recipe={}, hash={}", recipe.getId(), hash);
            throw new CustomException(ErrorCode.DATA_INTEGRITY_VIOLATION, "단축 링크를 생성하지 못했습니다.");
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
