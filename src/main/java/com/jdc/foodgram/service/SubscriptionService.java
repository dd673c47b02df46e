package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.RecipeShortDto;
import com.jdc.foodgram.domain.dto.user.UserWithRecipesDto;
import com.jdc.foodgram.domain.entity.Subscription;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.SubscriptionRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.RecipeMapper;
import com.jdc.foodgram.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final UserRepository userRepository;
    private final RecipeRepository recipeRepository;

    @Transactional
    public UserWithRecipesDto subscribe(Long followerId, Long authorId, Integer recipesLimit) {
        validateRecipesLimit(recipesLimit);
        User author = userRepository.findById(authorId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        if (followerId.equals(authorId)) {
            throw new CustomException(ErrorCode.SELF_SUBSCRIPTION);
        }
        if (subscriptionRepository.existsByFollowerIdAndAuthorId(followerId, authorId)) {
            throw new CustomException(ErrorCode.ALREADY_SUBSCRIBED);
        }

        User follower = userRepository.findById(followerId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        try {
            subscriptionRepository.saveAndFlush(Subscription.builder().follower(follower).author(author).build());
        } catch (DataIntegrityViolationException e) {
            throw new CustomException(ErrorCode.ALREADY_SUBSCRIBED);
        }
        log.debug("구독 추가: {} -> {}", followerId, authorId);

        return toAuthorWithRecipes(author, recipesLimit, recipeRepository.countByAuthorId(authorId));
    }

    @Transactional
    public void unsubscribe(Long followerId, Long authorId) {
        if (!userRepository.existsById(authorId)) {
            throw new CustomException(ErrorCode.USER_NOT_FOUND);
        }
        if (followerId.equals(authorId)) {
            throw new CustomException(ErrorCode.SELF_SUBSCRIPTION);
        }

        Subscription subscription = subscriptionRepository.findByFollowerIdAndAuthorId(followerId, authorId)
                .orElseThrow(() -> new CustomException(ErrorCode.SUBSCRIPTION_NOT_FOUND));
        subscriptionRepository.delete(subscription);
    }

    @Transactional(readOnly = true)
    public Page<UserWithRecipesDto> getSubscriptions(Long followerId, Pageable pageable, Integer recipesLimit) {
        validateRecipesLimit(recipesLimit);

        Page<Subscription> page = subscriptionRepository.findWithAuthorByFollowerId(followerId, pageable);
        List<Long> authorIds = page.getContent().stream()
                .map(s -> s.getAuthor().getId())
                .toList();
        Map<Long, Long> recipeCounts = authorIds.isEmpty()
                ? Map.of()
                : recipeRepository.countByAuthorIdIn(authorIds);

        return page.map(s -> toAuthorWithRecipes(
                s.getAuthor(), recipesLimit, recipeCounts.getOrDefault(s.getAuthor().getId(), 0L)));
    }

    private UserWithRecipesDto toAuthorWithRecipes(User author, Integer recipesLimit, long recipesCount) {
        List<RecipeShortDto> recipes;
        if (recipesLimit != null && recipesLimit == 0) {
            recipes = List.of();
        } else {
            Pageable limit = recipesLimit == null ? Pageable.unpaged() : PageRequest.of(0, recipesLimit);
            recipes = recipeRepository.findByAuthorIdOrderByCreatedAtDescIdDesc(author.getId(), limit)
                    .map(RecipeMapper::toShortDto)
                    .getContent();
        }
        return UserMapper.toWithRecipesDto(author, recipes, recipesCount);
    }

    private void validateRecipesLimit(Integer recipesLimit) {
        if (recipesLimit != null && recipesLimit < 0) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "recipes_limit 은 0 이상이어야 합니다.", "recipes_limit");
        }
    }
}
