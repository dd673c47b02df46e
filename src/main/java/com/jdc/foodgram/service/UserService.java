package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.user.AvatarResponseDto;
import com.jdc.foodgram.domain.dto.user.PasswordChangeRequestDto;
import com.jdc.foodgram.domain.dto.user.UserDto;
import com.jdc.foodgram.domain.dto.user.UserSignupRequestDto;
import com.jdc.foodgram.domain.dto.user.UserSignupResponseDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.AuthTokenRepository;
import com.jdc.foodgram.domain.repository.RecipeFavoriteRepository;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.ShoppingCartItemRepository;
import com.jdc.foodgram.domain.repository.SubscriptionRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.UserMapper;
import com.jdc.foodgram.service.image.Base64ImageDecoder;
import com.jdc.foodgram.service.image.Base64ImageDecoder.DecodedImage;
import com.jdc.foodgram.service.image.ImageStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Set;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class UserService {

    static final String AVATAR_DIRECTORY = "users";

    private final UserRepository userRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final RecipeRepository recipeRepository;
    private final RecipeFavoriteRepository recipeFavoriteRepository;
    private final ShoppingCartItemRepository shoppingCartItemRepository;
    private final AuthTokenRepository authTokenRepository;
    private final RecipeService recipeService;
    private final PasswordEncoder passwordEncoder;
    private final Base64ImageDecoder imageDecoder;
    private final ImageStorage imageStorage;

    public UserSignupResponseDto signup(UserSignupRequestDto dto) {
        if (userRepository.existsByEmail(dto.getEmail())) {
            throw new CustomException(ErrorCode.DUPLICATE_EMAIL, ErrorCode.DUPLICATE_EMAIL.getMessage(), "email");
        }
        if (userRepository.existsByUsername(dto.getUsername())) {
            throw new CustomException(ErrorCode.DUPLICATE_USERNAME, ErrorCode.DUPLICATE_USERNAME.getMessage(), "username");
        }

        User user = userRepository.save(UserMapper.toEntity(dto, passwordEncoder.encode(dto.getPassword())));
        log.info("회원 가입: id={}", user.getId());
        return UserMapper.toSignupResponse(user);
    }

    @Transactional(readOnly = true)
    public UserDto getMe(Long userId) {
        return UserMapper.toDto(getUserOrThrow(userId), false);
    }

    @Transactional(readOnly = true)
    public UserDto getUser(Long id, Long currentUserId) {
        User user = getUserOrThrow(id);
        boolean subscribed = currentUserId != null
                && subscriptionRepository.existsByFollowerIdAndAuthorId(currentUserId, id);
        return UserMapper.toDto(user, subscribed);
    }

    @Transactional(readOnly = true)
    public Page<UserDto> getUsers(Pageable pageable, Long currentUserId) {
        Pageable byId = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), Sort.by("id"));
        Page<User> page = userRepository.findAll(byId);
        if (currentUserId == null || page.isEmpty()) {
            return page.map(user -> UserMapper.toDto(user, false));
        }

        List<Long> ids = page.getContent().stream().map(User::getId).toList();
        Set<Long> subscribedIds = subscriptionRepository.findAuthorIdsByFollowerIdAndAuthorIdIn(currentUserId, ids);
        return page.map(user -> UserMapper.toDto(user, subscribedIds.contains(user.getId())));
    }

    public AvatarResponseDto updateAvatar(Long userId, String avatarDataUri) {
        User user = getUserOrThrow(userId);
        DecodedImage image = imageDecoder.decode(avatarDataUri, "avatar");

        String previous = user.getAvatar();
        user.updateAvatar(imageStorage.store(image.content(), image.extension(), AVATAR_DIRECTORY));
        deleteImageAfterCommit(previous);
        return new AvatarResponseDto(user.getAvatar());
    }

    public void deleteAvatar(Long userId) {
        User user = getUserOrThrow(userId);
        if (user.getAvatar() != null) {
            deleteImageAfterCommit(user.getAvatar());
            user.updateAvatar(null);
        }
    }

    public void changePassword(Long userId, PasswordChangeRequestDto dto) {
        User user = getUserOrThrow(userId);
        if (!passwordEncoder.matches(dto.getCurrentPassword(), user.getPassword())) {
            throw new CustomException(ErrorCode.INVALID_CURRENT_PASSWORD,
                    ErrorCode.INVALID_CURRENT_PASSWORD.getMessage(), "current_password");
        }
        user.changePassword(passwordEncoder.encode(dto.getNewPassword()));
    }

    /**
     * 관리자 전용. 작성한 레시피와 모든 관계(구독, 즐겨찾기, 장바구니, 토큰)를 함께 삭제한다.
     */
    public void deleteUser(Long userId) {
        User user = getUserOrThrow(userId);

        List<Recipe> recipes = recipeRepository.findByAuthorId(userId);
        recipes.forEach(recipeService::deleteRecipeWithRelations);

        recipeFavoriteRepository.deleteByUserId(userId);
        shoppingCartItemRepository.deleteByUserId(userId);
        subscriptionRepository.deleteAllInvolvingUser(userId);
        authTokenRepository.deleteByUserId(userId);

        if (user.getAvatar() != null) {
            imageStorage.delete(user.getAvatar());
        }
        userRepository.delete(user);
        log.info("사용자 삭제: id={}, 레시피 {}건 포함", userId, recipes.size());
    }

    private User getUserOrThrow(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
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
}
