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
import com.jdc.foodgram.service.image.Base64ImageDecoder;
import com.jdc.foodgram.service.image.Base64ImageDecoder.DecodedImage;
import com.jdc.foodgram.service.image.ImageStorage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock private UserRepository userRepository;
    @Mock private SubscriptionRepository subscriptionRepository;
    @Mock private RecipeRepository recipeRepository;
    @Mock private RecipeFavoriteRepository recipeFavoriteRepository;
    @Mock private ShoppingCartItemRepository shoppingCartItemRepository;
    @Mock private AuthTokenRepository authTokenRepository;
    @Mock private RecipeService recipeService;
    @Mock private PasswordEncoder passwordEncoder;
    @Mock private Base64ImageDecoder imageDecoder;
    @Mock private ImageStorage imageStorage;

    @InjectMocks
    private UserService userService;

    private UserSignupRequestDto signupDto() {
        return UserSignupRequestDto.builder()
                .email("cook@example.com")
                .username("cook")
                .firstName("Иван")
                .lastName("Иванов")
                .password("S3cure!pass")
                .build();
    }

    @Test
    @DisplayName("signup: 비밀번호를 인코딩해 저장하고 비밀번호 없이 응답한다")
    void signup_success() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(false);
        when(userRepository.existsByUsername("cook")).thenReturn(false);
        when(passwordEncoder.encode("S3cure!pass")).thenReturn("encoded");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserSignupResponseDto result = userService.signup(signupDto());

        assertEquals("cook", result.getUsername());
        assertEquals("Иван", result.getFirstName());
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertEquals("encoded", captor.getValue().getPassword());
    }

    @Test
    @DisplayName("signup: 이메일이 중복이면 DUPLICATE_EMAIL")
    void signup_duplicateEmail() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> userService.signup(signupDto()));

        assertEquals(ErrorCode.DUPLICATE_EMAIL, ex.getErrorCode());
        assertEquals("email", ex.getField());
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("signup: 사용자 이름이 중복이면 DUPLICATE_USERNAME")
    void signup_duplicateUsername() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(false);
        when(userRepository.existsByUsername("cook")).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> userService.signup(signupDto()));

        assertEquals(ErrorCode.DUPLICATE_USERNAME, ex.getErrorCode());
    }

    @Test
    @DisplayName("getUser: 로그인 사용자가 구독 중이면 is_subscribed=true")
    void getUser_subscribedFlag() {
        User author = User.builder().id(2L).username("chef").build();
        when(userRepository.findById(2L)).thenReturn(Optional.of(author));
        when(subscriptionRepository.existsByFollowerIdAndAuthorId(1L, 2L)).thenReturn(true);

        UserDto dto = userService.getUser(2L, 1L);

        assertTrue(dto.getIsSubscribed());
    }

    @Test
    @DisplayName("getUser: 비로그인 사용자는 구독 여부를 조회하지 않는다")
    void getUser_anonymous() {
        User author = User.builder().id(2L).username("chef").build();
        when(userRepository.findById(2L)).thenReturn(Optional.of(author));

        UserDto dto = userService.getUser(2L, null);

        assertFalse(dto.getIsSubscribed());
        verifyNoInteractions(subscriptionRepository);
    }

    @Test
    @DisplayName("changePassword: 현재 비밀번호가 틀리면 INVALID_CURRENT_PASSWORD")
    void changePassword_wrongCurrent() {
        User user = User.builder().id(1L).password("encoded").build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "encoded")).thenReturn(false);

        CustomException ex = assertThrows(CustomException.class,
                () -> userService.changePassword(1L, new PasswordChangeRequestDto("wrong", "newPass123")));

        assertEquals(ErrorCode.INVALID_CURRENT_PASSWORD, ex.getErrorCode());
        assertEquals("encoded", user.getPassword());
    }

    @Test
    @DisplayName("changePassword: 현재 비밀번호가 맞으면 새 비밀번호를 인코딩해 저장")
    void changePassword_success() {
        User user = User.builder().id(1L).password("encoded").build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("current", "encoded")).thenReturn(true);
        when(passwordEncoder.encode("newPass123")).thenReturn("encoded-new");

        userService.changePassword(1L, new PasswordChangeRequestDto("current", "newPass123"));

        assertEquals("encoded-new", user.getPassword());
    }

    @Test
    @DisplayName("updateAvatar: 새 이미지를 저장하고 이전 파일을 지운다")
    void updateAvatar_replacesPrevious() {
        byte[] bytes = {1};
        User user = User.builder().id(1L).avatar("/media/users/old.png").build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(imageDecoder.decode("data:image/png;base64,AQ==", "avatar")).thenReturn(new DecodedImage(bytes, "png"));
        when(imageStorage.store(bytes, "png", "users")).thenReturn("/media/users/new.png");

        AvatarResponseDto result = userService.updateAvatar(1L, "data:image/png;base64,AQ==");

        assertEquals("/media/users/new.png", result.getAvatar());
        verify(imageStorage).delete("/media/users/old.png");
    }

    @Test
    @DisplayName("deleteUser: 작성한 레시피와 모든 관계를 지운 뒤 사용자를 삭제한다")
    void deleteUser_cascades() {
        User user = User.builder().id(1L).build();
        Recipe recipe = Recipe.builder().id(10L).author(user).build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(recipeRepository.findByAuthorId(1L)).thenReturn(List.of(recipe));

        userService.deleteUser(1L);

        verify(recipeService).deleteRecipeWithRelations(recipe);
        verify(recipeFavoriteRepository).deleteByUserId(1L);
        verify(shoppingCartItemRepository).deleteByUserId(1L);
        verify(subscriptionRepository).deleteAllInvolvingUser(1L);
        verify(authTokenRepository).deleteByUserId(1L);
        verify(userRepository).delete(user);
        verifyNoInteractions(imageStorage);
    }
}
