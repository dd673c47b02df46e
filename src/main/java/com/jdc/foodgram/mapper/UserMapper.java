package com.jdc.foodgram.mapper;

import com.jdc.foodgram.domain.dto.recipe.RecipeShortDto;
import com.jdc.foodgram.domain.dto.user.UserDto;
import com.jdc.foodgram.domain.dto.user.UserSignupRequestDto;
import com.jdc.foodgram.domain.dto.user.UserSignupResponseDto;
import com.jdc.foodgram.domain.dto.user.UserWithRecipesDto;
import com.jdc.foodgram.domain.entity.User;

import java.util.List;

public class UserMapper {

    public static UserDto toDto(User user, boolean subscribed) {
        if (user == null) return null;
        return UserDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .isSubscribed(subscribed)
                .avatar(user.getAvatar())
                .build();
    }

    // 구독 목록용: 작성자 + 레시피 일부 + 전체 레시피 수
    public static UserWithRecipesDto toWithRecipesDto(User user, List<RecipeShortDto> recipes, long recipesCount) {
        if (user == null) return null;
        return UserWithRecipesDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .isSubscribed(true)
                .avatar(user.getAvatar())
                .recipes(recipes)
                .recipesCount(recipesCount)
                .build();
    }

    // 비밀번호는 인코딩된 값을 받는다
    public static User toEntity(UserSignupRequestDto dto, String encodedPassword) {
        if (dto == null) return null;
        return User.builder()
                .email(dto.getEmail())
                .username(dto.getUsername())
                .firstName(dto.getFirstName())
                .lastName(dto.getLastName())
                .password(encodedPassword)
                .build();
    }

    public static UserSignupResponseDto toSignupResponse(User user) {
        return UserSignupResponseDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .build();
    }
}
