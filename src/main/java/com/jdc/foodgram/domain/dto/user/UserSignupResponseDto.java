package com.jdc.foodgram.domain.dto.user;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class UserSignupResponseDto {
    private String email;
    private Long id;
    private String username;
    private String firstName;
    private String lastName;
}
