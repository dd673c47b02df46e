package com.jdc.foodgram.domain.dto.user;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UserDto {
    private String email;
    private Long id;
    private String username;
    private String firstName;
    private String lastName;
    private Boolean isSubscribed;
    private String avatar;
}
