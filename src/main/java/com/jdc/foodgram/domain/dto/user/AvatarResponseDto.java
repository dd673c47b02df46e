package com.jdc.foodgram.domain.dto.user;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AvatarResponseDto {
    private String avatar;
}
