package com.jdc.foodgram.domain.dto.user;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@AllArgsConstructor
@NoArgsConstructor
public class AvatarRequestDto {

    @NotBlank(message = "아바타 이미지는 필수입니다.")
    private String avatar;
}
