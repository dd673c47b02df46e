package com.jdc.foodgram.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ShortLinkDto {

    @JsonProperty("short-link")
    private String shortLink;
}
