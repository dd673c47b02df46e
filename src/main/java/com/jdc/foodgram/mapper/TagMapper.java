package com.jdc.foodgram.mapper;

import com.jdc.foodgram.domain.dto.tag.TagDto;
import com.jdc.foodgram.domain.entity.Tag;

public class TagMapper {

    public static TagDto toDto(Tag tag) {
        return TagDto.builder()
                .id(tag.getId())
                .name(tag.getName())
                .slug(tag.getSlug())
                .color(tag.getColor())
                .build();
    }
}
