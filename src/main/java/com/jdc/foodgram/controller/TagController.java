package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.tag.TagDto;
import com.jdc.foodgram.service.TagService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Tag(name = "태그 API")
public class TagController {

    private final TagService tagService;

    @GetMapping("/api/tags")
    @Operation(summary = "태그 전체 조회")
    public List<TagDto> getAllTags() {
        return tagService.getAllTags();
    }

    @GetMapping("/api/tags/{id}")
    @Operation(summary = "태그 단건 조회")
    public TagDto getTag(@PathVariable Long id) {
        return tagService.getTag(id);
    }
}
