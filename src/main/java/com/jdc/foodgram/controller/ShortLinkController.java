package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.recipe.ShortLinkDto;
import com.jdc.foodgram.service.ShortLinkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
@RequiredArgsConstructor
@Tag(name = "단축 링크 API", description = "레시피 공유용 단축 링크를 만들고, 단축 링크를 레시피 페이지로 연결합니다.")
public class ShortLinkController {

    private final ShortLinkService shortLinkService;

    @GetMapping("/api/recipes/{id}/get-link")
    @Operation(summary = "단축 링크 조회", description = "처음 요청 시 생성됩니다. 응답 키는 short-link 입니다.")
    public ResponseEntity<ShortLinkDto> getShortLink(@Parameter(description = "레시피 ID") @PathVariable Long id) {
        return ResponseEntity.ok(shortLinkService.getOrCreateShortLink(id));
    }

    @GetMapping("/s/{hash}")
    @Operation(summary = "단축 링크 이동", description = "레시피 페이지(/recipes/{id}/)로 302 리다이렉트합니다.")
    public ResponseEntity<Void> redirect(@PathVariable String hash) {
        Long recipeId = shortLinkService.resolveRecipeId(hash);
        HttpHeaders headers = new HttpHeaders();
        headers.setLocation(URI.create("/recipes/" + recipeId + "/"));
        return new ResponseEntity<>(headers, HttpStatus.FOUND);
    }
}
