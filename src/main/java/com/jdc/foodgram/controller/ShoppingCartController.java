package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.recipe.RecipeShortDto;
import com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.security.CustomUserDetails;
import com.jdc.foodgram.service.ShoppingCartService;
import com.jdc.foodgram.service.ShoppingListService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@Tag(name = "장바구니 API", description = "레시피를 장바구니에 담고, 담긴 레시피의 재료 목록을 합산해 내려받습니다.")
public class ShoppingCartController {

    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final ShoppingCartService shoppingCartService;
    private final ShoppingListService shoppingListService;

    @PostMapping("/{id}/shopping_cart")
    @Operation(summary = "장바구니에 담기", description = "이미 담긴 레시피면 400을 반환합니다.")
    public ResponseEntity<RecipeShortDto> addToCart(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(shoppingCartService.addToCart(userDetails.getUserId(), id));
    }

    @DeleteMapping("/{id}/shopping_cart")
    @Operation(summary = "장바구니에서 빼기", description = "장바구니에 없는 레시피면 400을 반환합니다.")
    public ResponseEntity<Void> removeFromCart(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        shoppingCartService.removeFromCart(userDetails.getUserId(), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/shopping_cart")
    @Operation(summary = "재료 목록 조회", description = "장바구니 레시피의 재료를 재료별로 합산해 JSON 으로 돌려줍니다.")
    public ResponseEntity<List<ShoppingListItemDto>> getShoppingList(
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.ok(shoppingListService.aggregate(userDetails.getUserId()));
    }

    @GetMapping("/download_shopping_cart")
    @Operation(summary = "재료 목록 다운로드", description = "\"이름 (단위) — 합계\" 형식의 줄로 된 shopping_list.txt 를 내려받습니다.")
    public ResponseEntity<byte[]> downloadShoppingList(
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        String body = shoppingListService.renderText(userDetails.getUserId());

        return ResponseEntity.ok()
                .contentType(TEXT_PLAIN_UTF8)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(ShoppingListService.FILE_NAME)
                        .build()
                        .toString())
                .body(body.getBytes(StandardCharsets.UTF_8));
    }
}
