package com.jdc.foodgram.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- User (100) ---
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "101", "요청한 사용자가 존재하지 않습니다."),
    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "102", "이미 사용 중인 이메일입니다."),
    DUPLICATE_USERNAME(HttpStatus.BAD_REQUEST, "103", "이미 사용 중인 사용자 이름입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "104", "인증이 필요합니다."),
    INVALID_CURRENT_PASSWORD(HttpStatus.BAD_REQUEST, "105", "현재 비밀번호가 올바르지 않습니다."),
    ADMIN_ACCESS_DENIED(HttpStatus.FORBIDDEN, "106", "관리자만 접근할 수 있습니다."),

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND(HttpStatus.NOT_FOUND, "201", "요청한 레시피가 존재하지 않습니다."),
    RECIPE_ACCESS_DENIED(HttpStatus.FORBIDDEN, "202", "레시피 작성자만 수정하거나 삭제할 수 있습니다."),
    INVALID_COOKING_TIME(HttpStatus.BAD_REQUEST, "203", "조리 시간은 1분 이상 32000분 이하여야 합니다."),
    INVALID_IMAGE_ENCODING(HttpStatus.BAD_REQUEST, "204", "이미지 인코딩 형식이 올바르지 않습니다."),
    IMAGE_REQUIRED(HttpStatus.BAD_REQUEST, "205", "레시피 이미지는 필수입니다."),

    // --- Relation (300) ---
    ALREADY_FAVORITED_RECIPE(HttpStatus.BAD_REQUEST, "301", "이미 즐겨찾기한 레시피입니다."),
    FAVORITE_NOT_FOUND(HttpStatus.BAD_REQUEST, "302", "즐겨찾기에 없는 레시피입니다."),
    ALREADY_IN_SHOPPING_CART(HttpStatus.BAD_REQUEST, "303", "이미 장바구니에 담긴 레시피입니다."),
    CART_ITEM_NOT_FOUND(HttpStatus.BAD_REQUEST, "304", "장바구니에 없는 레시피입니다."),
    ALREADY_SUBSCRIBED(HttpStatus.BAD_REQUEST, "305", "이미 구독 중인 사용자입니다."),
    SUBSCRIPTION_NOT_FOUND(HttpStatus.BAD_REQUEST, "306", "구독하지 않은 사용자입니다."),
    SELF_SUBSCRIPTION(HttpStatus.BAD_REQUEST, "307", "자기 자신을 구독하거나 구독 취소할 수 없습니다."),

    // --- Ingredient (400) ---
    INGREDIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "401", "요청한 재료가 존재하지 않습니다."),
    INVALID_INGREDIENT_AMOUNT(HttpStatus.BAD_REQUEST, "402", "재료 수량은 1 이상 32000 이하여야 합니다."),
    DUPLICATE_INGREDIENT(HttpStatus.BAD_REQUEST, "403", "재료가 중복되었습니다."),
    EMPTY_INGREDIENTS(HttpStatus.BAD_REQUEST, "404", "재료를 하나 이상 추가해야 합니다."),
    INGREDIENT_NOT_FOUND_IN_REQUEST(HttpStatus.BAD_REQUEST, "405", "존재하지 않는 재료가 포함되어 있습니다."),

    // --- Tag (500) ---
    TAG_NOT_FOUND(HttpStatus.NOT_FOUND, "501", "요청한 태그가 존재하지 않습니다."),
    EMPTY_TAGS(HttpStatus.BAD_REQUEST, "502", "태그를 하나 이상 선택해야 합니다."),
    DUPLICATE_TAG(HttpStatus.BAD_REQUEST, "503", "태그가 중복되었습니다."),
    TAG_NOT_FOUND_IN_REQUEST(HttpStatus.BAD_REQUEST, "504", "존재하지 않는 태그가 포함되어 있습니다."),

    // --- Auth (600) ---
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "601", "이메일 또는 비밀번호가 올바르지 않습니다."),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "602", "유효하지 않은 토큰입니다."),

    // --- Short link (700) ---
    SHORT_LINK_NOT_FOUND(HttpStatus.NOT_FOUND, "701", "존재하지 않는 단축 링크입니다."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "잘못된 입력값입니다."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "허용되지 않은 메소드입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "서버 내부 오류입니다."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "904", "지원하지 않는 Content-Type 입니다."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.CONFLICT, "905", "데이터베이스 제약조건을 위반했습니다."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
