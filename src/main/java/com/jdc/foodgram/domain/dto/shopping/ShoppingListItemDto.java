package com.jdc.foodgram.domain.dto.shopping;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 장바구니 재료 합계 한 줄. JPQL 생성자 표현식으로 만들어진다.
 */
@Getter
@AllArgsConstructor
public class ShoppingListItemDto {
    private String name;
    private String measurementUnit;
    private Long totalAmount;

    public String toLine() {
        return name + " (" + measurementUnit + ") — " + totalAmount;
    }
}
