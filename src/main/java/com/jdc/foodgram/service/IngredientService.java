package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.ingredient.IngredientDto;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.QIngredient;
import com.jdc.foodgram.domain.repository.IngredientRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.IngredientMapper;
import com.jdc.foodgram.util.ClasspathCsvReader;
import com.querydsl.core.types.Projections;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.core.types.dsl.CaseBuilder;
import com.querydsl.core.types.dsl.NumberExpression;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class IngredientService {

    private final JPAQueryFactory queryFactory;
    private final IngredientRepository repo;

    private final QIngredient ing = QIngredient.ingredient;

    /**
     * @param name 검색어 (optional). 대소문자 구분 없이 포함 검색하며, 검색어로 시작하는 재료가 먼저 온다.
     */
    @Transactional(readOnly = true)
    public List<IngredientDto> search(String name) {
        boolean hasKeyword = name != null && !name.isBlank();
        String keyword = hasKeyword ? name.trim() : null;

        BooleanExpression nameCond = hasKeyword ? ing.name.containsIgnoreCase(keyword) : null;
        NumberExpression<Integer> prefixFirst = hasKeyword
                ? new CaseBuilder().when(ing.name.startsWithIgnoreCase(keyword)).then(0).otherwise(1)
                : null;

        var query = queryFactory
                .select(Projections.constructor(
                        IngredientDto.class,
                        ing.id,
                        ing.name,
                        ing.measurementUnit
                ))
                .from(ing)
                .where(nameCond);

        if (prefixFirst != null) {
            query.orderBy(prefixFirst.asc());
        }
        return query.orderBy(ing.name.asc(), ing.measurementUnit.asc()).fetch();
    }

    @Transactional(readOnly = true)
    public IngredientDto get(Long id) {
        return repo.findById(id)
                .map(IngredientMapper::toDto)
                .orElseThrow(() -> new CustomException(ErrorCode.INGREDIENT_NOT_FOUND));
    }

    /**
     * "이름,단위" 형식의 CSV 를 적재한다. 이미 있는 (이름, 단위) 조합은 건너뛴다.
     *
     * @return 새로 추가된 재료 수
     */
    public int importFromClasspath(String location) {
        Set<String> existing = new HashSet<>();
        repo.findAll().forEach(i -> existing.add(key(i.getName(), i.getMeasurementUnit())));

        List<Ingredient> toSave = new ArrayList<>();
        for (String[] row : ClasspathCsvReader.readRows(location)) {
            if (row.length < 2 || row[0].isEmpty() || row[1].isEmpty()) {
                log.warn("재료 CSV 형식 오류로 건너뜀: {}", String.join(",", row));
                continue;
            }
            if (existing.add(key(row[0], row[1]))) {
                toSave.add(Ingredient.builder().name(row[0]).measurementUnit(row[1]).build());
            }
        }

        repo.saveAll(toSave);
        log.info("재료 적재: {} 에서 {}건 추가", location, toSave.size());
        return toSave.size();
    }

    private static String key(String name, String unit) {
        return name + '\u0000' + unit;
    }
}
