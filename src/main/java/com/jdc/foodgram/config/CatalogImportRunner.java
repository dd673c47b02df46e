package com.jdc.foodgram.config;

import com.jdc.foodgram.service.IngredientService;
import com.jdc.foodgram.service.TagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.catalog", name = "import-on-startup", havingValue = "true")
public class CatalogImportRunner implements ApplicationRunner {

    private final IngredientService ingredientService;
    private final TagService tagService;
    private final CatalogProperties catalogProperties;

    @Override
    public void run(ApplicationArguments args) {
        int ingredients = ingredientService.importFromClasspath(catalogProperties.getIngredientsPath());
        int tags = tagService.importFromClasspath(catalogProperties.getTagsPath());
        log.info("카탈로그 적재 완료: 재료 {}건, 태그 {}건 추가", ingredients, tags);
    }
}
