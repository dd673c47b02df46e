package com.jdc.foodgram.controller;

import com.jayway.jsonpath.JsonPath;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.Tag;
import com.jdc.foodgram.domain.repository.IngredientRepository;
import com.jdc.foodgram.domain.repository.TagRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class FoodgramApiTest {

    private static final String IMAGE = "data:image/png;base64,iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAYAAAAfFcSJAAAADUlEQVR42mP8z8BQDwAEhQGAhKmMIQAAAABJRU5ErkJggg==";

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private TagRepository tagRepository;
    @Autowired
    private IngredientRepository ingredientRepository;

    @Test
    @DisplayName("시작 시 CSV 카탈로그가 적재되고 잘못된 행과 중복은 건너뛴다")
    void catalogImportedOnStartup() throws Exception {
        mockMvc.perform(get("/api/tags"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].slug").value("breakfast"))
                .andExpect(jsonPath("$[0].color").value("#E26C2D"));

        mockMvc.perform(get("/api/ingredients").param("name", "PEP"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value("pepper, black"))
                .andExpect(jsonPath("$[0].measurement_unit").value("pinch"));
    }

    @Test
    @DisplayName("비로그인 사용자의 즐겨찾기 필터와 쓰기 요청은 401")
    void anonymousRestrictions() throws Exception {
        mockMvc.perform(get("/api/recipes").param("is_favorited", "1"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/recipes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/api/recipes/download_shopping_cart"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("가입, 로그인, 레시피 생성, 장바구니 다운로드, 로그아웃까지 한 흐름")
    void signupToShoppingListFlow() throws Exception {
        String username = "cook" + UUID.randomUUID().toString().substring(0, 8);
        String email = username + "@example.com";

        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "username": "%s", "first_name": "Ivan",
                                 "last_name": "Petrov", "password": "S3cure!pass"}
                                """.formatted(email, username)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.username").value(username))
                .andExpect(jsonPath("$.password").doesNotExist());

        String loginBody = mockMvc.perform(post("/api/auth/token/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "S3cure!pass"}
                                """.formatted(email)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String authHeader = "Token " + JsonPath.read(loginBody, "$.auth_token");

        Long tagId = tagRepository.findAll().stream()
                .filter(t -> t.getSlug().equals("breakfast"))
                .map(Tag::getId)
                .findFirst().orElseThrow();
        Map<String, Long> ingredientIds = ingredientRepository.findAll().stream()
                .collect(Collectors.toMap(Ingredient::getName, Ingredient::getId, (a, b) -> a));

        String createBody = mockMvc.perform(post("/api/recipes")
                        .header(HttpHeaders.AUTHORIZATION, authHeader)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Hash browns", "text": "Grate and fry", "cooking_time": 20,
                                 "image": "%s", "tags": [%d],
                                 "ingredients": [{"id": %d, "amount": 400}, {"id": %d, "amount": 5}]}
                                """.formatted(IMAGE, tagId, ingredientIds.get("potato"), ingredientIds.get("salt"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.tags[0].slug").value("breakfast"))
                .andExpect(jsonPath("$.ingredients", hasSize(2)))
                .andExpect(jsonPath("$.is_favorited").value(false))
                .andExpect(jsonPath("$.author.username").value(username))
                .andExpect(jsonPath("$.image").value(containsString("/media/recipes/")))
                .andReturn().getResponse().getContentAsString();
        Integer recipeId = JsonPath.read(createBody, "$.id");

        mockMvc.perform(post("/api/recipes/{id}/shopping_cart", recipeId)
                        .header(HttpHeaders.AUTHORIZATION, authHeader))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.cooking_time").value(20));

        mockMvc.perform(post("/api/recipes/{id}/shopping_cart", recipeId)
                        .header(HttpHeaders.AUTHORIZATION, authHeader))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/recipes/download_shopping_cart")
                        .header(HttpHeaders.AUTHORIZATION, authHeader))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("shopping_list.txt")))
                .andExpect(content().string("potato (g) — 400\nsalt (g) — 5"));

        mockMvc.perform(get("/api/recipes/{id}", recipeId)
                        .header(HttpHeaders.AUTHORIZATION, authHeader))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_in_shopping_cart").value(true));

        mockMvc.perform(post("/api/auth/token/logout")
                        .header(HttpHeaders.AUTHORIZATION, authHeader))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/users/me")
                        .header(HttpHeaders.AUTHORIZATION, authHeader))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("태그가 비어 있는 레시피는 400 과 필드명을 돌려준다")
    void createRecipe_withoutTags_badRequest() throws Exception {
        String username = "chef" + UUID.randomUUID().toString().substring(0, 8);
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s@example.com", "username": "%s", "first_name": "A",
                                 "last_name": "B", "password": "S3cure!pass"}
                                """.formatted(username, username)))
                .andExpect(status().isCreated());
        String loginBody = mockMvc.perform(post("/api/auth/token/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s@example.com", "password": "S3cure!pass"}
                                """.formatted(username)))
                .andReturn().getResponse().getContentAsString();
        String authHeader = "Token " + JsonPath.read(loginBody, "$.auth_token");
        Long potatoId = ingredientRepository.findAll().stream()
                .collect(Collectors.toMap(Ingredient::getName, Function.identity(), (a, b) -> a))
                .get("potato").getId();

        mockMvc.perform(post("/api/recipes")
                        .header(HttpHeaders.AUTHORIZATION, authHeader)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Nothing", "text": "x", "cooking_time": 5, "image": "%s",
                                 "tags": [], "ingredients": [{"id": %d, "amount": 1}]}
                                """.formatted(IMAGE, potatoId)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("502"));
    }
}
