package com.jdc.foodgram.domain.entity;

import com.jdc.foodgram.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(
        name = "recipes",
        indexes = {
                @Index(name = "idx_recipes_author_id", columnList = "author_id"),
                @Index(name = "idx_recipes_created_at", columnList = "created_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Recipe extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User author;

    @Column(nullable = false, length = 256)
    private String name;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String text;

    @Column(name = "cooking_time", nullable = false)
    private Integer cookingTime;

    @Column(nullable = false)
    private String image;

    @OneToMany(mappedBy = "recipe", fetch = FetchType.LAZY)
    @BatchSize(size = 50)
    @Builder.Default
    private Set<RecipeTag> tags = new HashSet<>();

    @OneToMany(mappedBy = "recipe", fetch = FetchType.LAZY)
    @BatchSize(size = 50)
    @Builder.Default
    private List<RecipeIngredient> ingredients = new ArrayList<>();

    public void update(String name, String text, Integer cookingTime) {
        this.name = name;
        this.text = text;
        this.cookingTime = cookingTime;
    }

    public void updateImage(String image) {
        this.image = image;
    }

    // 태그/재료 연결은 각 리포지토리로 저장하고, 메모리상의 컬렉션만 맞춘다
    public void replaceTags(Collection<RecipeTag> newTags) {
        this.tags.clear();
        this.tags.addAll(newTags);
    }

    public void replaceIngredients(Collection<RecipeIngredient> newIngredients) {
        this.ingredients.clear();
        this.ingredients.addAll(newIngredients);
    }

    public boolean isAuthor(Long userId) {
        return userId != null && author != null && userId.equals(author.getId());
    }
}
