package com.jdc.foodgram.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

@Entity
@Table(name = "short_links", uniqueConstraints = {
        @UniqueConstraint(name = "uk_short_links_hash", columnNames = {"hash"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ShortLink {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recipe_id", nullable = false, unique = true)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Recipe recipe;

    @Column(nullable = false, length = 10)
    private String hash;
}
