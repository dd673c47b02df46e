package com.jdc.foodgram.domain.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "ingredients", uniqueConstraints = {
        @UniqueConstraint(name = "uk_ingredients_name_unit", columnNames = {"name", "measurement_unit"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Ingredient {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(name = "measurement_unit", nullable = false, length = 64)
    private String measurementUnit;
}
