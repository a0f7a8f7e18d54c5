package com.menuzy.restaurant.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Restaurant classification (Pizza, Mexican, ...). Not to be confused with
 * {@link MenuCategory}, which groups items inside one restaurant's menu.
 */
@Entity
@Table(name = "categories")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Category {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    private String description;

    private String icon;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Builder
    public Category(String name, String description, String icon) {
        this.name = name;
        this.description = description;
        this.icon = icon;
        this.active = true;
    }
}
