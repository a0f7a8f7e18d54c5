package com.menuzy.restaurant.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * A section of one restaurant's menu ("Appetizers", "Pizzas").
 * {@code displayOrder} is unique per restaurant and sets the section sequence.
 */
@Entity
@Table(name = "menu_categories", uniqueConstraints = {
        @UniqueConstraint(name = "uk_menu_category_display_order",
                columnNames = {"restaurant_id", "display_order"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class MenuCategory {

    public static final int NAME_LENGTH = 100;
    public static final int DESCRIPTION_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "restaurant_id", nullable = false)
    private Restaurant restaurant;

    @Column(nullable = false, length = NAME_LENGTH)
    private String name;

    @Column(length = DESCRIPTION_LENGTH)
    private String description;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public MenuCategory(Restaurant restaurant, String name, String description, int displayOrder) {
        this.restaurant = restaurant;
        this.name = name;
        this.description = description;
        this.displayOrder = displayOrder;
        this.active = true;
    }
}
