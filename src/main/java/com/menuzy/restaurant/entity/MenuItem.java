package com.menuzy.restaurant.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A dish on a menu. Belongs to a restaurant and to one of that restaurant's
 * menu categories; {@code displayOrder} is unique within the category.
 *
 * <p>Prices are kept per size label ({@code small}, {@code large}, {@code regular})
 * in {@code menu_item_prices}; ingredients and allergens keep their order through an
 * index column.</p>
 */
@Entity
@Table(name = "menu_items", indexes = {
        @Index(name = "idx_menu_items_restaurant", columnList = "restaurant_id")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_menu_item_display_order",
                columnNames = {"restaurant_id", "menu_category_id", "display_order"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class MenuItem {

    public static final int NAME_LENGTH = 255;
    public static final int DESCRIPTION_LENGTH = 2000;
    public static final int IMAGE_URL_LENGTH = 500;
    public static final int SIZE_LABEL_LENGTH = 50;
    // One ingredient or allergen entry.
    public static final int TERM_LENGTH = 255;
    // amount NUMERIC(10, 2): at most 8 integer digits and 2 decimals.
    public static final int PRICE_PRECISION = 10;
    public static final int PRICE_SCALE = 2;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "restaurant_id", nullable = false)
    private Restaurant restaurant;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "menu_category_id", nullable = false)
    private MenuCategory menuCategory;

    @Column(nullable = false, length = NAME_LENGTH)
    private String name;

    @Column(length = DESCRIPTION_LENGTH)
    private String description;

    @ElementCollection
    @CollectionTable(name = "menu_item_prices", joinColumns = @JoinColumn(name = "menu_item_id"))
    @MapKeyColumn(name = "size_label", length = SIZE_LABEL_LENGTH)
    @Column(name = "amount", nullable = false, precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private Map<String, BigDecimal> price = new LinkedHashMap<>();

    @Column(name = "image_url", length = IMAGE_URL_LENGTH)
    private String imageUrl;

    @Column(name = "is_vegetarian", nullable = false)
    private boolean vegetarian;

    @Column(name = "is_vegan", nullable = false)
    private boolean vegan;

    @Column(name = "is_gluten_free", nullable = false)
    private boolean glutenFree;

    @ElementCollection
    @CollectionTable(name = "menu_item_ingredients", joinColumns = @JoinColumn(name = "menu_item_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "ingredient", nullable = false, length = TERM_LENGTH)
    private List<String> ingredients = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "menu_item_allergens", joinColumns = @JoinColumn(name = "menu_item_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "allergen", nullable = false, length = TERM_LENGTH)
    private List<String> allergens = new ArrayList<>();

    @Column(name = "is_available", nullable = false)
    private boolean available;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public MenuItem(Restaurant restaurant, MenuCategory menuCategory, String name, String description,
                    Map<String, BigDecimal> price, String imageUrl, boolean vegetarian, boolean vegan,
                    boolean glutenFree, List<String> ingredients, List<String> allergens,
                    Boolean available, int displayOrder) {
        this.restaurant = restaurant;
        this.menuCategory = menuCategory;
        this.name = name;
        this.description = description;
        if (price != null) {
            this.price = new LinkedHashMap<>(price);
        }
        this.imageUrl = imageUrl;
        this.vegetarian = vegetarian;
        this.vegan = vegan;
        this.glutenFree = glutenFree;
        if (ingredients != null) {
            this.ingredients = new ArrayList<>(ingredients);
        }
        if (allergens != null) {
            this.allergens = new ArrayList<>(allergens);
        }
        this.available = available == null || available;
        this.displayOrder = displayOrder;
    }
}
