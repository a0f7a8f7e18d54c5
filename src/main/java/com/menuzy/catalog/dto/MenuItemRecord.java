package com.menuzy.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * A menu item to create. Restaurant and menu category are each referenced by a
 * stored id or by a batch ref; the menu category must belong to that restaurant.
 *
 * <p>{@code price} maps a size label to its amount, e.g.
 * {@code {"small": 12.99, "large": 18.99}}.</p>
 */
@Builder(toBuilder = true)
public record MenuItemRecord(
        String ref,
        Long restaurantId,
        String restaurantRef,
        Long menuCategoryId,
        String menuCategoryRef,
        String name,
        String description,
        Map<String, BigDecimal> price,
        String imageUrl,
        @JsonProperty("is_vegetarian") Boolean vegetarian,
        @JsonProperty("is_vegan") Boolean vegan,
        @JsonProperty("is_gluten_free") Boolean glutenFree,
        List<String> ingredients,
        List<String> allergens,
        @JsonProperty("is_available") Boolean available,
        Integer displayOrder
) {

    public int displayOrderOrDefault() {
        return displayOrder == null ? 0 : displayOrder;
    }
}
