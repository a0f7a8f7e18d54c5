package com.menuzy.restaurant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.menuzy.restaurant.entity.MenuItem;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record MenuItemResponse(
        Long id,
        Long restaurantId,
        Long menuCategoryId,
        String name,
        String description,
        Map<String, BigDecimal> price,
        String imageUrl,
        @JsonProperty("is_vegetarian") boolean vegetarian,
        @JsonProperty("is_vegan") boolean vegan,
        @JsonProperty("is_gluten_free") boolean glutenFree,
        List<String> ingredients,
        List<String> allergens,
        @JsonProperty("is_available") boolean available,
        int displayOrder
) {

    public static MenuItemResponse from(MenuItem item) {
        return new MenuItemResponse(
                item.getId(),
                item.getRestaurant().getId(),
                item.getMenuCategory().getId(),
                item.getName(),
                item.getDescription(),
                new LinkedHashMap<>(item.getPrice()),
                item.getImageUrl(),
                item.isVegetarian(),
                item.isVegan(),
                item.isGlutenFree(),
                List.copyOf(item.getIngredients()),
                List.copyOf(item.getAllergens()),
                item.isAvailable(),
                item.getDisplayOrder());
    }
}
