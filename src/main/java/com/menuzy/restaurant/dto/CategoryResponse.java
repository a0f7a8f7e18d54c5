package com.menuzy.restaurant.dto;

import com.menuzy.restaurant.entity.Category;

public record CategoryResponse(Long id, String name, String description, String icon) {

    public static CategoryResponse from(Category category) {
        return new CategoryResponse(category.getId(), category.getName(),
                category.getDescription(), category.getIcon());
    }
}
