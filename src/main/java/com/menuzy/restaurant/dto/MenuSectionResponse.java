package com.menuzy.restaurant.dto;

import com.menuzy.restaurant.entity.MenuCategory;

import java.util.List;

/**
 * One menu category of a restaurant together with its items, both in display order.
 */
public record MenuSectionResponse(Long id, String name, String description, int displayOrder,
                                  List<MenuItemResponse> items) {

    public static MenuSectionResponse of(MenuCategory category, List<MenuItemResponse> items) {
        return new MenuSectionResponse(category.getId(), category.getName(),
                category.getDescription(), category.getDisplayOrder(), items);
    }
}
