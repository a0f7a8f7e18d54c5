package com.menuzy.catalog.dto;

import lombok.Builder;

@Builder(toBuilder = true)
public record MenuCategoryRecord(
        String ref,
        Long restaurantId,
        String restaurantRef,
        String name,
        String description,
        Integer displayOrder
) {

    // An omitted display order means 0.
    public int displayOrderOrDefault() {
        return displayOrder == null ? 0 : displayOrder;
    }
}
