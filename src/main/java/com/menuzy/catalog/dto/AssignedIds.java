package com.menuzy.catalog.dto;

import java.util.List;
import java.util.Map;

/**
 * Identifiers generated by a committed load. Each list follows the order of the
 * matching list in the batch; {@code refs} maps every batch ref to its new id.
 */
public record AssignedIds(
        List<Long> users,
        List<Long> restaurants,
        List<Long> menuCategories,
        List<Long> menuItems,
        Map<String, Long> refs
) {

    public AssignedIds {
        users = List.copyOf(users);
        restaurants = List.copyOf(restaurants);
        menuCategories = List.copyOf(menuCategories);
        menuItems = List.copyOf(menuItems);
        refs = Map.copyOf(refs);
    }

    public int total() {
        return users.size() + restaurants.size() + menuCategories.size() + menuItems.size();
    }
}
