package com.menuzy.catalog.dto;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything submitted to one load call. Omitted lists are treated as empty.
 *
 * <pre>{@code
 * {
 *   "users":           [{"ref": "john", "email": "john@pizzapalace.com", "role": "restaurant_admin", ...}],
 *   "restaurants":     [{"ref": "pizza-palace", "owner_ref": "john", "category_id": 4, ...}],
 *   "menu_categories": [{"ref": "pizzas", "restaurant_ref": "pizza-palace", "display_order": 2, ...}],
 *   "menu_items":      [{"restaurant_ref": "pizza-palace", "menu_category_ref": "pizzas", ...}]
 * }
 * }</pre>
 */
@Builder(toBuilder = true)
public record CatalogBatch(
        List<UserRecord> users,
        List<RestaurantRecord> restaurants,
        List<MenuCategoryRecord> menuCategories,
        List<MenuItemRecord> menuItems
) {

    public CatalogBatch {
        users = copyOf(users);
        restaurants = copyOf(restaurants);
        menuCategories = copyOf(menuCategories);
        menuItems = copyOf(menuItems);
    }

    public int size() {
        return users.size() + restaurants.size() + menuCategories.size() + menuItems.size();
    }

    // List.copyOf would reject null elements; those are reported by the validator instead.
    private static <T> List<T> copyOf(List<T> records) {
        return records == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(records));
    }
}
