package com.menuzy.catalog.service;

import com.menuzy.catalog.dto.CatalogBatch;
import com.menuzy.catalog.dto.EntityType;
import com.menuzy.catalog.dto.LoadError;
import com.menuzy.catalog.dto.MenuCategoryRecord;
import com.menuzy.catalog.dto.MenuItemRecord;
import com.menuzy.catalog.dto.RestaurantRecord;
import com.menuzy.catalog.dto.UserRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Lookup structure over one batch: batch refs by entity type, and the stored ids
 * the batch points at. Refs must be unique across the whole batch; blank or
 * repeated refs are collected as validation errors.
 */
public final class CatalogIndex {

    private final CatalogBatch batch;
    private final Map<String, Integer> userRefs = new HashMap<>();
    private final Map<String, Integer> restaurantRefs = new HashMap<>();
    private final Map<String, Integer> menuCategoryRefs = new HashMap<>();
    private final List<LoadError> errors = new ArrayList<>();

    private CatalogIndex(CatalogBatch batch) {
        this.batch = batch;
    }

    public static CatalogIndex of(CatalogBatch batch) {
        CatalogIndex index = new CatalogIndex(batch);
        Set<String> seen = new HashSet<>();
        index.register(EntityType.USER, batch.users(), UserRecord::ref, index.userRefs, seen);
        index.register(EntityType.RESTAURANT, batch.restaurants(), RestaurantRecord::ref, index.restaurantRefs, seen);
        index.register(EntityType.MENU_CATEGORY, batch.menuCategories(), MenuCategoryRecord::ref,
                index.menuCategoryRefs, seen);
        // Nothing references a menu item; its ref only has to be unique.
        index.register(EntityType.MENU_ITEM, batch.menuItems(), MenuItemRecord::ref, null, seen);
        return index;
    }

    private <T> void register(EntityType type, List<T> records, Function<T, String> refOf,
                              Map<String, Integer> target, Set<String> seen) {
        for (int i = 0; i < records.size(); i++) {
            T record = records.get(i);
            if (record == null) {
                continue;
            }
            String ref = refOf.apply(record);
            if (ref == null) {
                continue;
            }
            if (ref.isBlank()) {
                errors.add(LoadError.validation(type, i, "ref", "must not be blank"));
            } else if (!seen.add(ref)) {
                errors.add(LoadError.validation(type, i, "ref", "duplicate ref '" + ref + "'"));
            } else if (target != null) {
                target.put(ref, i);
            }
        }
    }

    public List<LoadError> errors() {
        return List.copyOf(errors);
    }

    public Integer userIndex(String ref) {
        return userRefs.get(ref);
    }

    public Integer restaurantIndex(String ref) {
        return restaurantRefs.get(ref);
    }

    public Integer menuCategoryIndex(String ref) {
        return menuCategoryRefs.get(ref);
    }

    /** Stored users named by {@code owner_id}. */
    public Set<Long> storedUserIds() {
        return collect(batch.restaurants(), RestaurantRecord::ownerId);
    }

    /** Stored restaurants named by {@code restaurant_id} on menu categories and menu items. */
    public Set<Long> storedRestaurantIds() {
        Set<Long> ids = new LinkedHashSet<>(collect(batch.menuCategories(), MenuCategoryRecord::restaurantId));
        ids.addAll(collect(batch.menuItems(), MenuItemRecord::restaurantId));
        return ids;
    }

    /** Stored menu categories named by {@code menu_category_id} on menu items. */
    public Set<Long> storedMenuCategoryIds() {
        return collect(batch.menuItems(), MenuItemRecord::menuCategoryId);
    }

    /** Restaurant classifications named by {@code category_id}. */
    public Set<Long> categoryIds() {
        return collect(batch.restaurants(), RestaurantRecord::categoryId);
    }

    private static <T> Set<Long> collect(List<T> records, Function<T, Long> idOf) {
        Set<Long> ids = new LinkedHashSet<>();
        records.stream()
                .filter(Objects::nonNull)
                .map(idOf)
                .filter(Objects::nonNull)
                .forEach(ids::add);
        return ids;
    }
}
