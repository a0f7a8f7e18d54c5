package com.menuzy.restaurant.repository;

/**
 * A display order already taken in the store, together with the id of the
 * parent it is unique under (restaurant for menu categories, menu category
 * for menu items).
 */
public record DisplayOrderSlot(Long parentId, int displayOrder) {
}
