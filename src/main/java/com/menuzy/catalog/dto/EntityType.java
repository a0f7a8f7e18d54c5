package com.menuzy.catalog.dto;

/**
 * The four record kinds a catalog batch carries, in the order they are persisted.
 */
public enum EntityType {
    USER,
    RESTAURANT,
    MENU_CATEGORY,
    MENU_ITEM
}
