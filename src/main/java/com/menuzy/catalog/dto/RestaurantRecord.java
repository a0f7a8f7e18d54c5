package com.menuzy.catalog.dto;

import lombok.Builder;

import java.util.Map;

/**
 * A restaurant to create. The owner is given either as {@code owner_id} (a stored
 * user) or as {@code owner_ref} (a user record of the same batch), never both.
 */
@Builder(toBuilder = true)
public record RestaurantRecord(
        String ref,
        String name,
        String description,
        String address,
        Double latitude,
        Double longitude,
        String phone,
        String email,
        Long categoryId,
        Long ownerId,
        String ownerRef,
        String imageUrl,
        Map<String, String> openingHours
) {
}
