package com.menuzy.restaurant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.menuzy.restaurant.entity.Restaurant;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

public record RestaurantResponse(
        Long id,
        String name,
        String description,
        String address,
        Double latitude,
        Double longitude,
        String phone,
        String email,
        Long categoryId,
        String categoryName,
        Long ownerId,
        String imageUrl,
        Map<String, String> openingHours,
        @JsonProperty("is_active") boolean active,
        BigDecimal rating,
        int totalReviews,
        LocalDateTime createdAt
) {

    public static RestaurantResponse from(Restaurant restaurant) {
        return new RestaurantResponse(
                restaurant.getId(),
                restaurant.getName(),
                restaurant.getDescription(),
                restaurant.getAddress(),
                restaurant.getLatitude(),
                restaurant.getLongitude(),
                restaurant.getPhone(),
                restaurant.getEmail(),
                restaurant.getCategory().getId(),
                restaurant.getCategory().getName(),
                restaurant.getOwner().getId(),
                restaurant.getImageUrl(),
                new LinkedHashMap<>(restaurant.getOpeningHours()),
                restaurant.isActive(),
                restaurant.getRating(),
                restaurant.getTotalReviews(),
                restaurant.getCreatedAt());
    }
}
