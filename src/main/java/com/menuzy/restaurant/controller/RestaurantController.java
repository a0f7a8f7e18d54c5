package com.menuzy.restaurant.controller;

import com.menuzy.common.dto.ApiResponse;
import com.menuzy.restaurant.dto.MenuSectionResponse;
import com.menuzy.restaurant.dto.RestaurantResponse;
import com.menuzy.restaurant.service.RestaurantService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/restaurants")
@RequiredArgsConstructor
public class RestaurantController {

    private final RestaurantService restaurantService;

    @GetMapping
    public ApiResponse<List<RestaurantResponse>> getRestaurants(
            @RequestParam(name = "category_id", required = false) Long categoryId) {
        return ApiResponse.ok(restaurantService.getRestaurants(categoryId));
    }

    @GetMapping("/search")
    public ApiResponse<List<RestaurantResponse>> searchRestaurants(
            @RequestParam @NotBlank String q,
            @RequestParam(name = "category_id", required = false) Long categoryId,
            @RequestParam(defaultValue = "20") @Positive @Max(100) int limit) {
        return ApiResponse.ok(restaurantService.searchRestaurants(q, categoryId, limit));
    }

    @GetMapping("/{id}")
    public ApiResponse<RestaurantResponse> getRestaurant(@PathVariable Long id) {
        return ApiResponse.ok(restaurantService.getRestaurant(id));
    }

    @GetMapping("/{id}/menu")
    public ApiResponse<List<MenuSectionResponse>> getMenu(@PathVariable Long id) {
        return ApiResponse.ok(restaurantService.getMenu(id));
    }
}
