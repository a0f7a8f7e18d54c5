package com.menuzy.restaurant.controller;

import com.menuzy.common.dto.ApiResponse;
import com.menuzy.restaurant.dto.CategoryResponse;
import com.menuzy.restaurant.service.RestaurantService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/categories")
@RequiredArgsConstructor
public class CategoryController {

    private final RestaurantService restaurantService;

    @GetMapping
    public ApiResponse<List<CategoryResponse>> getCategories() {
        return ApiResponse.ok(restaurantService.getCategories());
    }
}
