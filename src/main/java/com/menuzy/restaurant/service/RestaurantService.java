package com.menuzy.restaurant.service;

import com.menuzy.common.exception.BusinessException;
import com.menuzy.common.exception.ErrorCode;
import com.menuzy.restaurant.dto.CategoryResponse;
import com.menuzy.restaurant.dto.MenuItemResponse;
import com.menuzy.restaurant.dto.MenuSectionResponse;
import com.menuzy.restaurant.dto.RestaurantResponse;
import com.menuzy.restaurant.entity.MenuCategory;
import com.menuzy.restaurant.repository.CategoryRepository;
import com.menuzy.restaurant.repository.MenuCategoryRepository;
import com.menuzy.restaurant.repository.MenuItemRepository;
import com.menuzy.restaurant.repository.RestaurantRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read side of the catalog.
 *
 * <p>Results are cached in Caffeine as response records, never as entities, so
 * nothing lazy escapes the transaction. Every catalog load clears these caches.</p>
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RestaurantService {

    public static final String CATEGORIES_CACHE = "categories";
    public static final String RESTAURANTS_CACHE = "restaurants";
    public static final String MENUS_CACHE = "restaurantMenus";

    private final CategoryRepository categoryRepository;
    private final RestaurantRepository restaurantRepository;
    private final MenuCategoryRepository menuCategoryRepository;
    private final MenuItemRepository menuItemRepository;

    @Cacheable(value = CATEGORIES_CACHE, key = "'active'")
    public List<CategoryResponse> getCategories() {
        return categoryRepository.findByActiveTrueOrderByNameAsc().stream()
                .map(CategoryResponse::from)
                .toList();
    }

    public List<RestaurantResponse> getRestaurants(Long categoryId) {
        requireCategory(categoryId);
        var restaurants = categoryId == null
                ? restaurantRepository.findByActiveTrueOrderByNameAsc()
                : restaurantRepository.findByActiveTrueAndCategoryIdOrderByNameAsc(categoryId);
        return restaurants.stream()
                .map(RestaurantResponse::from)
                .toList();
    }

    /**
     * Free-text search over name, description and address. Not cached: the
     * query space is open-ended.
     */
    public List<RestaurantResponse> searchRestaurants(String query, Long categoryId, int limit) {
        requireCategory(categoryId);
        return restaurantRepository.search(query.trim(), categoryId, PageRequest.of(0, limit)).stream()
                .map(RestaurantResponse::from)
                .toList();
    }

    @Cacheable(value = RESTAURANTS_CACHE, key = "#id")
    public RestaurantResponse getRestaurant(Long id) {
        return restaurantRepository.findById(id)
                .map(RestaurantResponse::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.RESTAURANT_NOT_FOUND,
                        "Restaurant " + id + " not found"));
    }

    /**
     * Active menu categories in display order, each with its items ordered by
     * display order and then name.
     */
    @Cacheable(value = MENUS_CACHE, key = "#restaurantId")
    public List<MenuSectionResponse> getMenu(Long restaurantId) {
        if (!restaurantRepository.existsById(restaurantId)) {
            throw new BusinessException(ErrorCode.RESTAURANT_NOT_FOUND,
                    "Restaurant " + restaurantId + " not found");
        }

        Map<Long, List<MenuItemResponse>> itemsByCategory =
                menuItemRepository.findByRestaurantIdOrderByDisplayOrderAscNameAsc(restaurantId).stream()
                        .map(MenuItemResponse::from)
                        .collect(Collectors.groupingBy(MenuItemResponse::menuCategoryId));

        List<MenuCategory> categories =
                menuCategoryRepository.findByRestaurantIdAndActiveTrueOrderByDisplayOrderAscNameAsc(restaurantId);
        return categories.stream()
                .map(category -> MenuSectionResponse.of(category,
                        itemsByCategory.getOrDefault(category.getId(), List.of())))
                .toList();
    }

    private void requireCategory(Long categoryId) {
        if (categoryId != null && !categoryRepository.existsById(categoryId)) {
            throw new BusinessException(ErrorCode.CATEGORY_NOT_FOUND, "Category " + categoryId + " not found");
        }
    }
}
