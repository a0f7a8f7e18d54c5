package com.menuzy.restaurant.service;

import com.menuzy.common.exception.BusinessException;
import com.menuzy.common.exception.ErrorCode;
import com.menuzy.restaurant.dto.MenuItemResponse;
import com.menuzy.restaurant.dto.MenuSectionResponse;
import com.menuzy.restaurant.dto.RestaurantResponse;
import com.menuzy.restaurant.entity.Category;
import com.menuzy.restaurant.entity.MenuCategory;
import com.menuzy.restaurant.entity.MenuItem;
import com.menuzy.restaurant.entity.Restaurant;
import com.menuzy.restaurant.repository.CategoryRepository;
import com.menuzy.restaurant.repository.MenuCategoryRepository;
import com.menuzy.restaurant.repository.MenuItemRepository;
import com.menuzy.restaurant.repository.RestaurantRepository;
import com.menuzy.user.entity.User;
import com.menuzy.user.entity.UserRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RestaurantServiceTest {

    @Mock
    private CategoryRepository categoryRepository;
    @Mock
    private RestaurantRepository restaurantRepository;
    @Mock
    private MenuCategoryRepository menuCategoryRepository;
    @Mock
    private MenuItemRepository menuItemRepository;

    @InjectMocks
    private RestaurantService restaurantService;

    @Test
    @DisplayName("식당 상세 조회 - 분류와 주인 id 포함")
    void getRestaurant_Success() {
        Restaurant restaurant = restaurant();
        given(restaurantRepository.findById(1L)).willReturn(Optional.of(restaurant));

        RestaurantResponse response = restaurantService.getRestaurant(1L);

        assertThat(response.name()).isEqualTo("Pizza Palace");
        assertThat(response.categoryName()).isEqualTo("Pizza");
        assertThat(response.ownerId()).isEqualTo(2L);
        assertThat(response.openingHours()).containsEntry("friday", "11:00-23:00");
        assertThat(response.active()).isTrue();
        assertThat(response.rating()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("없는 식당 조회 시 RESTAURANT_NOT_FOUND")
    void getRestaurant_NotFound_ThrowsException() {
        given(restaurantRepository.findById(42L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> restaurantService.getRestaurant(42L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.RESTAURANT_NOT_FOUND));
    }

    @Test
    @DisplayName("없는 분류로 식당 목록 조회 시 CATEGORY_NOT_FOUND")
    void getRestaurants_UnknownCategory_ThrowsException() {
        given(categoryRepository.existsById(99L)).willReturn(false);

        assertThatThrownBy(() -> restaurantService.getRestaurants(99L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.CATEGORY_NOT_FOUND));
        verifyNoInteractions(restaurantRepository);
    }

    @Test
    @DisplayName("검색어는 앞뒤 공백을 지우고 limit만큼만 조회")
    void searchRestaurants_TrimsQueryAndLimits() {
        given(categoryRepository.existsById(4L)).willReturn(true);
        given(restaurantRepository.search("pizza", 4L, PageRequest.of(0, 5))).willReturn(List.of(restaurant()));

        List<RestaurantResponse> found = restaurantService.searchRestaurants("  pizza ", 4L, 5);

        assertThat(found).extracting(RestaurantResponse::name).containsExactly("Pizza Palace");
    }

    @Test
    @DisplayName("없는 분류로 검색 시 CATEGORY_NOT_FOUND")
    void searchRestaurants_UnknownCategory_ThrowsException() {
        given(categoryRepository.existsById(99L)).willReturn(false);

        assertThatThrownBy(() -> restaurantService.searchRestaurants("pizza", 99L, 20))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.CATEGORY_NOT_FOUND));
        verifyNoInteractions(restaurantRepository);
    }

    @Test
    @DisplayName("메뉴는 카테고리 display_order 순, 각 카테고리에 자기 메뉴만")
    void getMenu_GroupsItemsByCategory() {
        Restaurant restaurant = restaurant();
        MenuCategory appetizers = menuCategory(restaurant, 10L, "Appetizers", 1);
        MenuCategory pizzas = menuCategory(restaurant, 11L, "Pizzas", 2);
        given(restaurantRepository.existsById(1L)).willReturn(true);
        given(menuCategoryRepository.findByRestaurantIdAndActiveTrueOrderByDisplayOrderAscNameAsc(1L))
                .willReturn(List.of(appetizers, pizzas));
        given(menuItemRepository.findByRestaurantIdOrderByDisplayOrderAscNameAsc(1L)).willReturn(List.of(
                menuItem(restaurant, appetizers, 100L, "Garlic Bread", 1),
                menuItem(restaurant, pizzas, 101L, "Margherita", 1),
                menuItem(restaurant, appetizers, 102L, "Mozzarella Sticks", 2)));

        List<MenuSectionResponse> menu = restaurantService.getMenu(1L);

        assertThat(menu).extracting(MenuSectionResponse::name).containsExactly("Appetizers", "Pizzas");
        assertThat(menu.get(0).items()).extracting(MenuItemResponse::name).containsExactly("Garlic Bread", "Mozzarella Sticks");
        assertThat(menu.get(1).items()).singleElement().satisfies(item -> {
            assertThat(item.name()).isEqualTo("Margherita");
            assertThat(item.available()).isTrue();
            assertThat(item.price()).containsEntry("small", new BigDecimal("12.99"));
        });
    }

    @Test
    @DisplayName("없는 식당의 메뉴 조회 시 RESTAURANT_NOT_FOUND")
    void getMenu_UnknownRestaurant_ThrowsException() {
        given(restaurantRepository.existsById(42L)).willReturn(false);

        assertThatThrownBy(() -> restaurantService.getMenu(42L))
                .isInstanceOf(BusinessException.class);
        verifyNoInteractions(menuItemRepository, menuCategoryRepository);
    }

    private static Restaurant restaurant() {
        Category pizza = Category.builder().name("Pizza").description("Pizza restaurants").icon("🍕").build();
        ReflectionTestUtils.setField(pizza, "id", 4L);
        User owner = User.builder().email("john@pizzapalace.com").fullName("John Smith")
                .role(UserRole.RESTAURANT_ADMIN).build();
        ReflectionTestUtils.setField(owner, "id", 2L);
        Restaurant restaurant = Restaurant.builder()
                .name("Pizza Palace")
                .address("123 Main St, New York, NY")
                .category(pizza)
                .owner(owner)
                .openingHours(Map.of("friday", "11:00-23:00"))
                .build();
        ReflectionTestUtils.setField(restaurant, "id", 1L);
        return restaurant;
    }

    private static MenuCategory menuCategory(Restaurant restaurant, Long id, String name, int displayOrder) {
        MenuCategory category = MenuCategory.builder()
                .restaurant(restaurant).name(name).displayOrder(displayOrder).build();
        ReflectionTestUtils.setField(category, "id", id);
        return category;
    }

    private static MenuItem menuItem(Restaurant restaurant, MenuCategory category, Long id, String name,
                                     int displayOrder) {
        MenuItem item = MenuItem.builder()
                .restaurant(restaurant)
                .menuCategory(category)
                .name(name)
                .price(Map.of("small", new BigDecimal("12.99")))
                .displayOrder(displayOrder)
                .build();
        ReflectionTestUtils.setField(item, "id", id);
        return item;
    }
}
