package com.menuzy.restaurant.repository;

import com.menuzy.restaurant.entity.MenuCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface MenuCategoryRepository extends JpaRepository<MenuCategory, Long> {

    List<MenuCategory> findByRestaurantIdAndActiveTrueOrderByDisplayOrderAscNameAsc(Long restaurantId);

    @Query("SELECT new com.menuzy.restaurant.repository.DisplayOrderSlot(c.restaurant.id, c.displayOrder) "
            + "FROM MenuCategory c WHERE c.restaurant.id IN :restaurantIds")
    List<DisplayOrderSlot> findDisplayOrderSlots(@Param("restaurantIds") Collection<Long> restaurantIds);
}
