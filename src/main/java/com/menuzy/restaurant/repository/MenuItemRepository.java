package com.menuzy.restaurant.repository;

import com.menuzy.restaurant.entity.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {

    List<MenuItem> findByRestaurantIdOrderByDisplayOrderAscNameAsc(Long restaurantId);

    @Query("SELECT new com.menuzy.restaurant.repository.DisplayOrderSlot(i.menuCategory.id, i.displayOrder) "
            + "FROM MenuItem i WHERE i.menuCategory.id IN :menuCategoryIds")
    List<DisplayOrderSlot> findDisplayOrderSlots(@Param("menuCategoryIds") Collection<Long> menuCategoryIds);
}
