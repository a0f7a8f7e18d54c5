package com.menuzy.restaurant.repository;

import com.menuzy.restaurant.entity.Category;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CategoryRepository extends JpaRepository<Category, Long> {

    List<Category> findByActiveTrueOrderByNameAsc();

    boolean existsByName(String name);
}
