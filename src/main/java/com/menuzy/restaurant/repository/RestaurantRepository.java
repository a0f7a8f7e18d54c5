package com.menuzy.restaurant.repository;

import com.menuzy.restaurant.entity.Restaurant;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface RestaurantRepository extends JpaRepository<Restaurant, Long> {

    List<Restaurant> findByActiveTrueOrderByNameAsc();

    List<Restaurant> findByActiveTrueAndCategoryIdOrderByNameAsc(Long categoryId);

    /**
     * Active restaurants whose name, description or address contains {@code term},
     * ignoring case; best rated first. A null {@code categoryId} matches every category.
     */
    @Query("SELECT r FROM Restaurant r WHERE r.active = true "
            + "AND (:categoryId IS NULL OR r.category.id = :categoryId) "
            + "AND (LOWER(r.name) LIKE LOWER(CONCAT('%', :term, '%')) "
            + "OR LOWER(r.description) LIKE LOWER(CONCAT('%', :term, '%')) "
            + "OR LOWER(r.address) LIKE LOWER(CONCAT('%', :term, '%'))) "
            + "ORDER BY r.rating DESC, r.name ASC")
    List<Restaurant> search(@Param("term") String term, @Param("categoryId") Long categoryId, Pageable pageable);

    /**
     * SELECT ... FOR UPDATE on every listed restaurant, in id order so two
     * loads locking overlapping sets cannot deadlock. Held until the load's
     * transaction ends, which serializes loads touching the same restaurant.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Restaurant r WHERE r.id IN :ids ORDER BY r.id")
    List<Restaurant> findAllByIdInWithLock(@Param("ids") Collection<Long> ids);
}
