package com.menuzy.restaurant.config;

import com.menuzy.restaurant.entity.Category;
import com.menuzy.restaurant.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Inserts the default restaurant classifications at start-up. Names already
 * present are skipped, so restarts never duplicate them.
 *
 * <p>Runs before the catalog seed, whose restaurants reference these rows.</p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class CategorySeeder implements ApplicationRunner {

    static final List<DefaultCategory> DEFAULT_CATEGORIES = List.of(
            new DefaultCategory("Fast Food", "Quick service restaurants", "🍔"),
            new DefaultCategory("Fine Dining", "Upscale dining experience", "🍽️"),
            new DefaultCategory("Cafe", "Coffee shops and light meals", "☕"),
            new DefaultCategory("Pizza", "Pizza restaurants", "🍕"),
            new DefaultCategory("Asian", "Asian cuisine", "🥢"),
            new DefaultCategory("Italian", "Italian cuisine", "🍝"),
            new DefaultCategory("Mexican", "Mexican cuisine", "🌮"),
            new DefaultCategory("Indian", "Indian cuisine", "🍛"),
            new DefaultCategory("Desserts", "Dessert and sweet shops", "🍰"),
            new DefaultCategory("Healthy", "Health-focused restaurants", "🥗"));

    private final CategoryRepository categoryRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        int inserted = 0;
        for (DefaultCategory category : DEFAULT_CATEGORIES) {
            if (categoryRepository.existsByName(category.name())) {
                continue;
            }
            categoryRepository.save(Category.builder()
                    .name(category.name())
                    .description(category.description())
                    .icon(category.icon())
                    .build());
            inserted++;
        }
        log.info("Default categories ready: {} inserted, {} already present",
                inserted, DEFAULT_CATEGORIES.size() - inserted);
    }

    record DefaultCategory(String name, String description, String icon) {
    }
}
