package com.menuzy.catalog.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.menuzy.catalog.dto.CatalogBatch;
import com.menuzy.catalog.dto.LoadResult;
import com.menuzy.catalog.service.CatalogLoader;
import com.menuzy.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the sample catalog once at start-up when {@code menuzy.catalog.seed.enabled=true}.
 *
 * <p>Skipped when any user exists already. A failed load is logged and start-up
 * continues; an unreadable seed file is a configuration error and stops it.</p>
 */
@Slf4j
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@ConditionalOnProperty(prefix = "menuzy.catalog.seed", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class CatalogSeedRunner implements ApplicationRunner {

    private final CatalogLoader catalogLoader;
    private final UserRepository userRepository;
    private final CatalogProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) {
        if (userRepository.count() > 0) {
            log.info("Catalog seed skipped: store already has users");
            return;
        }

        String location = properties.getSeed().getLocation();
        CatalogBatch batch = read(location);
        LoadResult result = catalogLoader.load(batch);
        if (result.ok()) {
            log.info("Catalog seed loaded from {}: {} records", location, result.ids().total());
        } else {
            log.warn("Catalog seed from {} not loaded ({}): {}", location, result.status(), result.errors());
        }
    }

    private CatalogBatch read(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, CatalogBatch.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read catalog seed " + location, e);
        }
    }
}
