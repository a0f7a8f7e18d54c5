package com.menuzy.catalog.service;

import com.menuzy.catalog.config.CatalogProperties;
import com.menuzy.catalog.dto.AssignedIds;
import com.menuzy.catalog.dto.CatalogBatch;
import com.menuzy.catalog.dto.LoadError;
import com.menuzy.catalog.dto.LoadResult;
import com.menuzy.catalog.dto.LoadStatus;
import com.menuzy.catalog.dto.MenuCategoryRecord;
import com.menuzy.catalog.dto.MenuItemRecord;
import com.menuzy.catalog.dto.RestaurantRecord;
import com.menuzy.catalog.dto.UserRecord;
import com.menuzy.restaurant.entity.MenuCategory;
import com.menuzy.restaurant.entity.MenuItem;
import com.menuzy.restaurant.entity.Restaurant;
import com.menuzy.restaurant.repository.CategoryRepository;
import com.menuzy.restaurant.repository.MenuCategoryRepository;
import com.menuzy.restaurant.repository.MenuItemRepository;
import com.menuzy.restaurant.repository.RestaurantRepository;
import com.menuzy.restaurant.service.RestaurantService;
import com.menuzy.user.entity.User;
import com.menuzy.user.entity.UserRole;
import com.menuzy.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Loads a catalog batch atomically: all of it or none of it.
 *
 * <p>Each call runs in its own transaction ({@code REQUIRES_NEW}, isolation from
 * {@link CatalogProperties}) bounded by the caller's timeout. Inside it the stored
 * restaurants the batch points at are locked, the batch is validated, and only a
 * batch without errors is inserted, tier by tier, so every reference is an
 * existing row by the time it is written:</p>
 *
 * <pre>
 *   users → restaurants → menu categories → menu items
 * </pre>
 *
 * <p>The outcome is always a {@link LoadResult}; validation, store and timeout
 * failures are never thrown to the caller.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogLoader {

    // Longest timeout a transaction can carry (whole seconds as an int); longer ones are capped.
    static final Duration MAX_TIMEOUT = Duration.ofSeconds(Integer.MAX_VALUE);

    private final CatalogValidator validator;
    private final UserRepository userRepository;
    private final CategoryRepository categoryRepository;
    private final RestaurantRepository restaurantRepository;
    private final MenuCategoryRepository menuCategoryRepository;
    private final MenuItemRepository menuItemRepository;
    private final PlatformTransactionManager transactionManager;
    private final CatalogProperties properties;
    private final Clock clock;

    /**
     * Loads with the configured default timeout.
     */
    @CacheEvict(cacheNames = {RestaurantService.RESTAURANTS_CACHE, RestaurantService.MENUS_CACHE}, allEntries = true)
    public LoadResult load(CatalogBatch batch) {
        return doLoad(batch, properties.getDefaultTimeout());
    }

    /**
     * @param timeout upper bound for the whole transaction, validation included; capped at {@link #MAX_TIMEOUT}
     * @throws IllegalArgumentException if {@code timeout} is not positive
     */
    @CacheEvict(cacheNames = {RestaurantService.RESTAURANTS_CACHE, RestaurantService.MENUS_CACHE}, allEntries = true)
    public LoadResult load(CatalogBatch batch, Duration timeout) {
        return doLoad(batch, timeout);
    }

    private LoadResult doLoad(CatalogBatch batch, Duration timeout) {
        Objects.requireNonNull(batch, "batch must not be null");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            log.debug("Timeout {} capped at {}", timeout, MAX_TIMEOUT);
            timeout = MAX_TIMEOUT;
        }

        LoadRun run = new LoadRun(clock.instant().plus(timeout));
        log.info("Catalog load received: {} users, {} restaurants, {} menu categories, {} menu items (timeout {})",
                batch.users().size(), batch.restaurants().size(),
                batch.menuCategories().size(), batch.menuItems().size(), timeout);

        try {
            LoadResult result = newTransaction(timeout).execute(tx -> loadInTransaction(batch, run, tx));
            if (result.ok()) {
                run.moveTo(LoadStatus.COMMITTED);
                log.info("Catalog load committed: {} records", result.ids().total());
            } else {
                run.moveTo(LoadStatus.REJECTED);
                log.warn("Catalog load rejected with {} errors", result.errors().size());
            }
            return result;
        } catch (TransactionTimedOutException | QueryTimeoutException e) {
            return rollBack(run, LoadError.timeout("load exceeded its timeout of " + timeout + ": " + e.getMessage()), e);
        } catch (DataIntegrityViolationException e) {
            return rollBack(run, LoadError.store("constraint violated: " + rootMessage(e)), e);
        } catch (ConcurrencyFailureException e) {
            return rollBack(run, LoadError.store("concurrent update conflict: " + rootMessage(e)), e);
        } catch (DataAccessException | TransactionException e) {
            return rollBack(run, LoadError.store(rootMessage(e)), e);
        }
    }

    private TransactionTemplate newTransaction(Duration timeout) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setIsolationLevel(properties.getIsolation().value());
        template.setTimeout(timeoutSeconds(timeout));
        return template;
    }

    // Transaction timeouts are whole seconds; round up so a short timeout never becomes zero.
    static int timeoutSeconds(Duration timeout) {
        if (timeout.compareTo(MAX_TIMEOUT) >= 0) {
            return Integer.MAX_VALUE;
        }
        long millis = timeout.toMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.max(1, Math.min(seconds, Integer.MAX_VALUE));
    }

    private LoadResult loadInTransaction(CatalogBatch batch, LoadRun run, TransactionStatus tx) {
        CatalogIndex index = CatalogIndex.of(batch);
        Map<Long, Restaurant> lockedRestaurants = lockRestaurants(index);
        run.checkDeadline("validation");

        List<LoadError> errors = validator.validate(batch, index);
        run.moveTo(LoadStatus.VALIDATED);
        if (!errors.isEmpty()) {
            tx.setRollbackOnly();
            return LoadResult.rejected(errors);
        }
        run.checkDeadline("persisting");

        run.moveTo(LoadStatus.PERSISTING);
        AssignedIds ids = new Persist(batch, index, lockedRestaurants, run).all();
        // COMMITTED and REJECTED are entered once the transaction has ended.
        return LoadResult.committed(ids);
    }

    private Map<Long, Restaurant> lockRestaurants(CatalogIndex index) {
        Map<Long, Restaurant> locked = new HashMap<>();
        if (index.storedRestaurantIds().isEmpty()) {
            return locked;
        }
        restaurantRepository.findAllByIdInWithLock(index.storedRestaurantIds())
                .forEach(restaurant -> locked.put(restaurant.getId(), restaurant));
        log.debug("Locked restaurants {}", locked.keySet());
        return locked;
    }

    private LoadResult rollBack(LoadRun run, LoadError error, Exception cause) {
        run.moveTo(LoadStatus.ROLLED_BACK);
        log.warn("Catalog load rolled back ({}): {}", error.kind(), error.reason());
        log.debug("Rollback cause", cause);
        return LoadResult.rolledBack(error);
    }

    private static String rootMessage(Exception e) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(e);
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    /**
     * Status and deadline of one load call.
     */
    private final class LoadRun {

        private final Instant deadline;
        private LoadStatus status = LoadStatus.RECEIVED;

        private LoadRun(Instant deadline) {
            this.deadline = deadline;
        }

        void moveTo(LoadStatus next) {
            status = status.transitionTo(next);
            log.debug("Catalog load -> {}", next);
        }

        void checkDeadline(String phase) {
            if (!clock.instant().isBefore(deadline)) {
                throw new TransactionTimedOutException("deadline passed before " + phase);
            }
        }
    }

    /**
     * Inserts one validated batch. Batch refs are turned into the entities saved
     * by earlier tiers; stored ids into references the session already holds or
     * lazily resolves.
     */
    private final class Persist {

        private final CatalogBatch batch;
        private final CatalogIndex index;
        private final Map<Long, Restaurant> lockedRestaurants;
        private final LoadRun run;
        private final Map<String, Long> refs = new HashMap<>();

        private Persist(CatalogBatch batch, CatalogIndex index, Map<Long, Restaurant> lockedRestaurants, LoadRun run) {
            this.batch = batch;
            this.index = index;
            this.lockedRestaurants = lockedRestaurants;
            this.run = run;
        }

        AssignedIds all() {
            List<User> users = userRepository.saveAll(map(batch.users(), this::toUser));
            assignRefs(batch.users(), UserRecord::ref, users, User::getId);
            run.checkDeadline("restaurants");

            List<Restaurant> restaurants = restaurantRepository.saveAll(
                    map(batch.restaurants(), record -> toRestaurant(record, users)));
            assignRefs(batch.restaurants(), RestaurantRecord::ref, restaurants, Restaurant::getId);
            run.checkDeadline("menu categories");

            List<MenuCategory> menuCategories = menuCategoryRepository.saveAll(
                    map(batch.menuCategories(), record -> toMenuCategory(record, restaurants)));
            assignRefs(batch.menuCategories(), MenuCategoryRecord::ref, menuCategories, MenuCategory::getId);
            run.checkDeadline("menu items");

            List<MenuItem> menuItems = menuItemRepository.saveAll(
                    map(batch.menuItems(), record -> toMenuItem(record, restaurants, menuCategories)));
            assignRefs(batch.menuItems(), MenuItemRecord::ref, menuItems, MenuItem::getId);

            // Surface constraint violations now, while the load can still report them.
            menuItemRepository.flush();
            run.checkDeadline("commit");

            return new AssignedIds(ids(users, User::getId), ids(restaurants, Restaurant::getId),
                    ids(menuCategories, MenuCategory::getId), ids(menuItems, MenuItem::getId), refs);
        }

        private User toUser(UserRecord record) {
            return User.builder()
                    .email(record.email())
                    .fullName(record.fullName())
                    .phone(record.phone())
                    .role(UserRole.fromValue(record.role()).orElseThrow())
                    .passwordHash(record.passwordHash())
                    .build();
        }

        private Restaurant toRestaurant(RestaurantRecord record, List<User> users) {
            User owner = record.ownerRef() != null
                    ? users.get(index.userIndex(record.ownerRef()))
                    : userRepository.getReferenceById(record.ownerId());
            return Restaurant.builder()
                    .name(record.name())
                    .description(record.description())
                    .address(record.address())
                    .latitude(record.latitude())
                    .longitude(record.longitude())
                    .phone(record.phone())
                    .email(record.email())
                    .category(categoryRepository.getReferenceById(record.categoryId()))
                    .owner(owner)
                    .imageUrl(record.imageUrl())
                    .openingHours(record.openingHours())
                    .build();
        }

        private MenuCategory toMenuCategory(MenuCategoryRecord record, List<Restaurant> restaurants) {
            return MenuCategory.builder()
                    .restaurant(restaurant(record.restaurantId(), record.restaurantRef(), restaurants))
                    .name(record.name())
                    .description(record.description())
                    .displayOrder(record.displayOrderOrDefault())
                    .build();
        }

        private MenuItem toMenuItem(MenuItemRecord record, List<Restaurant> restaurants,
                                    List<MenuCategory> menuCategories) {
            MenuCategory menuCategory = record.menuCategoryRef() != null
                    ? menuCategories.get(index.menuCategoryIndex(record.menuCategoryRef()))
                    : menuCategoryRepository.getReferenceById(record.menuCategoryId());
            return MenuItem.builder()
                    .restaurant(restaurant(record.restaurantId(), record.restaurantRef(), restaurants))
                    .menuCategory(menuCategory)
                    .name(record.name())
                    .description(record.description())
                    .price(record.price())
                    .imageUrl(record.imageUrl())
                    .vegetarian(Boolean.TRUE.equals(record.vegetarian()))
                    .vegan(Boolean.TRUE.equals(record.vegan()))
                    .glutenFree(Boolean.TRUE.equals(record.glutenFree()))
                    .ingredients(record.ingredients())
                    .allergens(record.allergens())
                    .available(record.available())
                    .displayOrder(record.displayOrderOrDefault())
                    .build();
        }

        private Restaurant restaurant(Long id, String ref, List<Restaurant> restaurants) {
            if (ref != null) {
                return restaurants.get(index.restaurantIndex(ref));
            }
            Restaurant locked = lockedRestaurants.get(id);
            return locked != null ? locked : restaurantRepository.getReferenceById(id);
        }

        private <R, E> void assignRefs(List<R> records, Function<R, String> refOf,
                                       List<E> saved, Function<E, Long> idOf) {
            for (int i = 0; i < records.size(); i++) {
                String ref = refOf.apply(records.get(i));
                if (ref != null) {
                    refs.put(ref, idOf.apply(saved.get(i)));
                }
            }
        }

        private static <R, E> List<E> map(List<R> records, Function<R, E> mapper) {
            List<E> entities = new ArrayList<>(records.size());
            records.forEach(record -> entities.add(mapper.apply(record)));
            return entities;
        }

        private static <E> List<Long> ids(List<E> entities, Function<E, Long> idOf) {
            return entities.stream().map(idOf).toList();
        }
    }
}
