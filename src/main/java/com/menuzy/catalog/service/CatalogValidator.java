package com.menuzy.catalog.service;

import com.menuzy.catalog.dto.CatalogBatch;
import com.menuzy.catalog.dto.EntityType;
import com.menuzy.catalog.dto.LoadError;
import com.menuzy.catalog.dto.MenuCategoryRecord;
import com.menuzy.catalog.dto.MenuItemRecord;
import com.menuzy.catalog.dto.RestaurantRecord;
import com.menuzy.catalog.dto.UserRecord;
import com.menuzy.restaurant.entity.Category;
import com.menuzy.restaurant.entity.MenuCategory;
import com.menuzy.restaurant.entity.MenuItem;
import com.menuzy.restaurant.entity.OpeningHoursConverter;
import com.menuzy.restaurant.entity.Restaurant;
import com.menuzy.restaurant.repository.CategoryRepository;
import com.menuzy.restaurant.repository.DisplayOrderSlot;
import com.menuzy.restaurant.repository.MenuCategoryRepository;
import com.menuzy.restaurant.repository.MenuItemRepository;
import com.menuzy.restaurant.repository.RestaurantRepository;
import com.menuzy.user.entity.User;
import com.menuzy.user.entity.UserRole;
import com.menuzy.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks a whole batch before anything is written and returns every problem it
 * finds, so the caller can fix the batch in one pass.
 *
 * <p>Problems with the input itself are {@code VALIDATION} errors: missing or
 * malformed fields, values longer or more precise than their column, references
 * that resolve to nothing, an owner without an admin role, a menu item whose
 * category belongs to another restaurant, display orders repeated among siblings
 * of the batch. A well-formed record that collides with a row already stored
 * (email taken, display order slot used) is a {@code STORE} error instead.</p>
 *
 * <p>Must run inside the load's transaction so the stored rows it reads are the
 * ones the insert will meet.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final OpeningHoursConverter OPENING_HOURS = new OpeningHoursConverter();
    private static final Set<String> WEEKDAYS = Arrays.stream(DayOfWeek.values())
            .map(day -> day.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    private static final String ROLES = Arrays.stream(UserRole.values())
            .map(UserRole::getValue)
            .collect(Collectors.joining(", "));

    private static final Comparator<LoadError> BY_RECORD = Comparator
            .comparing(LoadError::entity, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(LoadError::index, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final UserRepository userRepository;
    private final CategoryRepository categoryRepository;
    private final RestaurantRepository restaurantRepository;
    private final MenuCategoryRepository menuCategoryRepository;
    private final MenuItemRepository menuItemRepository;

    /**
     * @return every problem found, ordered by entity type and record position; empty when the batch may be persisted
     */
    public List<LoadError> validate(CatalogBatch batch) {
        return validate(batch, CatalogIndex.of(batch));
    }

    /**
     * Same as {@link #validate(CatalogBatch)} for a caller that already indexed the batch.
     */
    public List<LoadError> validate(CatalogBatch batch, CatalogIndex index) {
        BatchCheck check = new BatchCheck(batch, index, readStoredRows(batch, index));
        check.errors.addAll(index.errors());
        check.checkUsers();
        check.checkRestaurants();
        check.checkMenuCategories();
        check.checkMenuItems();

        List<LoadError> errors = new ArrayList<>(check.errors);
        errors.sort(BY_RECORD);
        log.debug("Validated batch of {} records: {} errors", batch.size(), errors.size());
        return errors;
    }

    private StoredRows readStoredRows(CatalogBatch batch, CatalogIndex index) {
        Map<Long, User> users = byId(userRepository.findAllById(index.storedUserIds()), User::getId);
        Set<Long> categoryIds = categoryRepository.findAllById(index.categoryIds()).stream()
                .map(Category::getId)
                .collect(Collectors.toSet());
        Map<Long, Restaurant> restaurants =
                byId(restaurantRepository.findAllById(index.storedRestaurantIds()), Restaurant::getId);
        Map<Long, MenuCategory> menuCategories =
                byId(menuCategoryRepository.findAllById(index.storedMenuCategoryIds()), MenuCategory::getId);

        Set<String> emails = batch.users().stream()
                .filter(Objects::nonNull)
                .map(user -> User.normalizeEmail(user.email()))
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<String> takenEmails = emails.isEmpty() ? Set.of() : userRepository.findByEmailIn(emails).stream()
                .map(User::getEmail)
                .collect(Collectors.toSet());

        Set<DisplayOrderSlot> menuCategorySlots = restaurants.isEmpty() ? Set.of()
                : new HashSet<>(menuCategoryRepository.findDisplayOrderSlots(restaurants.keySet()));
        Set<DisplayOrderSlot> menuItemSlots = menuCategories.isEmpty() ? Set.of()
                : new HashSet<>(menuItemRepository.findDisplayOrderSlots(menuCategories.keySet()));

        return new StoredRows(users, categoryIds, restaurants, menuCategories, takenEmails,
                menuCategorySlots, menuItemSlots);
    }

    private static <T> Map<Long, T> byId(List<T> entities, Function<T, Long> idOf) {
        Map<Long, T> map = new HashMap<>();
        entities.forEach(entity -> map.put(idOf.apply(entity), entity));
        return map;
    }

    private record StoredRows(
            Map<Long, User> users,
            Set<Long> categoryIds,
            Map<Long, Restaurant> restaurants,
            Map<Long, MenuCategory> menuCategories,
            Set<String> takenEmails,
            Set<DisplayOrderSlot> menuCategorySlots,
            Set<DisplayOrderSlot> menuItemSlots
    ) {
    }

    // A display order among the children of one parent (restaurant or menu category).
    private record SiblingSlot(EntityKey parent, int displayOrder) {
    }

    /**
     * State of one validation pass. Menu categories are checked before menu items
     * because an item's category must resolve to the same restaurant as the item.
     */
    private static final class BatchCheck {

        private final CatalogBatch batch;
        private final CatalogIndex index;
        private final StoredRows stored;
        private final List<LoadError> errors = new ArrayList<>();
        private final EntityKey[] menuCategoryRestaurants;

        private BatchCheck(CatalogBatch batch, CatalogIndex index, StoredRows stored) {
            this.batch = batch;
            this.index = index;
            this.stored = stored;
            this.menuCategoryRestaurants = new EntityKey[batch.menuCategories().size()];
        }

        void checkUsers() {
            List<UserRecord> users = batch.users();
            Map<String, List<Integer>> byEmail = new LinkedHashMap<>();
            for (int i = 0; i < users.size(); i++) {
                UserRecord user = users.get(i);
                if (user == null) {
                    nullRecord(EntityType.USER, i);
                    continue;
                }
                String email = User.normalizeEmail(user.email());
                if (isBlank(email)) {
                    fail(EntityType.USER, i, "email", "must not be blank");
                } else if (!EMAIL.matcher(email).matches()) {
                    fail(EntityType.USER, i, "email", "is not a valid email address");
                } else if (email.length() > User.EMAIL_LENGTH) {
                    tooLong(EntityType.USER, i, "email", User.EMAIL_LENGTH);
                } else if (stored.takenEmails().contains(email)) {
                    conflict(EntityType.USER, i, "email", "is already registered");
                } else {
                    byEmail.computeIfAbsent(email, key -> new ArrayList<>()).add(i);
                }
                required(EntityType.USER, i, "full_name", user.fullName(), User.FULL_NAME_LENGTH);
                maxLength(EntityType.USER, i, "phone", user.phone(), User.PHONE_LENGTH);
                maxLength(EntityType.USER, i, "password_hash", user.passwordHash(), User.PASSWORD_HASH_LENGTH);
                if (isBlank(user.role())) {
                    fail(EntityType.USER, i, "role", "must not be blank");
                } else if (UserRole.fromValue(user.role()).isEmpty()) {
                    fail(EntityType.USER, i, "role", "must be one of " + ROLES);
                }
            }
            byEmail.values().stream()
                    .filter(indexes -> indexes.size() > 1)
                    .flatMap(List::stream)
                    .forEach(i -> fail(EntityType.USER, i, "email", "is used by more than one user in the batch"));
        }

        void checkRestaurants() {
            List<RestaurantRecord> restaurants = batch.restaurants();
            for (int i = 0; i < restaurants.size(); i++) {
                RestaurantRecord restaurant = restaurants.get(i);
                if (restaurant == null) {
                    nullRecord(EntityType.RESTAURANT, i);
                    continue;
                }
                required(EntityType.RESTAURANT, i, "name", restaurant.name(), Restaurant.NAME_LENGTH);
                required(EntityType.RESTAURANT, i, "address", restaurant.address(), Restaurant.ADDRESS_LENGTH);
                maxLength(EntityType.RESTAURANT, i, "description", restaurant.description(),
                        Restaurant.DESCRIPTION_LENGTH);
                checkRange(i, "latitude", restaurant.latitude(), 90);
                checkRange(i, "longitude", restaurant.longitude(), 180);
                maxLength(EntityType.RESTAURANT, i, "phone", restaurant.phone(), Restaurant.PHONE_LENGTH);
                maxLength(EntityType.RESTAURANT, i, "email", restaurant.email(), Restaurant.EMAIL_LENGTH);
                maxLength(EntityType.RESTAURANT, i, "image_url", restaurant.imageUrl(), Restaurant.IMAGE_URL_LENGTH);

                if (restaurant.categoryId() == null) {
                    fail(EntityType.RESTAURANT, i, "category_id", "must not be null");
                } else if (!stored.categoryIds().contains(restaurant.categoryId())) {
                    fail(EntityType.RESTAURANT, i, "category_id", "not found");
                }

                checkOwner(i, restaurant);
                checkOpeningHours(i, restaurant.openingHours());
            }
        }

        private void checkOwner(int i, RestaurantRecord restaurant) {
            EntityKey owner = resolve(EntityType.RESTAURANT, i, "owner",
                    restaurant.ownerId(), restaurant.ownerRef(), stored.users().keySet(), index::userIndex);
            if (owner == null) {
                return;
            }
            UserRole role = owner.isStored()
                    ? stored.users().get(owner.storedId()).getRole()
                    : UserRole.fromValue(batch.users().get(owner.batchIndex()).role()).orElse(null);
            // An unknown role is already reported on the user record.
            if (role != null && !role.canOwnRestaurant()) {
                fail(EntityType.RESTAURANT, i, owner.isStored() ? "owner_id" : "owner_ref",
                        "must reference a restaurant_admin or super_admin, not a " + role.getValue());
            }
        }

        private void checkOpeningHours(int i, Map<String, String> openingHours) {
            if (openingHours == null) {
                return;
            }
            openingHours.forEach((day, hours) -> {
                if (!WEEKDAYS.contains(day)) {
                    fail(EntityType.RESTAURANT, i, "opening_hours", "unknown weekday '" + day + "'");
                } else if (isBlank(hours)) {
                    fail(EntityType.RESTAURANT, i, "opening_hours", "hours for " + day + " must not be blank");
                }
            });
            String json = OPENING_HOURS.convertToDatabaseColumn(openingHours);
            if (json != null && json.length() > Restaurant.OPENING_HOURS_LENGTH) {
                fail(EntityType.RESTAURANT, i, "opening_hours",
                        "must be at most " + Restaurant.OPENING_HOURS_LENGTH + " characters as JSON");
            }
        }

        void checkMenuCategories() {
            List<MenuCategoryRecord> categories = batch.menuCategories();
            Map<SiblingSlot, List<Integer>> slots = new LinkedHashMap<>();
            for (int i = 0; i < categories.size(); i++) {
                MenuCategoryRecord category = categories.get(i);
                if (category == null) {
                    nullRecord(EntityType.MENU_CATEGORY, i);
                    continue;
                }
                required(EntityType.MENU_CATEGORY, i, "name", category.name(), MenuCategory.NAME_LENGTH);
                maxLength(EntityType.MENU_CATEGORY, i, "description", category.description(),
                        MenuCategory.DESCRIPTION_LENGTH);
                int displayOrder = category.displayOrderOrDefault();
                boolean orderValid = checkDisplayOrder(EntityType.MENU_CATEGORY, i, displayOrder);

                EntityKey restaurant = resolve(EntityType.MENU_CATEGORY, i, "restaurant",
                        category.restaurantId(), category.restaurantRef(),
                        stored.restaurants().keySet(), index::restaurantIndex);
                menuCategoryRestaurants[i] = restaurant;
                if (restaurant == null || !orderValid) {
                    continue;
                }
                if (restaurant.isStored() && stored.menuCategorySlots()
                        .contains(new DisplayOrderSlot(restaurant.storedId(), displayOrder))) {
                    conflict(EntityType.MENU_CATEGORY, i, "display_order",
                            "display_order " + displayOrder + " is already used in restaurant " + restaurant.storedId());
                } else {
                    slots.computeIfAbsent(new SiblingSlot(restaurant, displayOrder), key -> new ArrayList<>()).add(i);
                }
            }
            reportRepeatedSlots(EntityType.MENU_CATEGORY, slots, "restaurant");
        }

        void checkMenuItems() {
            List<MenuItemRecord> items = batch.menuItems();
            Map<SiblingSlot, List<Integer>> slots = new LinkedHashMap<>();
            for (int i = 0; i < items.size(); i++) {
                MenuItemRecord item = items.get(i);
                if (item == null) {
                    nullRecord(EntityType.MENU_ITEM, i);
                    continue;
                }
                required(EntityType.MENU_ITEM, i, "name", item.name(), MenuItem.NAME_LENGTH);
                maxLength(EntityType.MENU_ITEM, i, "description", item.description(), MenuItem.DESCRIPTION_LENGTH);
                maxLength(EntityType.MENU_ITEM, i, "image_url", item.imageUrl(), MenuItem.IMAGE_URL_LENGTH);
                int displayOrder = item.displayOrderOrDefault();
                boolean orderValid = checkDisplayOrder(EntityType.MENU_ITEM, i, displayOrder);
                checkPrice(i, item.price());
                checkTerms(i, "ingredients", item.ingredients());
                checkTerms(i, "allergens", item.allergens());

                EntityKey restaurant = resolve(EntityType.MENU_ITEM, i, "restaurant",
                        item.restaurantId(), item.restaurantRef(),
                        stored.restaurants().keySet(), index::restaurantIndex);
                EntityKey category = resolve(EntityType.MENU_ITEM, i, "menu_category",
                        item.menuCategoryId(), item.menuCategoryRef(),
                        stored.menuCategories().keySet(), index::menuCategoryIndex);
                if (category == null) {
                    continue;
                }
                if (restaurant != null) {
                    EntityKey owning = restaurantOf(category);
                    if (owning != null && !owning.equals(restaurant)) {
                        fail(EntityType.MENU_ITEM, i, category.isStored() ? "menu_category_id" : "menu_category_ref",
                                "belongs to a different restaurant (" + owning + ")");
                    }
                }
                if (!orderValid) {
                    continue;
                }
                if (category.isStored() && stored.menuItemSlots()
                        .contains(new DisplayOrderSlot(category.storedId(), displayOrder))) {
                    conflict(EntityType.MENU_ITEM, i, "display_order",
                            "display_order " + displayOrder + " is already used in menu category " + category.storedId());
                } else {
                    slots.computeIfAbsent(new SiblingSlot(category, displayOrder), key -> new ArrayList<>()).add(i);
                }
            }
            reportRepeatedSlots(EntityType.MENU_ITEM, slots, "menu category");
        }

        // Null when the category's own restaurant reference did not resolve.
        private EntityKey restaurantOf(EntityKey menuCategory) {
            if (menuCategory.isStored()) {
                return EntityKey.stored(stored.menuCategories().get(menuCategory.storedId()).getRestaurant().getId());
            }
            return menuCategoryRestaurants[menuCategory.batchIndex()];
        }

        private void checkPrice(int i, Map<String, BigDecimal> price) {
            if (price == null || price.isEmpty()) {
                fail(EntityType.MENU_ITEM, i, "price", "must have at least one size");
                return;
            }
            price.forEach((label, amount) -> {
                if (isBlank(label)) {
                    fail(EntityType.MENU_ITEM, i, "price", "size label must not be blank");
                } else if (label.length() > MenuItem.SIZE_LABEL_LENGTH) {
                    fail(EntityType.MENU_ITEM, i, "price",
                            "size label '" + label + "' must be at most " + MenuItem.SIZE_LABEL_LENGTH + " characters");
                }
                if (amount == null || amount.signum() <= 0) {
                    fail(EntityType.MENU_ITEM, i, "price", "amount for '" + label + "' must be greater than 0");
                    return;
                }
                BigDecimal plain = amount.stripTrailingZeros();
                if (plain.scale() > MenuItem.PRICE_SCALE) {
                    fail(EntityType.MENU_ITEM, i, "price", "amount for '" + label + "' must have at most "
                            + MenuItem.PRICE_SCALE + " decimal places");
                } else if (plain.precision() - plain.scale() > MenuItem.PRICE_PRECISION - MenuItem.PRICE_SCALE) {
                    fail(EntityType.MENU_ITEM, i, "price", "amount for '" + label + "' must have at most "
                            + (MenuItem.PRICE_PRECISION - MenuItem.PRICE_SCALE) + " integer digits");
                }
            });
        }

        private void checkTerms(int i, String field, List<String> terms) {
            if (terms == null) {
                return;
            }
            if (terms.stream().anyMatch(BatchCheck::isBlank)) {
                fail(EntityType.MENU_ITEM, i, field, "must not contain blank entries");
            } else if (terms.stream().anyMatch(term -> term.length() > MenuItem.TERM_LENGTH)) {
                fail(EntityType.MENU_ITEM, i, field,
                        "entries must be at most " + MenuItem.TERM_LENGTH + " characters");
            }
        }

        private boolean checkDisplayOrder(EntityType entity, int i, int displayOrder) {
            if (displayOrder < 0) {
                fail(entity, i, "display_order", "must not be negative");
                return false;
            }
            return true;
        }

        private void checkRange(int i, String field, Double value, int bound) {
            if (value != null && (value.isNaN() || value < -bound || value > bound)) {
                fail(EntityType.RESTAURANT, i, field, "must be between -" + bound + " and " + bound);
            }
        }

        private void maxLength(EntityType entity, int i, String field, String value, int max) {
            if (value != null && value.length() > max) {
                tooLong(entity, i, field, max);
            }
        }

        private void tooLong(EntityType entity, int i, String field, int max) {
            fail(entity, i, field, "must be at most " + max + " characters");
        }

        /**
         * Resolves an {@code <name>_id} / {@code <name>_ref} pair. Exactly one side
         * must be set and must name something that exists.
         *
         * @return the resolved key, or null after recording why it could not be resolved
         */
        private EntityKey resolve(EntityType entity, int i, String name, Long id, String ref,
                                  Set<Long> storedIds, Function<String, Integer> batchLookup) {
            String idField = name + "_id";
            String refField = name + "_ref";
            if (id != null && ref != null) {
                fail(entity, i, refField, "give either " + idField + " or " + refField + ", not both");
                return null;
            }
            if (id == null && ref == null) {
                fail(entity, i, idField, "must not be null (or give " + refField + ")");
                return null;
            }
            if (id != null) {
                if (!storedIds.contains(id)) {
                    fail(entity, i, idField, "not found");
                    return null;
                }
                return EntityKey.stored(id);
            }
            Integer batchIndex = batchLookup.apply(ref);
            if (batchIndex == null) {
                fail(entity, i, refField, "not found");
                return null;
            }
            return EntityKey.batch(batchIndex);
        }

        private void reportRepeatedSlots(EntityType entity, Map<SiblingSlot, List<Integer>> slots, String parentName) {
            slots.forEach((slot, indexes) -> {
                if (indexes.size() < 2) {
                    return;
                }
                for (Integer i : indexes) {
                    fail(entity, i, "display_order", "display_order " + slot.displayOrder()
                            + " is repeated within the same " + parentName + " (records " + indexes + ")");
                }
            });
        }

        private void required(EntityType entity, int i, String field, String value, int max) {
            if (isBlank(value)) {
                fail(entity, i, field, "must not be blank");
            } else {
                maxLength(entity, i, field, value, max);
            }
        }

        private void nullRecord(EntityType entity, int i) {
            fail(entity, i, "record", "must not be null");
        }

        private void fail(EntityType entity, int i, String field, String reason) {
            errors.add(LoadError.validation(entity, i, field, reason));
        }

        private void conflict(EntityType entity, int i, String field, String reason) {
            errors.add(LoadError.store(entity, i, field, reason));
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}
