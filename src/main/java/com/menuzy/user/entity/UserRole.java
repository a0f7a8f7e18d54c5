package com.menuzy.user.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Platform role, stored and serialized in its lower-case form ({@code restaurant_admin}).
 */
@Getter
@RequiredArgsConstructor
public enum UserRole {

    CUSTOMER("customer"),
    RESTAURANT_ADMIN("restaurant_admin"),
    SUPER_ADMIN("super_admin");

    @JsonValue
    private final String value;

    /** Only admins may own a restaurant. */
    public boolean canOwnRestaurant() {
        return this == RESTAURANT_ADMIN || this == SUPER_ADMIN;
    }

    public static Optional<UserRole> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(role -> role.value.equals(value))
                .findFirst();
    }
}
