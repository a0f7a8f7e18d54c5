package com.menuzy.catalog.dto;

import lombok.Builder;

/**
 * A user to create. {@code role} stays a plain string so an unknown value is
 * reported as a validation error instead of failing JSON parsing.
 */
@Builder(toBuilder = true)
public record UserRecord(
        String ref,
        String email,
        String fullName,
        String phone,
        String role,
        String passwordHash
) {
}
