package com.menuzy.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.menuzy.user.entity.User;
import com.menuzy.user.entity.UserRole;

import java.time.LocalDateTime;

// No password hash here.
public record UserResponse(Long id, String email, String fullName, String phone,
                           UserRole role, @JsonProperty("is_active") boolean active, LocalDateTime createdAt) {

    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getEmail(), user.getFullName(),
                user.getPhone(), user.getRole(), user.isActive(), user.getCreatedAt());
    }
}
