package com.menuzy.user.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.Locale;

@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class User {

    public static final int EMAIL_LENGTH = 255;
    public static final int FULL_NAME_LENGTH = 255;
    public static final int PHONE_LENGTH = 20;
    public static final int PASSWORD_HASH_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Always stored trimmed and lower-cased, so the unique constraint is
     * effectively case-insensitive.
     */
    @Column(nullable = false, unique = true, length = EMAIL_LENGTH)
    private String email;

    @Column(name = "full_name", nullable = false, length = FULL_NAME_LENGTH)
    private String fullName;

    @Column(length = PHONE_LENGTH)
    private String phone;

    @Convert(converter = UserRoleConverter.class)
    @Column(nullable = false, length = 20)
    private UserRole role;

    // Opaque value supplied by the caller; never hashed or checked here.
    @Column(name = "password_hash", length = PASSWORD_HASH_LENGTH)
    private String passwordHash;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public User(String email, String fullName, String phone, UserRole role, String passwordHash) {
        this.email = normalizeEmail(email);
        this.fullName = fullName;
        this.phone = phone;
        this.role = role == null ? UserRole.CUSTOMER : role;
        this.passwordHash = passwordHash;
        this.active = true;
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
