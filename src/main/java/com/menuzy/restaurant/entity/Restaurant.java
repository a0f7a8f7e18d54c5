package com.menuzy.restaurant.entity;

import com.menuzy.user.entity.User;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "restaurants", indexes = {
        @Index(name = "idx_restaurants_location", columnList = "latitude, longitude"),
        @Index(name = "idx_restaurants_category", columnList = "category_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Restaurant {

    public static final int NAME_LENGTH = 255;
    public static final int DESCRIPTION_LENGTH = 2000;
    public static final int ADDRESS_LENGTH = 255;
    public static final int PHONE_LENGTH = 20;
    public static final int EMAIL_LENGTH = 255;
    public static final int IMAGE_URL_LENGTH = 500;
    // Length of the serialized JSON, not of the map.
    public static final int OPENING_HOURS_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = NAME_LENGTH)
    private String name;

    @Column(length = DESCRIPTION_LENGTH)
    private String description;

    @Column(nullable = false, length = ADDRESS_LENGTH)
    private String address;

    private Double latitude;

    private Double longitude;

    @Column(length = PHONE_LENGTH)
    private String phone;

    @Column(length = EMAIL_LENGTH)
    private String email;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    /**
     * Always a restaurant_admin or super_admin; checked before insert.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_id", nullable = false)
    private User owner;

    @Column(name = "image_url", length = IMAGE_URL_LENGTH)
    private String imageUrl;

    @Convert(converter = OpeningHoursConverter.class)
    @Column(name = "opening_hours", length = OPENING_HOURS_LENGTH)
    private Map<String, String> openingHours = new LinkedHashMap<>();

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(nullable = false, precision = 3, scale = 2)
    private BigDecimal rating;

    @Column(name = "total_reviews", nullable = false)
    private int totalReviews;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public Restaurant(String name, String description, String address, Double latitude, Double longitude,
                      String phone, String email, Category category, User owner, String imageUrl,
                      Map<String, String> openingHours) {
        this.name = name;
        this.description = description;
        this.address = address;
        this.latitude = latitude;
        this.longitude = longitude;
        this.phone = phone;
        this.email = email;
        this.category = category;
        this.owner = owner;
        this.imageUrl = imageUrl;
        if (openingHours != null) {
            this.openingHours = new LinkedHashMap<>(openingHours);
        }
        this.active = true;
        this.rating = BigDecimal.ZERO;
        this.totalReviews = 0;
    }
}
