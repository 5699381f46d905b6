package com.glowup.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Entity
@Table(name = "posts", indexes = {
        @Index(name = "idx_posts_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Post {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String username;

    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private String caption = "";

    // fit, makeup, food, nails, style or other; not checked on write
    @Builder.Default
    private String category = "other";

    // Stored file name inside the upload directory, e.g. "{id}.png"
    @Column(name = "image_url", nullable = false)
    private String imageFilename;

    @Column(name = "share_token", nullable = false, unique = true, length = 8)
    private String shareToken;

    @Column(name = "pin_hash", length = 64)
    private String pinHash;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now(ZoneOffset.UTC);
}
