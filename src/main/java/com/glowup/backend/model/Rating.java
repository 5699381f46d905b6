package com.glowup.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Entity
@Table(name = "ratings", indexes = {
        @Index(name = "idx_ratings_post_id", columnList = "post_id")
})
@Check(constraints = "score BETWEEN 1 AND 10")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Rating {

    public static final String DEFAULT_RATER = "Anonymous";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "post_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JsonIgnore
    @ToString.Exclude
    private Post post;

    @Column(name = "rater_name")
    @Builder.Default
    private String raterName = DEFAULT_RATER;

    @Column(nullable = false)
    private Integer score;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now(ZoneOffset.UTC);
}
