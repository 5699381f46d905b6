package com.glowup.backend.repository;

import com.glowup.backend.model.Rating;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RatingRepository extends JpaRepository<Rating, Long> {

    interface RatingSummary {
        Double getAverage();

        Long getTotal();
    }

    @Query("SELECT AVG(r.score) AS average, COUNT(r) AS total FROM Rating r WHERE r.post.id = :postId")
    RatingSummary summarizeByPostId(@Param("postId") String postId);
}
