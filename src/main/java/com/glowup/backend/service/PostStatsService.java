package com.glowup.backend.service;

import com.glowup.backend.repository.RatingRepository;
import com.glowup.backend.repository.ReactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregates ratings and reactions for a post. Nothing is cached; every call queries.
 */
@Service
@RequiredArgsConstructor
public class PostStatsService {

    private final RatingRepository ratingRepository;
    private final ReactionRepository reactionRepository;

    @Transactional(readOnly = true)
    public Map<String, Object> statsFor(String postId) {
        RatingRepository.RatingSummary summary = ratingRepository.summarizeByPostId(postId);
        Double average = summary != null ? summary.getAverage() : null;
        Long total = summary != null && summary.getTotal() != null ? summary.getTotal() : 0L;

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("avg_rating", roundAverage(average));
        stats.put("total_ratings", total);
        stats.put("reactions", reactionCounts(postId));
        return stats;
    }

    @Transactional(readOnly = true)
    public Map<String, Long> reactionCounts(String postId) {
        Map<String, Long> counts = new LinkedHashMap<>();
        reactionRepository.countByEmojiForPost(postId)
                .forEach(row -> counts.put(row.getEmoji(), row.getOccurrences()));
        return counts;
    }

    // Rounds the exact binary value of the double, so 167/20 (8.3499...) becomes 8.3
    static Double roundAverage(Double average) {
        if (average == null) {
            return null;
        }
        return new BigDecimal(average).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }
}
