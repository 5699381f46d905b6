package com.glowup.backend.repository;

import com.glowup.backend.model.Reaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ReactionRepository extends JpaRepository<Reaction, Long> {

    interface EmojiCount {
        String getEmoji();

        Long getOccurrences();
    }

    @Query("SELECT r.emoji AS emoji, COUNT(r) AS occurrences FROM Reaction r WHERE r.post.id = :postId " +
            "GROUP BY r.emoji ORDER BY MIN(r.id)")
    List<EmojiCount> countByEmojiForPost(@Param("postId") String postId);
}
