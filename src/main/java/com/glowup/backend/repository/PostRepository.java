package com.glowup.backend.repository;

import com.glowup.backend.model.Post;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PostRepository extends JpaRepository<Post, String> {

    List<Post> findAllByOrderByCreatedAtDesc();

    // A token may be either the public share token or the raw post id
    Optional<Post> findFirstByShareTokenOrId(String shareToken, String id);

    default Optional<Post> findByToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return findFirstByShareTokenOrId(token, token);
    }
}
