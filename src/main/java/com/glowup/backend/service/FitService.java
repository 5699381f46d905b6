package com.glowup.backend.service;

import com.glowup.backend.model.Post;
import com.glowup.backend.model.Rating;
import com.glowup.backend.model.Reaction;
import com.glowup.backend.repository.PostRepository;
import com.glowup.backend.repository.RatingRepository;
import com.glowup.backend.repository.ReactionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class FitService {

    private static final Logger log = LoggerFactory.getLogger(FitService.class);

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 10;
    static final int SHARE_TOKEN_LENGTH = 8;

    private final PostRepository postRepository;
    private final RatingRepository ratingRepository;
    private final ReactionRepository reactionRepository;
    private final PostStatsService postStatsService;
    private final FileStorageService fileStorageService;

    /**
     * Writes the image first and the row second. The two steps are not atomic: a failure
     * in between leaves an orphaned file.
     */
    public Map<String, Object> createPost(String username, String caption, String category, String pin,
            MultipartFile image) throws IOException {
        if (username == null || username.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "username is required");
        }
        if (image == null || image.getContentType() == null || !image.getContentType().startsWith("image/")) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "File must be an image");
        }

        String postId = UUID.randomUUID().toString();
        String shareToken = UUID.randomUUID().toString().substring(0, SHARE_TOKEN_LENGTH);
        String filename = fileStorageService.store(postId, image);

        Post post = Post.builder()
                .id(postId)
                .username(username)
                .caption(caption != null ? caption : "")
                .category(category != null && !category.isEmpty() ? category : "other")
                .imageFilename(filename)
                .shareToken(shareToken)
                .pinHash(pin != null && !pin.isEmpty() ? PinHasher.hash(pin) : null)
                .build();
        postRepository.save(post);
        log.info("Created post {} by {} (share token {}, pin={})", postId, username, shareToken,
                post.getPinHash() != null);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", postId);
        result.put("share_token", shareToken);
        result.put("share_url", "/rate/" + shareToken);
        return result;
    }

    @Transactional(readOnly = true)
    public List<Map<String, Object>> listPosts(String baseUrl) {
        return postRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(post -> toDto(post, baseUrl))
                .toList();
    }

    @Transactional(readOnly = true)
    public Map<String, Object> getPost(String token, String baseUrl) {
        return toDto(resolve(token), baseUrl);
    }

    @Transactional
    public Map<String, Object> ratePost(String token, int score, String raterName) {
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Score must be 1-10");
        }
        Post post = resolve(token);

        ratingRepository.save(Rating.builder()
                .post(post)
                .raterName(raterName != null ? raterName : Rating.DEFAULT_RATER)
                .score(score)
                .build());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Rated! ✨");
        result.putAll(postStatsService.statsFor(post.getId()));
        return result;
    }

    @Transactional
    public Map<String, Object> reactToPost(String token, String emoji) {
        Post post = resolve(token);

        reactionRepository.save(Reaction.builder()
                .post(post)
                .emoji(emoji)
                .build());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Reacted!");
        result.put("reactions", postStatsService.reactionCounts(post.getId()));
        return result;
    }

    /**
     * Ratings and reactions go with the post through the cascading foreign keys.
     */
    @Transactional
    public Map<String, Object> deletePost(String token, String pin) throws IOException {
        Post post = resolve(token);

        if (post.getPinHash() != null && !PinHasher.matches(pin, post.getPinHash())) {
            log.warn("Rejected delete of post {}: PIN mismatch", post.getId());
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Invalid PIN");
        }

        fileStorageService.delete(post.getImageFilename());
        postRepository.delete(post);
        log.info("Deleted post {}", post.getId());

        return Map.of("message", "Post deleted ✨");
    }

    private Post resolve(String token) {
        return postRepository.findByToken(token)
                .orElseThrow(() -> {
                    log.warn("No post for token {}", token);
                    return new ResponseStatusException(HttpStatus.NOT_FOUND, "Post not found");
                });
    }

    private Map<String, Object> toDto(Post post, String baseUrl) {
        Map<String, Object> dto = new LinkedHashMap<>();
        dto.put("id", post.getId());
        dto.put("username", post.getUsername());
        dto.put("caption", post.getCaption());
        dto.put("category", post.getCategory());
        dto.put("image_url", baseUrl + "/uploads/" + post.getImageFilename());
        dto.put("share_token", post.getShareToken());
        dto.put("created_at", post.getCreatedAt());
        dto.putAll(postStatsService.statsFor(post.getId()));
        return dto;
    }
}
