package com.glowup.backend.controller;

import com.glowup.backend.service.FitService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/fits")
@RequiredArgsConstructor
public class FitController {

    private final FitService fitService;

    @Value("${glowup.public-base-url:http://localhost:8000}")
    private String publicBaseUrl;

    /**
     * POST /fits
     * Upload a new fit (multipart form)
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> createPost(
            @RequestParam("username") String username,
            @RequestParam(value = "caption", required = false) String caption,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "pin", required = false) String pin,
            @RequestPart("image") MultipartFile image) throws IOException {
        return ResponseEntity.ok(fitService.createPost(username, caption, category, pin, image));
    }

    /**
     * GET /fits
     * All posts, newest first, with stats
     */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> getPosts(
            @RequestParam(value = "request_base", required = false) String requestBase) {
        return ResponseEntity.ok(fitService.listPosts(baseUrl(requestBase)));
    }

    /**
     * GET /fits/{token}
     * Lookup by share token or post id
     */
    @GetMapping("/{token}")
    public ResponseEntity<Map<String, Object>> getPost(
            @PathVariable String token,
            @RequestParam(value = "request_base", required = false) String requestBase) {
        return ResponseEntity.ok(fitService.getPost(token, baseUrl(requestBase)));
    }

    @PostMapping("/{token}/rate")
    public ResponseEntity<Map<String, Object>> ratePost(
            @PathVariable String token,
            @RequestParam("score") int score,
            @RequestParam(value = "rater_name", required = false) String raterName) {
        return ResponseEntity.ok(fitService.ratePost(token, score, raterName));
    }

    @PostMapping("/{token}/react")
    public ResponseEntity<Map<String, Object>> reactToPost(
            @PathVariable String token,
            @RequestParam("emoji") String emoji) {
        return ResponseEntity.ok(fitService.reactToPost(token, emoji));
    }

    /**
     * DELETE /fits/{token}
     * PIN is only checked when one was set at upload time
     */
    @DeleteMapping("/{token}")
    public ResponseEntity<Map<String, Object>> deletePost(
            @PathVariable String token,
            @RequestParam(value = "pin", required = false) String pin) throws IOException {
        return ResponseEntity.ok(fitService.deletePost(token, pin));
    }

    private String baseUrl(String requestBase) {
        return requestBase != null ? requestBase : publicBaseUrl;
    }
}
