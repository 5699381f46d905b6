package com.glowup.backend.service;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

@Service
public class FileStorageService {

    private static final Logger log = LoggerFactory.getLogger(FileStorageService.class);

    static final String DEFAULT_EXTENSION = "jpg";

    private final Path uploadDir;

    public FileStorageService(@Value("${glowup.upload-dir:uploads}") String uploadDir) {
        this.uploadDir = Path.of(uploadDir).toAbsolutePath().normalize();
    }

    @PostConstruct
    public void init() throws IOException {
        Files.createDirectories(uploadDir);
        log.info("Serving uploads from {}", uploadDir);
    }

    public Path getUploadDir() {
        return uploadDir;
    }

    /**
     * Text after the last dot of the client file name, or "jpg" when there is no dot.
     * Nothing is sniffed, so a wrong extension is kept as-is.
     */
    public static String extensionOf(String originalFilename) {
        if (originalFilename == null || !originalFilename.contains(".")) {
            return DEFAULT_EXTENSION;
        }
        return originalFilename.substring(originalFilename.lastIndexOf('.') + 1);
    }

    public String store(String baseName, MultipartFile file) throws IOException {
        String filename = baseName + "." + extensionOf(file.getOriginalFilename());
        Path target = uploadDir.resolve(filename);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Stored upload {} ({} bytes)", filename, file.getSize());
        return filename;
    }

    /**
     * Resolves a stored file, refusing names that point outside the upload directory.
     */
    public Optional<Path> find(String filename) {
        if (filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        Path path = uploadDir.resolve(filename).normalize();
        if (!path.startsWith(uploadDir) || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(path);
    }

    /**
     * Removes a stored file. A file that is already gone is not an error.
     */
    public boolean delete(String filename) throws IOException {
        Optional<Path> path = find(filename);
        if (path.isEmpty()) {
            log.debug("Upload {} already missing, nothing to remove", filename);
            return false;
        }
        return Files.deleteIfExists(path.get());
    }
}
