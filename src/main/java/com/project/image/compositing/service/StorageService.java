package com.project.image.compositing.service;

import com.project.image.compositing.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Keeps uploaded cutouts and rendered photos on disk, in two sibling folders under {@code app.upload.dir}.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    static final String CUTOUTS = "cutouts";
    static final String PHOTOS = "photos";

    private final Path rootDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(rootDir.resolve(CUTOUTS));
            Files.createDirectories(rootDir.resolve(PHOTOS));
            log.info("Using upload directory: {}", rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public Path rootDir() {
        return rootDir;
    }

    public StoredFile storeCutout(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "cutout" : file.getOriginalFilename());
        String filename = uniquePrefix() + "_" + original.replaceAll("[^a-zA-Z0-9._-]", "_");
        Path target = rootDir.resolve(CUTOUTS).resolve(filename);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to store cutout", e);
        }
        log.debug("Stored cutout {}", target);
        return new StoredFile(target, filename, "uploads/" + CUTOUTS + "/" + filename);
    }

    public StoredFile storePhoto(byte[] pngBytes) {
        String filename = uniquePrefix() + "_photo.png";
        Path target = rootDir.resolve(PHOTOS).resolve(filename);
        try {
            Files.write(target, pngBytes);
        } catch (IOException e) {
            throw new StorageException("Failed to store rendered photo", e);
        }
        log.debug("Stored photo {}", target);
        return new StoredFile(target, filename, "uploads/" + PHOTOS + "/" + filename);
    }

    private static String uniquePrefix() {
        return STAMP.format(LocalDateTime.now()) + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
