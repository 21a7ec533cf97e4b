package com.project.image.compositing.controller;

import com.project.image.compositing.DTOs.CompositionOptions;
import com.project.image.compositing.DTOs.CompositionResult;
import com.project.image.compositing.DTOs.PhotoResponse;
import com.project.image.compositing.config.CompositingProperties;
import com.project.image.compositing.model.RasterImage;
import com.project.image.compositing.model.RgbColor;
import com.project.image.compositing.model.Size;
import com.project.image.compositing.service.ImageCodec;
import com.project.image.compositing.service.ProductPhotoService;
import com.project.image.compositing.service.StorageService;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * Renders uploaded cutouts (RGBA images whose alpha marks the product) into product photos.
 */
@RestController
@RequestMapping("/api/photos")
@Validated
public class PhotoController {
    private static final Logger log = LoggerFactory.getLogger(PhotoController.class);

    // formats ImageIO can read out of the box
    private static final List<String> SUPPORTED_FORMATS = List.of(
            "image/png", "image/gif", "image/bmp", "image/jpeg", "image/jpg"
    );
    private static final long MAX_UPLOAD_BYTES = 10L * 1024 * 1024;

    private final ProductPhotoService productPhotoService;
    private final ImageCodec imageCodec;
    private final StorageService storageService;
    private final CompositingProperties defaults;

    public PhotoController(ProductPhotoService productPhotoService, ImageCodec imageCodec,
                           StorageService storageService, CompositingProperties defaults) {
        this.productPhotoService = productPhotoService;
        this.imageCodec = imageCodec;
        this.storageService = storageService;
        this.defaults = defaults;
    }

    @PostMapping(value = "/render", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> render(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "background", required = false) String background,
            @RequestParam(name = "padding", required = false)
            @DecimalMin(value = "0.0", message = "Padding cannot be negative")
            @DecimalMax(value = "0.5", inclusive = false, message = "Padding must be below 0.5")
            Double padding,
            @RequestParam(name = "shadow", required = false) Boolean shadow,
            @RequestParam(name = "width", required = false)
            @Min(value = 16, message = "Width must be at least 16 pixels")
            @Max(value = 4000, message = "Width cannot exceed 4000 pixels")
            Integer width,
            @RequestParam(name = "height", required = false)
            @Min(value = 16, message = "Height must be at least 16 pixels")
            @Max(value = 4000, message = "Height cannot exceed 4000 pixels")
            Integer height
    ) throws IOException {
        validateUploadedFile(file);
        CompositionOptions options = resolveOptions(background, padding, shadow, width, height);
        log.info("Rendering {} ({}KB)", file.getOriginalFilename(), file.getSize() / 1024);

        RasterImage cutout = imageCodec.decode(file.getBytes());
        byte[] png = imageCodec.toPng(productPhotoService.render(cutout, options));

        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .body(png);
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public PhotoResponse create(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "background", required = false) String background,
            @RequestParam(name = "padding", required = false)
            @DecimalMin(value = "0.0", message = "Padding cannot be negative")
            @DecimalMax(value = "0.5", inclusive = false, message = "Padding must be below 0.5")
            Double padding,
            @RequestParam(name = "shadow", required = false) Boolean shadow,
            @RequestParam(name = "width", required = false)
            @Min(value = 16, message = "Width must be at least 16 pixels")
            @Max(value = 4000, message = "Width cannot exceed 4000 pixels")
            Integer width,
            @RequestParam(name = "height", required = false)
            @Min(value = 16, message = "Height must be at least 16 pixels")
            @Max(value = 4000, message = "Height cannot exceed 4000 pixels")
            Integer height
    ) throws IOException {
        validateUploadedFile(file);
        CompositionOptions options = resolveOptions(background, padding, shadow, width, height);

        RasterImage cutout = imageCodec.decode(file.getBytes());
        CompositionResult result = productPhotoService.process(cutout, options);

        var storedCutout = storageService.storeCutout(file);
        var storedPhoto = storageService.storePhoto(imageCodec.toPng(result.image()));
        log.info("Stored photo {} for cutout {}", storedPhoto.filename(), storedCutout.filename());

        return new PhotoResponse(
                "/" + storedCutout.relativeWebPath(),
                "/" + storedPhoto.relativeWebPath(),
                result.image().width(),
                result.image().height(),
                options.backgroundColor(),
                result.contentBox(),
                result.placement(),
                result.shadowApplied()
        );
    }

    // colour is checked here so a bad value is rejected before the upload is decoded
    private CompositionOptions resolveOptions(String background, Double padding, Boolean shadow,
                                              Integer width, Integer height) {
        CompositionOptions options = defaults.toOptions();
        if (background != null) {
            options = options.withBackgroundColor(background);
        }
        if (padding != null) {
            options = options.withPadding(padding);
        }
        if (shadow != null) {
            options = options.withShadow(shadow);
        }
        RgbColor.parseHex(options.backgroundColor());
        if (width != null || height != null) {
            options = options.withOutputSize(new Size(
                    width != null ? width : options.outputSize().width(),
                    height != null ? height : options.outputSize().height()));
        }
        return options;
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a cutout image to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file format: " + contentType + ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS));
        }
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File is too large. Maximum size: 10MB");
        }
    }
}
