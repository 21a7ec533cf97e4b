package com.project.image.compositing.config;

import com.project.image.compositing.service.StorageService;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves stored cutouts and rendered photos under /uploads/**, from the directory StorageService writes to.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    private final StorageService storageService;

    public StaticResourceConfig(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations(storageService.rootDir().toUri().toString());
    }
}
