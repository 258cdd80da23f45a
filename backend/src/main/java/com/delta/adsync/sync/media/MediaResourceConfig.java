package com.delta.adsync.sync.media;

import com.delta.adsync.config.AdSyncProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/** Serves the cached media directory under {@code /media/**}. */
@Configuration
public class MediaResourceConfig implements WebMvcConfigurer {
    private final AdSyncProperties properties;

    public MediaResourceConfig(AdSyncProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Path.of(properties.getMedia().getStorageRoot()).toAbsolutePath().normalize().toUri().toString();
        registry.addResourceHandler("/media/**")
            .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
