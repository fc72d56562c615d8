package com.frogolio.frogol.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Serves stored avatar files under the image URL prefix
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    @Value("${frogolio.images.dir:static/avatars}")
    private String imageDir;

    @Value("${frogolio.images.url-prefix:/static/avatars}")
    private String urlPrefix;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Paths.get(imageDir).toAbsolutePath().normalize().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        String prefix = urlPrefix.endsWith("/") ? urlPrefix : urlPrefix + "/";
        registry.addResourceHandler(prefix + "**").addResourceLocations(location);
    }
}
