package com.registration.API;

import com.registration.config.RegistrationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

@Configuration
@EnableConfigurationProperties(RegistrationProperties.class)
public class StaticResourceConfig implements WebMvcConfigurer {

    private final RegistrationProperties properties;

    public StaticResourceConfig(RegistrationProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        // Serve kết quả tại /outputs/** -> từ thư mục workspace
        registry.addResourceHandler("/outputs/**")
                .addResourceLocations(Paths.get(properties.getWorkspace()).toAbsolutePath().normalize().toUri().toString());
    }
}
