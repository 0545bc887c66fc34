package io.github.samzhu.medlog.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 前端跨來源 (CORS) 設定。
 *
 * <p>允許來源由 {@code medlog.cors.allowed-origins} 提供（環境變數 {@code ALLOWED_ORIGINS}，
 * 逗號分隔）。使用 origin pattern 以便 {@code *} 可與 credentials 並用。
 */
@Configuration
public class WebCorsConfig implements WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebCorsConfig.class);

    private final MedlogProperties properties;

    public WebCorsConfig(MedlogProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = properties.cors().allowedOrigins().stream()
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toArray(String[]::new);

        registry.addMapping("/**")
            .allowedOriginPatterns(origins)
            .allowedMethods("GET", "POST", "OPTIONS")
            .allowedHeaders("Content-Type", "Authorization")
            .allowCredentials(true);

        log.info("CORS configured: allowedOrigins={}", String.join(",", origins));
    }
}
