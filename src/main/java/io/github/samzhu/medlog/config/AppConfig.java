package io.github.samzhu.medlog.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link MedlogProperties} 的型別安全配置綁定，
 * 並提供服務共用的 {@link Clock}（UTC），測試時可替換為固定時鐘。
 *
 * @see MedlogProperties
 */
@Configuration
@EnableConfigurationProperties(MedlogProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
