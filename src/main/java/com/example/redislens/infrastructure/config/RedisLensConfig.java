package com.example.redislens.infrastructure.config;

import com.example.redislens.domain.catalog.CatalogSettings;
import com.example.redislens.domain.catalog.KeyCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 도메인 객체 빈 등록
 */
@Configuration
public class RedisLensConfig {

    @Bean
    public KeyCatalog keyCatalog(RedisLensProperties properties) {
        RedisLensProperties.Catalog catalog = properties.getCatalog();
        return new KeyCatalog(CatalogSettings.defaults()
                .scanThreshold(catalog.getScanThreshold())
                .scanBatchSize(catalog.getScanBatchSize())
                .maxScanIterations(catalog.getMaxScanIterations()));
    }
}
