package dev.smellscope.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.smellscope.aggregation.CategoryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the label lookup table once at startup. A missing or invalid table
 * fails the context rather than silently mapping everything to Unknown.
 */
@Configuration
public class CategoryTableConfig {

    private static final Logger log = LoggerFactory.getLogger(CategoryTableConfig.class);

    @Bean
    public CategoryTable categoryTable(AggregationProperties properties, ResourceLoader resourceLoader,
                                       ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(properties.categoryTable());
        try (InputStream in = resource.getInputStream()) {
            CategoryTable table = CategoryTable.read(in, objectMapper);
            log.info("Loaded {} smell label aliases from {}", table.aliasCount(), properties.categoryTable());
            return table;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load category table from " + properties.categoryTable(), e);
        }
    }
}
