package com.crescent.gateway.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApplicationConfigTest {

    private static PropertySource<?> applicationYaml() throws Exception {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        assertEquals(1, sources.size());
        return sources.get(0);
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    @Test
    void shouldLoadRouteSchemaAtStartup() throws Exception {
        PropertySource<?> yaml = applicationYaml();

        assertEquals("classpath:db/schema.sql", text(yaml.getProperty("spring.sql.init.schema-locations")));
        assertEquals("${DB_INIT_MODE:always}", text(yaml.getProperty("spring.sql.init.mode")));

        Resource schema = new ClassPathResource("db/schema.sql");
        assertTrue(schema.exists());
        String ddl = StreamUtils.copyToString(schema.getInputStream(), StandardCharsets.UTF_8);
        assertTrue(ddl.contains("CREATE TABLE IF NOT EXISTS"), "schema must be safe to re-run on every start");
    }

    @Test
    void shouldShipQuotaDisabledByDefault() throws Exception {
        PropertySource<?> yaml = applicationYaml();

        assertEquals("false", text(yaml.getProperty("gateway.quota.enabled")));
        assertEquals("daily", text(yaml.getProperty("gateway.quota.reset-period")));
    }
}
