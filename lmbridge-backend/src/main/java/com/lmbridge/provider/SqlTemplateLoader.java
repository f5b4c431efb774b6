package com.lmbridge.provider;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads SQL templates from {@code classpath:sql/}. Templates are read once and cached.
 */
@Component
public class SqlTemplateLoader {

    private static final String BASE_PATH = "sql/";

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    /**
     * Get a template's SQL text.
     *
     * @param sqlFile template file name, e.g. {@code release_group_by_id.sql}
     * @return SQL text
     * @throws IllegalArgumentException if the name is invalid or no such template exists
     */
    public String load(String sqlFile) {
        if (sqlFile == null || sqlFile.isBlank() || sqlFile.contains("/") || sqlFile.contains("\\") || sqlFile.contains("..")) {
            throw new IllegalArgumentException("Invalid SQL template name: " + sqlFile);
        }
        return templates.computeIfAbsent(sqlFile, this::read);
    }

    private String read(String sqlFile) {
        ClassPathResource resource = new ClassPathResource(BASE_PATH + sqlFile);
        if (!resource.exists()) {
            throw new IllegalArgumentException("SQL template not found: " + sqlFile);
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read SQL template: " + sqlFile, e);
        }
    }
}
