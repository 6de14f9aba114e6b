package dev.smellscope.aggregation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.smellscope.domain.enums.SmellCategory;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Read-only mapping from backend-specific smell labels to canonical
 * categories. Labels are compared after {@link SmellCategory#normalize}, so
 * "Long Method", "long_method" and "LONG-METHOD" are the same key.
 *
 * <p>Lookup order: explicit alias, then a direct match on a category name,
 * then {@link SmellCategory#UNKNOWN}. Built once and shared across requests.
 */
public final class CategoryTable {

    private final Map<String, SmellCategory> aliases;

    private CategoryTable(Map<String, SmellCategory> aliases) {
        this.aliases = Map.copyOf(aliases);
    }

    /**
     * @param aliases label → category display name (or enum constant)
     * @throws IllegalArgumentException if an alias names no known category
     */
    public static CategoryTable of(Map<String, String> aliases) {
        Map<String, SmellCategory> resolved = new HashMap<>();
        aliases.forEach((label, categoryName) -> {
            SmellCategory category = SmellCategory.fromName(categoryName)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Alias '%s' points at unknown category '%s'".formatted(label, categoryName)));
            String key = SmellCategory.normalize(label);
            if (!key.isEmpty()) resolved.put(key, category);
        });
        return new CategoryTable(resolved);
    }

    public static CategoryTable empty() {
        return new CategoryTable(Map.of());
    }

    /**
     * Reads a {@code {"aliases": {"<label>": "<Category>"}}} document.
     */
    public static CategoryTable read(InputStream in, ObjectMapper mapper) throws IOException {
        TableDocument doc = mapper.readValue(in, TableDocument.class);
        return of(doc.aliases() == null ? Map.of() : doc.aliases());
    }

    public SmellCategory categorize(String label) {
        String key = SmellCategory.normalize(label);
        if (key.isEmpty()) return SmellCategory.UNKNOWN;
        SmellCategory aliased = aliases.get(key);
        if (aliased != null) return aliased;
        return SmellCategory.fromName(key).orElse(SmellCategory.UNKNOWN);
    }

    public int aliasCount() {
        return aliases.size();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TableDocument(Map<String, String> aliases) {}
}
