package com.disease.coding.catalog;

import com.disease.coding.core.model.CodeEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Initial catalog contents, read from a JSON object keyed by canonical name.
 *
 * <pre>
 * {
 *   "Asthma": {"ICD11": "CA23", "TM2": "TM2-404"},
 *   "Fever":  {"ICD11": "MG21", "TM2": "TM2-210"}
 * }
 * </pre>
 *
 * <p>Document order becomes catalog order.</p>
 */
public final class CatalogSeed {
    private static final Logger log = LoggerFactory.getLogger(CatalogSeed.class);

    public static final String DEFAULT_RESOURCE = "diseases.json";

    static final String PRIMARY_FIELD = "ICD11";
    static final String SECONDARY_FIELD = "TM2";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, CodeEntry> entries;

    private CatalogSeed(Map<String, CodeEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Loads the bundled seed from {@value #DEFAULT_RESOURCE}.
     */
    public static CatalogSeed defaults() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads a seed from a classpath resource.
     *
     * @throws CatalogSeedException if the resource is missing or malformed
     */
    public static CatalogSeed fromResource(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = CatalogSeed.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new CatalogSeedException("Seed resource not found: " + resource);
            }
            CatalogSeed seed = fromStream(in);
            log.info("Loaded {} diseases from seed resource '{}'", seed.size(), resource);
            return seed;
        } catch (IOException e) {
            throw new CatalogSeedException("Failed to read seed resource: " + resource, e);
        }
    }

    /**
     * Parses a seed from a JSON stream. The stream is not closed.
     *
     * @throws CatalogSeedException if the content is malformed
     */
    public static CatalogSeed fromStream(InputStream in) {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new CatalogSeedException("Malformed seed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CatalogSeedException("Failed to read seed JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CatalogSeedException("Seed JSON must be an object keyed by disease name");
        }

        Map<String, CodeEntry> parsed = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (name.isBlank()) {
                throw new CatalogSeedException("Seed contains a blank disease name");
            }
            parsed.put(name, toEntry(name, field.getValue()));
        }
        return new CatalogSeed(parsed);
    }

    /**
     * Creates a seed from an in-memory map, keeping its iteration order.
     */
    public static CatalogSeed of(Map<String, CodeEntry> entries) {
        return new CatalogSeed(new LinkedHashMap<>(entries));
    }

    public Map<String, CodeEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    private static CodeEntry toEntry(String name, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new CatalogSeedException("Seed entry for '" + name + "' must be an object");
        }
        String primary = requireText(name, node, PRIMARY_FIELD);
        String secondary = requireText(name, node, SECONDARY_FIELD);
        try {
            return new CodeEntry(primary, secondary);
        } catch (IllegalArgumentException e) {
            throw new CatalogSeedException("Invalid codes for '" + name + "': " + e.getMessage(), e);
        }
    }

    private static String requireText(String name, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new CatalogSeedException("Seed entry for '" + name + "' is missing " + field);
        }
        return value.asText();
    }
}
