package com.instaharvest.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Name-to-locator mapping loaded once from a JSON store, plus the keyword sets used for
 * text-based control discovery.
 * <p>
 * Store layout:
 * <pre>
 * {
 *   "selectors": { "LOGIN_USERNAME_INPUT": "input[name='username']", ... },
 *   "keywords":  { "login": [...], "loginMatch": "SUBSTRING", "dismiss": [...], "interstitial": [...] }
 * }
 * </pre>
 * Every {@link SelectorKey} must be present and non-blank; otherwise loading fails with a
 * {@link ConfigurationException} naming the key. The {@code keywords} object is optional and
 * falls back to {@link KeywordSets#defaults()} entry by entry.
 */
public final class SelectorConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SelectorConfiguration.class);
    public static final String DEFAULT_RESOURCE = "/selectors.json";

    private final Map<SelectorKey, String> locators;
    private final KeywordSets keywords;

    public SelectorConfiguration(Map<SelectorKey, String> locators, KeywordSets keywords) {
        EnumMap<SelectorKey, String> copy = new EnumMap<>(SelectorKey.class);
        for (SelectorKey key : SelectorKey.values()) {
            String locator = locators == null ? null : locators.get(key);
            if (locator == null || locator.isBlank()) {
                throw new ConfigurationException("Missing selector '" + key.name() + "' in selector configuration.");
            }
            copy.put(key, locator.strip());
        }
        this.locators = Collections.unmodifiableMap(copy);
        this.keywords = keywords == null ? KeywordSets.defaults() : keywords;
    }

    /**
     * Loads the selector store bundled on the classpath.
     */
    public static SelectorConfiguration loadDefault() {
        try (InputStream in = SelectorConfiguration.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("Selector configuration resource " + DEFAULT_RESOURCE + " not found on classpath.");
            }
            return parse(new ObjectMapper().readTree(in), DEFAULT_RESOURCE);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Corrupt selector configuration " + DEFAULT_RESOURCE + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read selector configuration " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads a selector store from a file.
     * @param path JSON file
     * @throws ConfigurationException when the file is missing, corrupt or incomplete
     */
    public static SelectorConfiguration load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Selector configuration file not found: " + path);
        }
        try {
            return parse(new ObjectMapper().readTree(path.toFile()), path.toString());
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Corrupt selector configuration " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read selector configuration " + path, e);
        }
    }

    static SelectorConfiguration parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Selector configuration " + source + " must be a JSON object.");
        }
        JsonNode selectorsNode = root.path("selectors");
        if (!selectorsNode.isObject()) {
            throw new ConfigurationException("Selector configuration " + source + " has no 'selectors' object.");
        }
        Map<SelectorKey, String> locators = new EnumMap<>(SelectorKey.class);
        Iterator<Map.Entry<String, JsonNode>> fields = selectorsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            SelectorKey key;
            try {
                key = SelectorKey.valueOf(field.getKey());
            } catch (IllegalArgumentException e) {
                logger.debug("Ignoring unknown selector key '{}' in {}", field.getKey(), source);
                continue;
            }
            if (field.getValue().isTextual()) {
                locators.put(key, field.getValue().asText());
            }
        }
        SelectorConfiguration configuration = new SelectorConfiguration(locators, parseKeywords(root.path("keywords"), source));
        logger.info("Loaded {} selectors from {}", locators.size(), source);
        return configuration;
    }

    private static KeywordSets parseKeywords(JsonNode node, String source) {
        if (node.isMissingNode() || node.isNull()) {
            return KeywordSets.defaults();
        }
        if (!node.isObject()) {
            throw new ConfigurationException("'keywords' in " + source + " must be a JSON object.");
        }
        KeywordSets.MatchMode mode = null;
        JsonNode modeNode = node.path("loginMatch");
        if (modeNode.isTextual()) {
            try {
                mode = KeywordSets.MatchMode.valueOf(modeNode.asText().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown loginMatch '" + modeNode.asText() + "' in " + source, e);
            }
        }
        return new KeywordSets(stringList(node, "login", source), mode, stringList(node, "dismiss", source),
            stringList(node, "interstitial", source));
    }

    private static List<String> stringList(JsonNode parent, String name, String source) {
        JsonNode node = parent.path(name);
        if (node.isMissingNode() || node.isNull()) return null;
        if (!node.isArray()) {
            throw new ConfigurationException("'keywords." + name + "' in " + source + " must be an array of strings.");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual()) values.add(item.asText());
        }
        return values;
    }

    /**
     * Returns the locator registered for a logical name. Never {@code null}.
     */
    public String get(SelectorKey key) {
        String locator = locators.get(key);
        if (locator == null) {
            throw new ConfigurationException("Missing selector '" + key + "' in selector configuration.");
        }
        return locator;
    }

    public KeywordSets keywords() {
        return keywords;
    }
}
