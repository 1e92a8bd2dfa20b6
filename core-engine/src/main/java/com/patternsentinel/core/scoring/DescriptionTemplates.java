package com.patternsentinel.core.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Locale-specific description templates keyed by description key.
 *
 * <p>
 * Loaded from YAML documents of the form:
 * </p>
 *
 * <pre>
 * locale: en
 * templates:
 *   spike.up: "Sudden spike in {entity_short}: {value:%.1f}"
 *   default: "Anomaly in {entity_short}: {value:%.1f}"
 * </pre>
 *
 * <p>
 * A {@value #DEFAULT_KEY} template is required; it is used for keys without
 * a template of their own.
 * </p>
 *
 * @since 1.0.0
 */
public final class DescriptionTemplates {

    private static final Logger LOG = LoggerFactory.getLogger(DescriptionTemplates.class);

    public static final String DEFAULT_KEY = "default";

    private final Locale locale;
    private final Map<String, String> templates;

    /**
     * @param locale    locale of the template texts
     * @param templates key to template; must contain {@value #DEFAULT_KEY}
     * @throws IllegalArgumentException if the default template is missing
     */
    public DescriptionTemplates(Locale locale, Map<String, String> templates) {
        this.locale = Objects.requireNonNull(locale, "locale must not be null");
        Objects.requireNonNull(templates, "templates must not be null");
        if (!templates.containsKey(DEFAULT_KEY)) {
            throw new IllegalArgumentException(
                    "Description templates for " + locale + " lack a '" + DEFAULT_KEY + "' entry");
        }
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    /**
     * Load templates from a classpath resource.
     *
     * @param resource classpath resource name, e.g. {@code descriptions/en.yml}
     * @return the loaded templates
     * @throws IllegalArgumentException if the resource does not exist or is
     *                                  malformed
     * @throws IllegalStateException    if reading fails
     */
    public static DescriptionTemplates fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DescriptionTemplates.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(resource, is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * @return English templates bundled with the engine
     */
    public static DescriptionTemplates english() {
        return fromClasspath("descriptions/en.yml");
    }

    /**
     * @return German templates bundled with the engine
     */
    public static DescriptionTemplates german() {
        return fromClasspath("descriptions/de.yml");
    }

    /**
     * @param key description key
     * @return the template for {@code key}, or the default template
     */
    public String templateFor(String key) {
        return find(key).orElse(templates.get(DEFAULT_KEY));
    }

    public Optional<String> find(String key) {
        return Optional.ofNullable(key == null ? null : templates.get(key));
    }

    public Locale getLocale() {
        return locale;
    }

    public Map<String, String> getTemplates() {
        return templates;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DescriptionTemplates parse(String source, InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Object doc = new Yaml(options).load(is);
        if (!(doc instanceof Map<?, ?> root)) {
            throw new IllegalArgumentException("Template document " + source + " is not a mapping");
        }
        Object rawLocale = root.get("locale");
        Object rawTemplates = root.get("templates");
        if (!(rawTemplates instanceof Map<?, ?> entries)) {
            throw new IllegalArgumentException("Template document " + source
                    + " has no 'templates' mapping");
        }
        Map<String, String> templates = new LinkedHashMap<>();
        entries.forEach((k, v) -> templates.put(String.valueOf(k), String.valueOf(v)));
        Locale locale = rawLocale == null ? Locale.ROOT : Locale.forLanguageTag(rawLocale.toString());
        LOG.info("Loaded {} description template(s) for locale '{}' from {}",
                templates.size(), locale.toLanguageTag(), source);
        return new DescriptionTemplates(locale, templates);
    }
}
