package com.patternsentinel.core.scoring;

import com.patternsentinel.core.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.IllegalFormatException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link AnomalyDescriber} that fills a locale's {@link DescriptionTemplates}.
 *
 * <h3>Placeholders</h3>
 * <p>
 * {@code {name}} inserts a value as text, {@code {name:%.1f}} formats it with
 * {@link String#format(java.util.Locale, String, Object...)} in the template
 * locale. Available names:
 * </p>
 * <ul>
 * <li>{@code entity}, {@code entity_short} (part after the last dot)</li>
 * <li>{@code value}, {@code expected}, {@code deviation_pct}, {@code score},
 * {@code severity}, {@code type}</li>
 * <li>every entry of the anomaly context's template values</li>
 * </ul>
 * <p>
 * {@link DayOfWeek} values are rendered as full weekday names in the template
 * locale. Unknown placeholders are left as they are.
 * </p>
 *
 * @since 1.0.0
 */
public class TemplateDescriber implements AnomalyDescriber {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateDescriber.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)(?::([^}]+))?}");

    private final DescriptionTemplates templates;

    public TemplateDescriber(DescriptionTemplates templates) {
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
    }

    @Override
    public String describe(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        return render(templates.templateFor(anomaly.getDescriptionKey()), values(anomaly));
    }

    public DescriptionTemplates getTemplates() {
        return templates;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Map<String, Object> values(Anomaly anomaly) {
        Map<String, Object> v = new LinkedHashMap<>();
        String entity = anomaly.getEntityId();
        v.put("entity", entity);
        v.put("entity_short", shortName(entity));
        v.put("value", anomaly.getValue());
        v.put("expected", anomaly.getExpectedValue());
        v.put("deviation_pct", anomaly.getDeviationPct());
        v.put("score", anomaly.getScore());
        v.put("severity", anomaly.getSeverity().id());
        v.put("type", anomaly.getType().id());
        v.putAll(anomaly.getContext().toTemplateValues());
        return v;
    }

    static String shortName(String entityId) {
        int dot = entityId.lastIndexOf('.');
        return dot >= 0 && entityId.indexOf(" <-> ") < 0 ? entityId.substring(dot + 1) : entityId;
    }

    private String render(String template, Map<String, Object> values) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            String format = m.group(2);
            String replacement = values.containsKey(name)
                    ? format(name, values.get(name), format)
                    : m.group();
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    private String format(String name, Object value, String format) {
        if (value instanceof DayOfWeek day) {
            return day.getDisplayName(TextStyle.FULL, templates.getLocale());
        }
        if (format == null) {
            return String.valueOf(value);
        }
        try {
            return String.format(templates.getLocale(), format, value);
        } catch (IllegalFormatException e) {
            LOG.warn("Template format '{}' does not fit placeholder '{}'={}: {}",
                    format, name, value, e.getMessage());
            return String.valueOf(value);
        }
    }
}
