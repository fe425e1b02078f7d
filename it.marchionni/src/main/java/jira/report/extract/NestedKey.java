package jira.report.extract;

import java.util.Locale;
import java.util.Map;

/**
 * Per i campi il cui valore è un oggetto JSON, indica quale chiave interna
 * contiene il testo da mostrare. I campi non elencati usano {@code value}
 * (caso tipico delle select custom).
 */
public enum NestedKey {
    DISPLAY_NAME("displayName"),
    NAME("name"),
    ORIGINAL_ESTIMATE("originalEstimate"),
    VALUE("value");

    private static final Map<String, NestedKey> BY_FIELD = Map.of(
            "assignee",     DISPLAY_NAME,
            "reporter",     DISPLAY_NAME,
            "issuetype",    NAME,
            "status",       NAME,
            "priority",     NAME,
            "timetracking", ORIGINAL_ESTIMATE
    );

    private final String key;

    NestedKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static NestedKey forField(String fieldName) {
        return BY_FIELD.getOrDefault(fieldName.toLowerCase(Locale.ROOT), VALUE);
    }
}
