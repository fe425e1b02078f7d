package jira.report.extract;

import jira.report.exceptions.MalformedResponseException;
import jakarta.json.JsonArray;
import jakarta.json.JsonObject;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;

/**
 * Ricava lo "sviluppatore di riferimento" di un'issue dal changelog:
 * l'autore della prima transizione verso lo stato {@value #IN_DEVELOPMENT}.
 */
public final class ChangelogScanner {

    public static final String IN_DEVELOPMENT = "In Development";

    private ChangelogScanner() { /* utility class */ }

    /**
     * Scorre le history nell'ordine dato e, dentro ognuna, gli item in ordine.
     * Si ferma alla prima corrispondenza con autore non vuoto.
     *
     * @param issue issue scaricata con {@code expand=changelog}
     * @return displayName dell'autore, stringa vuota se la transizione non c'è
     * @throws MalformedResponseException se changelog o history mancano o hanno tipo errato
     */
    public static String developerOfRecord(JsonObject issue) {
        JsonObject changelog = requireObject(issue, "changelog");
        for (JsonValue history : requireArray(changelog, "histories")) {
            JsonObject entry = asObject(history, "histories[]");
            for (JsonValue item : requireArray(entry, "items")) {
                JsonValue to = asObject(item, "items[]").get("toString");
                if (to instanceof JsonString && IN_DEVELOPMENT.equals(((JsonString) to).getString())) {
                    String developer = authorName(entry);
                    if (!developer.isEmpty()) {
                        return developer;
                    }
                    break;
                }
            }
        }
        return "";
    }

    private static String authorName(JsonObject entry) {
        JsonValue name = requireObject(entry, "author").get("displayName");
        if (!(name instanceof JsonString)) {
            throw new MalformedResponseException("author.displayName mancante nel changelog");
        }
        return ((JsonString) name).getString();
    }

    private static JsonObject requireObject(JsonObject parent, String key) {
        return asObject(parent.get(key), key);
    }

    private static JsonArray requireArray(JsonObject parent, String key) {
        JsonValue v = parent.get(key);
        if (v == null || v.getValueType() != JsonValue.ValueType.ARRAY) {
            throw new MalformedResponseException("'" + key + "' mancante o non è un array");
        }
        return v.asJsonArray();
    }

    private static JsonObject asObject(JsonValue v, String what) {
        if (v == null || v.getValueType() != JsonValue.ValueType.OBJECT) {
            throw new MalformedResponseException("'" + what + "' mancante o non è un oggetto");
        }
        return v.asJsonObject();
    }
}
