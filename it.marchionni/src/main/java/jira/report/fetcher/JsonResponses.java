package jira.report.fetcher;

import jira.report.exceptions.MalformedResponseException;
import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonException;
import jakarta.json.JsonObject;
import jakarta.json.JsonReader;
import jakarta.json.JsonValue;

import java.io.ByteArrayInputStream;

/**
 * Parsing JSON-P dei body restituiti da Jira, con controllo della forma.
 */
final class JsonResponses {

    private JsonResponses() { /* utility class */ }

    static JsonValue read(byte[] body, String what) {
        try (JsonReader jr = Json.createReader(new ByteArrayInputStream(body))) {
            return jr.readValue();
        } catch (JsonException e) {
            throw new MalformedResponseException("JSON non valido per " + what, e);
        }
    }

    static JsonObject readObject(byte[] body, String what) {
        JsonValue v = read(body, what);
        if (v.getValueType() != JsonValue.ValueType.OBJECT) {
            throw new MalformedResponseException(what + ": atteso un oggetto, trovato " + v.getValueType());
        }
        return v.asJsonObject();
    }

    static JsonArray requireArray(JsonObject parent, String key, String what) {
        JsonValue v = parent.get(key);
        if (v == null || v.getValueType() != JsonValue.ValueType.ARRAY) {
            throw new MalformedResponseException(what + ": '" + key + "' mancante o non è un array");
        }
        return v.asJsonArray();
    }

    static JsonObject asObject(JsonValue v, String what) {
        if (v == null || v.getValueType() != JsonValue.ValueType.OBJECT) {
            throw new MalformedResponseException(what + ": atteso un oggetto");
        }
        return v.asJsonObject();
    }

    static String requireString(JsonObject parent, String key, String what) {
        JsonValue v = parent.get(key);
        if (v == null || v.getValueType() != JsonValue.ValueType.STRING) {
            throw new MalformedResponseException(what + ": '" + key + "' mancante o non è una stringa");
        }
        return parent.getString(key);
    }
}
