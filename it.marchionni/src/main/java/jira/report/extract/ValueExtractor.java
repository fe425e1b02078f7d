package jira.report.extract;

import jira.report.exceptions.MalformedResponseException;
import jakarta.json.JsonArray;
import jakarta.json.JsonNumber;
import jakarta.json.JsonObject;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Objects;

/**
 * Trasforma il valore di un campo di un'issue (qualunque forma abbia il JSON)
 * nella stringa da scrivere nel report.
 *
 * <p>La classe non ha stato mutabile: la stessa istanza è usata in parallelo
 * da tutti i worker.</p>
 */
public class ValueExtractor {

    public static final String NOT_AVAILABLE = "N/A";

    static final String CREATED = "created";

    // es. 2023-03-05T10:15:30.000+0000
    private static final DateTimeFormatter JIRA_TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .appendOffset("+HHMM", "+0000")
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter REPORT_DATE =
            DateTimeFormatter.ofPattern("dd/MMM/yy", Locale.ENGLISH);

    private final DateFailurePolicy datePolicy;

    public ValueExtractor() {
        this(DateFailurePolicy.FAIL);
    }

    public ValueExtractor(DateFailurePolicy datePolicy) {
        this.datePolicy = Objects.requireNonNull(datePolicy);
    }

    /**
     * Restituisce il valore del campo {@code fieldName} dentro {@code issue.fields},
     * oppure "N/A" se l'issue non ha {@code fields} o il campo non c'è.
     *
     * @throws MalformedResponseException se il valore ha una forma non rappresentabile
     */
    public String extractField(JsonObject issue, String fieldName) {
        JsonValue fields = issue.get("fields");
        if (fields == null || fields.getValueType() == JsonValue.ValueType.NULL) {
            return NOT_AVAILABLE;
        }
        if (fields.getValueType() != JsonValue.ValueType.OBJECT) {
            throw new MalformedResponseException(
                    "'fields' non è un oggetto ma " + fields.getValueType());
        }

        JsonValue val = fields.asJsonObject().get(fieldName);
        if (val == null) {
            return NOT_AVAILABLE;
        }
        if (CREATED.equalsIgnoreCase(fieldName)) {
            return formatCreated(val);
        }
        return valueOf(val, fieldName).replace(",", "");
    }

    private String formatCreated(JsonValue val) {
        try {
            if (!(val instanceof JsonString)) {
                throw new MalformedResponseException(
                        "'created' non è una stringa ma " + val.getValueType());
            }
            String raw = ((JsonString) val).getString();
            return OffsetDateTime.parse(raw, JIRA_TIMESTAMP).format(REPORT_DATE);
        } catch (DateTimeParseException | MalformedResponseException e) {
            if (datePolicy == DateFailurePolicy.NOT_AVAILABLE) {
                return NOT_AVAILABLE;
            }
            if (e instanceof MalformedResponseException) {
                throw (MalformedResponseException) e;
            }
            throw new MalformedResponseException("Data 'created' non valida: " + val, e);
        }
    }

    static String valueOf(JsonValue val, String fieldName) {
        switch (val.getValueType()) {
            case ARRAY:
                return firstSelection(val.asJsonArray(), fieldName);
            case OBJECT:
                JsonValue nested = val.asJsonObject().get(NestedKey.forField(fieldName).key());
                return nested == null ? "" : scalar(nested, fieldName);
            default:
                return scalar(val, fieldName);
        }
    }

    // multi-select: conta solo la prima opzione
    private static String firstSelection(JsonArray arr, String fieldName) {
        if (arr.isEmpty()) {
            return "";
        }
        JsonValue first = arr.get(0);
        if (first.getValueType() != JsonValue.ValueType.OBJECT) {
            throw new MalformedResponseException("Campo '" + fieldName
                    + "': atteso array di oggetti, primo elemento " + first.getValueType());
        }
        JsonValue option = first.asJsonObject().get(NestedKey.VALUE.key());
        return option == null ? "" : scalar(option, fieldName);
    }

    private static String scalar(JsonValue val, String fieldName) {
        switch (val.getValueType()) {
            case STRING: return ((JsonString) val).getString();
            case NUMBER: return ((JsonNumber) val).toString();
            case TRUE:   return "true";
            case FALSE:  return "false";
            case NULL:   return "";
            default:
                throw new MalformedResponseException("Campo '" + fieldName
                        + "': valore annidato non scalare (" + val.getValueType() + ")");
        }
    }
}
