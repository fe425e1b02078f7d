package jira.report.fetcher.model;

import jakarta.json.JsonObject;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;
import jakarta.json.bind.annotation.JsonbTransient;

import java.util.ArrayList;
import java.util.List;

/**
 * Issue Jira così come passa lungo la pipeline:
 *  - il JSON grezzo restituito dalla search
 *  - gli id dei campi richiesti (servono all'estrazione dei valori)
 *  - le sotto-attività e, per i bug, lo sviluppatore ricavato dal changelog
 */
public class Issue {

    /* ---------- dati grezzi ---------- */
    private final JsonObject data;
    private final List<String> fields;

    /* ---------- arricchimento ---------- */
    private List<SubTask> subTasks = new ArrayList<>();
    private String assigneeName;    // null finché l'issue non è classificata come bug

    public Issue(JsonObject data, List<String> fields) {
        this.data   = data;
        this.fields = List.copyOf(fields);
    }

    @JsonbTransient
    public JsonObject getData() { return data; }

    /** Id Jira ("10234"), null se assente. */
    @JsonbTransient
    public String getId() { return stringOrNull("id"); }

    /** Chiave leggibile ("PROJ-123"), null se assente. */
    public String getKey() { return stringOrNull("key"); }

    public List<String> getFields() { return fields; }

    public List<SubTask> getSubTasks() { return subTasks; }
    public void setSubTasks(List<SubTask> subTasks) { this.subTasks = List.copyOf(subTasks); }

    public String getAssigneeName() { return assigneeName; }
    public void   setAssigneeName(String assigneeName) { this.assigneeName = assigneeName; }

    private String stringOrNull(String name) {
        JsonValue v = data.get(name);
        return v instanceof JsonString ? ((JsonString) v).getString() : null;
    }
}
