package jira.report.fetcher.model;

/**
 * Definizione di un campo come restituita da {@code /rest/api/2/field}.
 * Popolata da Gson: i campi restano null se mancano nella risposta.
 */
public class FieldDefinition {
    private String id;
    private String name;
    private Boolean custom;

    public FieldDefinition() {
        //empty
    }

    public FieldDefinition(String id, String name, boolean custom) {
        this.id = id;
        this.name = name;
        this.custom = custom;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public Boolean getCustom() { return custom; }
}
