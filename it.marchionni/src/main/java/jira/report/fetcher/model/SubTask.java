package jira.report.fetcher.model;

/**
 * Riga di sotto-attività: tutti i valori sono stringhe già pronte per il
 * report ("N/A" se il campo manca).
 */
public class SubTask {
    private final String type;
    private final String name;
    private final String assigneeName;
    private final String totalHours;

    public SubTask(String type, String name, String assigneeName, String totalHours) {
        this.type         = type;
        this.name         = name;
        this.assigneeName = assigneeName;
        this.totalHours   = totalHours;
    }

    public String getType()         { return type; }
    public String getName()         { return name; }
    public String getAssigneeName() { return assigneeName; }
    public String getTotalHours()   { return totalHours; }

    @Override
    public String toString() {
        return type + " '" + name + "' (" + assigneeName + ", " + totalHours + ")";
    }
}
