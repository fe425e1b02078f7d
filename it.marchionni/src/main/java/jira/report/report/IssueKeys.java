package jira.report.report;

/**
 * Confronto "naturale" fra chiavi Jira: PROJ-9 viene prima di PROJ-10.
 */
final class IssueKeys {

    private IssueKeys() { /* utility class */ }

    static int compare(String a, String b) {
        int da = a.lastIndexOf('-');
        int db = b.lastIndexOf('-');
        if (da > 0 && db > 0) {
            int byProject = a.substring(0, da).compareTo(b.substring(0, db));
            if (byProject != 0) {
                return byProject;
            }
            try {
                return Long.compare(Long.parseLong(a.substring(da + 1)), Long.parseLong(b.substring(db + 1)));
            } catch (NumberFormatException e) {
                // chiave non standard: ordine lessicografico
                return a.compareTo(b);
            }
        }
        return a.compareTo(b);
    }
}
