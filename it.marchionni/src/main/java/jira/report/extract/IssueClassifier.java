package jira.report.extract;

import java.util.Locale;
import java.util.Set;

public final class IssueClassifier {

    private static final Set<String> BUG_TYPES = Set.of("bug", "functional bug", "production issue");

    private IssueClassifier() { /* utility class */ }

    /** true se il tipo di issue (già estratto come stringa) è una delle varianti di bug. */
    public static boolean isBug(String issueType) {
        return issueType != null && BUG_TYPES.contains(issueType.toLowerCase(Locale.ROOT));
    }
}
