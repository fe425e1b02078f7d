package jira.report;

import jira.report.exceptions.ConfigException;
import jira.report.extract.DateFailurePolicy;
import jakarta.json.bind.Jsonb;
import jakarta.json.bind.JsonbBuilder;
import jakarta.json.bind.annotation.JsonbCreator;
import jakarta.json.bind.annotation.JsonbProperty;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configurazione di una esecuzione, letta da file JSON.
 * {@code JIRA_URL} e {@code JIRA_TOKEN} nell'ambiente hanno la precedenza sul file.
 */
public final class ReportConfig {

    static final String ENV_URL   = "JIRA_URL";
    static final String ENV_TOKEN = "JIRA_TOKEN";
    static final int DEFAULT_WORKERS = 8;

    private final String jiraUrl;
    private final String authToken;
    private final String jql;
    private final List<String> fields;
    private final int workers;
    private final Path outputCsv;
    private final Path outputJson;     // può essere null
    private final DateFailurePolicy datePolicy;

    @JsonbCreator
    public ReportConfig(@JsonbProperty("jiraUrl")    String jiraUrl,
                        @JsonbProperty("authToken")  String authToken,
                        @JsonbProperty("jql")        String jql,
                        @JsonbProperty("fields")     List<String> fields,
                        @JsonbProperty("workers")    Integer workers,
                        @JsonbProperty("outputCsv")  String outputCsv,
                        @JsonbProperty("outputJson") String outputJson,
                        @JsonbProperty("datePolicy") String datePolicy) {
        this.jiraUrl    = jiraUrl;
        this.authToken  = authToken;
        this.jql        = jql;
        this.fields     = fields == null ? List.of() : List.copyOf(fields);
        this.workers    = workers == null ? DEFAULT_WORKERS : workers;
        this.outputCsv  = Path.of(outputCsv == null ? "report.csv" : outputCsv);
        this.outputJson = outputJson == null ? null : Path.of(outputJson);
        this.datePolicy = datePolicy == null
                ? DateFailurePolicy.FAIL
                : DateFailurePolicy.valueOf(datePolicy.trim().toUpperCase(Locale.ROOT));
    }

    public String jiraUrl()    { return jiraUrl; }
    public String authToken()  { return authToken; }
    public String jql()        { return jql; }
    public List<String> fields() { return fields; }
    public int workers()       { return workers; }
    public Path outputCsv()    { return outputCsv; }
    public Path outputJson()   { return outputJson; }
    public DateFailurePolicy datePolicy() { return datePolicy; }

    public static ReportConfig load(Path file) throws ConfigException {
        return load(file, System.getenv());
    }

    static ReportConfig load(Path file, Map<String, String> env) throws ConfigException {
        ReportConfig fromFile;
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             Jsonb jb = JsonbBuilder.create()) {
            fromFile = jb.fromJson(r, ReportConfig.class);
        } catch (Exception e) {
            throw new ConfigException("Errore leggendo la configurazione da " + file, e);
        }
        return fromFile.withOverrides(env).validate();
    }

    private ReportConfig withOverrides(Map<String, String> env) {
        return new ReportConfig(
                env.getOrDefault(ENV_URL, jiraUrl),
                env.getOrDefault(ENV_TOKEN, authToken),
                jql, fields, workers,
                outputCsv.toString(),
                outputJson == null ? null : outputJson.toString(),
                datePolicy.name());
    }

    private ReportConfig validate() throws ConfigException {
        if (isBlank(jiraUrl))   throw new ConfigException("jiraUrl mancante (file o " + ENV_URL + ")");
        if (isBlank(authToken)) throw new ConfigException("authToken mancante (file o " + ENV_TOKEN + ")");
        if (isBlank(jql))       throw new ConfigException("jql mancante");
        if (workers < 1)        throw new ConfigException("workers deve essere >= 1");
        return this;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return "ReportConfig{jiraUrl=" + jiraUrl + ", jql=" + jql + ", fields=" + fields
                + ", workers=" + workers + ", outputCsv=" + outputCsv + ", outputJson="
                + Objects.toString(outputJson, "-") + ", datePolicy=" + datePolicy + "}";
    }
}
