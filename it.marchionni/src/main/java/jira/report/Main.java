package jira.report;

import jira.report.exceptions.ConfigException;
import jira.report.exceptions.PipelineException;
import jira.report.exceptions.ReportWriterException;
import jira.report.extract.ValueExtractor;
import jira.report.fetcher.IssuePipeline;
import jira.report.fetcher.JiraCommunicator;
import jira.report.fetcher.model.Issue;
import jira.report.report.CsvReportWriter;
import jira.report.report.JsonReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Path configFile = Path.of(args.length > 0 ? args[0] : "config.json");
        try {
            run(ReportConfig.load(configFile));
        } catch (ConfigException | PipelineException | ReportWriterException e) {
            LOG.error("🔴 Report interrotto:", e);
            System.exit(1);
        } catch (RuntimeException e) {
            LOG.error("🔴 Errore inatteso, report interrotto:", e);
            System.exit(1);
        }
    }

    static void run(ReportConfig cfg) throws PipelineException, ReportWriterException {
        LOG.info("▶ Avvio report Jira: {}", cfg);

        ValueExtractor extractor = new ValueExtractor(cfg.datePolicy());
        IssuePipeline pipeline = new IssuePipeline(
                new JiraCommunicator(cfg.jiraUrl(), cfg.authToken()), extractor, cfg.workers());

        List<Issue> issues = new ArrayList<>();
        pipeline.run(cfg.jql(), cfg.fields(), issues::add);

        new CsvReportWriter(cfg.fields(), extractor).write(issues, cfg.outputCsv());
        if (cfg.outputJson() != null) {
            new JsonReportWriter().write(issues, cfg.outputJson());
        }
        LOG.info("✅ Report completato: {} issue", issues.size());
    }
}
