package jira.report.fetcher;

import jira.report.exceptions.PipelineException;
import jira.report.extract.ValueExtractor;
import jira.report.fetcher.model.FieldCatalog;
import jira.report.fetcher.model.Issue;
import jakarta.json.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Esecuzione completa: catalogo dei campi, search, aggregazione delle
 * sotto-attività in parallelo.
 *
 * <pre>
 *   search ──► retrieved (canale) ──► pool di N worker ──► completion ──► sink
 * </pre>
 *
 * Le issue arrivano al {@code sink} nell'ordine in cui i worker terminano,
 * non in quello della search. Un qualunque errore interrompe tutta
 * l'esecuzione: non esiste un risultato parziale.
 */
public class IssuePipeline {

    private static final Logger log = LoggerFactory.getLogger(IssuePipeline.class);

    // marcatore di fine search sul canale
    private static final Issue END_OF_SEARCH = new Issue(JsonValue.EMPTY_JSON_OBJECT, List.of());

    private final FieldCatalogResolver resolver;
    private final SearchRunner searchRunner;
    private final SubTaskAggregator aggregator;
    private final AtomicInteger totalRestCalls;
    private final int workers;

    public IssuePipeline(Communicator communicator, ValueExtractor extractor, int workers) {
        this(communicator, extractor, workers, new AtomicInteger());
    }

    IssuePipeline(Communicator communicator, ValueExtractor extractor, int workers, AtomicInteger totalRestCalls) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers deve essere >= 1, ricevuto " + workers);
        }
        Objects.requireNonNull(communicator);
        this.resolver       = new FieldCatalogResolver(communicator);
        this.searchRunner   = new SearchRunner(communicator);
        this.totalRestCalls = totalRestCalls;
        this.aggregator     = new SubTaskAggregator(new IssueFetcher(communicator), extractor, totalRestCalls);
        this.workers        = workers;
    }

    /**
     * @param jql        filtro della search
     * @param fieldNames nomi leggibili dei campi del report (tradotti in id col catalogo)
     * @param sink       consumatore a valle; chiamato sempre dal thread del chiamante
     * @return numero di issue consegnate al sink
     */
    public int run(String jql, List<String> fieldNames, Consumer<Issue> sink) throws PipelineException {
        long start = System.nanoTime();
        ExecutorService searchThread = Executors.newSingleThreadExecutor();
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        List<Future<Issue>> pending = new ArrayList<>();
        try {
            // 1) catalogo: una volta sola, prima di tutto il resto
            FieldCatalog catalog = resolver.resolve();
            List<String> fieldIds = catalog.toFieldIds(fieldNames);
            log.info("▶ Campi richiesti {} → id {}", fieldNames, fieldIds);

            // 2) search in un thread produttore
            BlockingQueue<Issue> retrieved = new LinkedBlockingQueue<>();
            Future<Integer> search = searchThread.submit(() -> {
                try {
                    return searchRunner.search(jql, fieldIds, retrieved);
                } finally {
                    retrieved.put(END_OF_SEARCH);
                }
            });

            // 3) un task di aggregazione per issue
            CompletionService<Issue> completion = new ExecutorCompletionService<>(pool);
            for (Issue issue = retrieved.take(); issue != END_OF_SEARCH; issue = retrieved.take()) {
                Issue current = issue;
                pending.add(completion.submit(() -> aggregator.aggregate(current)));
            }
            search.get();

            // 4) consegna a valle in ordine di completamento
            for (int i = 0; i < pending.size(); i++) {
                sink.accept(completion.take().get());
            }

            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
            log.info("✅ {} issue elaborate, {} chiamate REST in {} s ({} chiamate/s)",
                    pending.size(), totalRestCalls.get(), String.format("%.1f", seconds),
                    String.format("%.1f", seconds > 0 ? totalRestCalls.get() / seconds : 0.0));
            return pending.size();
        } catch (ExecutionException e) {
            pending.forEach(f -> f.cancel(true));
            throw new PipelineException("Errore durante l'elaborazione delle issue", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.forEach(f -> f.cancel(true));
            throw new PipelineException("Pipeline interrotta", e);
        } catch (Exception e) {
            pending.forEach(f -> f.cancel(true));
            throw new PipelineException("Errore durante l'elaborazione delle issue", e);
        } finally {
            searchThread.shutdownNow();
            pool.shutdownNow();
        }
    }

    public int getTotalRestCalls() {
        return totalRestCalls.get();
    }
}
