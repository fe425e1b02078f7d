package jira.report.fetcher;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import jira.report.exceptions.MalformedResponseException;
import jira.report.exceptions.TransportException;
import jira.report.fetcher.model.FieldCatalog;
import jira.report.fetcher.model.FieldDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Costruisce il {@link FieldCatalog} a partire da {@code /rest/api/2/field}.
 *
 * <p>Jira può esporre più campi con lo stesso nome leggibile. Regole, applicate
 * nell'ordine della risposta:</p>
 * <ul>
 *   <li>un campo <b>custom</b> entra nel catalogo solo se il nome non è già
 *       presente e non è stato reclamato da un campo standard (vince il primo
 *       custom visto);</li>
 *   <li>un campo <b>standard</b> rimuove l'eventuale custom con lo stesso nome
 *       e reclama il nome per sempre.</li>
 * </ul>
 */
public class FieldCatalogResolver {

    private static final Logger log = LoggerFactory.getLogger(FieldCatalogResolver.class);

    static final String FIELD_API = "/rest/api/2/field";

    private static final Gson GSON = new Gson();

    private final Communicator communicator;

    public FieldCatalogResolver(Communicator communicator) {
        this.communicator = Objects.requireNonNull(communicator);
    }

    public FieldCatalog resolve() throws TransportException {
        byte[] body = communicator.createRequestAndGetResponse(FIELD_API, null);
        FieldCatalog catalog = resolve(parse(body));
        log.info("→ {} campi custom nel catalogo", catalog.size());
        return catalog;
    }

    static FieldCatalog resolve(FieldDefinition[] fields) {
        Map<String, String> result = new LinkedHashMap<>();
        Set<String> standardNames = new HashSet<>();
        Map<String, String> standardIds = new HashMap<>();

        for (FieldDefinition field : fields) {
            String name = field.getName().toLowerCase(Locale.ROOT);
            if (Boolean.TRUE.equals(field.getCustom())) {
                if (!result.containsKey(name) && !standardNames.contains(name)) {
                    result.put(name, field.getId().toLowerCase(Locale.ROOT));
                } else {
                    log.debug("campo custom {} ({}) ignorato: nome già usato", field.getName(), field.getId());
                }
            } else {
                if (result.remove(name) != null) {
                    log.debug("campo standard {} sostituisce un custom omonimo", field.getName());
                }
                standardNames.add(name);
                standardIds.putIfAbsent(name, field.getId().toLowerCase(Locale.ROOT));
            }
        }
        return new FieldCatalog(result, standardIds);
    }

    private static FieldDefinition[] parse(byte[] body) {
        FieldDefinition[] fields;
        try (Reader r = new InputStreamReader(new ByteArrayInputStream(body), StandardCharsets.UTF_8)) {
            fields = GSON.fromJson(r, FieldDefinition[].class);
        } catch (JsonParseException | IOException e) {
            throw new MalformedResponseException("Risposta di " + FIELD_API + " non è un array di campi", e);
        }
        if (fields == null) {
            throw new MalformedResponseException("Risposta vuota da " + FIELD_API);
        }
        for (FieldDefinition f : fields) {
            if (f == null || f.getId() == null || f.getName() == null || f.getCustom() == null) {
                throw new MalformedResponseException(
                        "Definizione di campo incompleta in " + FIELD_API + " (id, name e custom sono obbligatori)");
            }
        }
        return fields;
    }
}
