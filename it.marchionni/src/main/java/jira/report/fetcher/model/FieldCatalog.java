package jira.report.fetcher.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Mappa (immutabile) nome del campo in minuscolo → id del campo custom.
 * Accanto tiene gli id dei campi standard ("issue type" → issuetype), usati
 * solo per tradurre i nomi richiesti nel report.
 * Costruita una sola volta per esecuzione, poi solo letta: può essere
 * condivisa fra thread senza sincronizzazione.
 */
public final class FieldCatalog {

    private final Map<String, String> idsByName;
    private final Map<String, String> standardIdsByName;

    public FieldCatalog(Map<String, String> idsByName) {
        this(idsByName, Map.of());
    }

    public FieldCatalog(Map<String, String> idsByName, Map<String, String> standardIdsByName) {
        this.idsByName         = Collections.unmodifiableMap(new LinkedHashMap<>(idsByName));
        this.standardIdsByName = Map.copyOf(standardIdsByName);
    }

    public Optional<String> idFor(String name) {
        return Optional.ofNullable(idsByName.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean contains(String name) {
        return idsByName.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return idsByName.size();
    }

    public Map<String, String> asMap() {
        return idsByName;
    }

    /**
     * Traduce i nomi "umani" richiesti nel report negli id da passare alla
     * search: prima i custom, poi i campi standard, infine il nome stesso in
     * minuscolo (già un id, es. "summary").
     */
    public List<String> toFieldIds(List<String> names) {
        List<String> ids = new ArrayList<>(names.size());
        for (String name : names) {
            String lower = name.trim().toLowerCase(Locale.ROOT);
            String id = idsByName.get(lower);
            ids.add(id != null ? id : standardIdsByName.getOrDefault(lower, lower));
        }
        return ids;
    }
}
