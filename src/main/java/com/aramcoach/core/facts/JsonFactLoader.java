package com.aramcoach.core.facts;

import com.aramcoach.core.model.ChampionFacts;
import com.aramcoach.core.model.FactSet;
import com.aramcoach.core.model.ItemFacts;
import com.aramcoach.core.model.RuneFacts;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Loads a {@link FactSet} from the JSON files of a patch directory.
 * <p>
 * Loaded fact sets are immutable, so they are cached per patch id and handed
 * to concurrent runs as-is.
 */
@Service
public class JsonFactLoader implements FactLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonFactLoader.class);

    private final PatchDataReader reader;
    private final DataProperties properties;
    private final ConcurrentHashMap<String, FactSet> cache = new ConcurrentHashMap<>();

    public JsonFactLoader(PatchDataReader reader, DataProperties properties) {
        this.reader = reader;
        this.properties = properties;
    }

    @Override
    public FactSet load(String patchId) {
        if (!properties.isCacheFacts()) {
            return read(patchId);
        }
        FactSet cached = cache.get(patchId);
        if (cached != null) {
            return cached;
        }
        // Not computeIfAbsent: a failed load must not be cached and exceptions should surface unwrapped
        FactSet loaded = read(patchId);
        FactSet previous = cache.putIfAbsent(patchId, loaded);
        return previous != null ? previous : loaded;
    }

    private FactSet read(String patchId) {
        long start = System.currentTimeMillis();
        List<ChampionFacts> champions = reader.readRequired(patchId, "champions.json", new TypeReference<>() {});
        List<ItemFacts> items = reader.readRequired(patchId, "items.json", new TypeReference<>() {});
        List<RuneFacts> runes = reader.readRequired(patchId, "runes.json", new TypeReference<>() {});

        for (ChampionFacts c : champions) {
            requireText(patchId, "champions.json", c == null ? null : c.id(), "id");
            requireText(patchId, "champions.json", c.name(), "name of " + c.id());
        }
        for (ItemFacts i : items) {
            requireText(patchId, "items.json", i == null ? null : i.id(), "id");
            requireText(patchId, "items.json", i.name(), "name of " + i.id());
            if (i.cost() < 0) {
                throw new DataCorruptException("items.json for patch " + patchId
                        + ": item " + i.id() + " has negative cost " + i.cost());
            }
        }
        for (RuneFacts r : runes) {
            requireText(patchId, "runes.json", r == null ? null : r.id(), "id");
        }

        var facts = new FactSet(patchId,
                index(patchId, "champions.json", champions, ChampionFacts::id),
                index(patchId, "items.json", items, ItemFacts::id),
                index(patchId, "runes.json", runes, RuneFacts::id));
        log.info("Loaded facts for patch {}: {} champions, {} items, {} runes ({} ms)",
                patchId, facts.champions().size(), facts.items().size(), facts.runes().size(),
                System.currentTimeMillis() - start);
        return facts;
    }

    private static <T> Map<String, T> index(String patchId, String file, List<T> rows, Function<T, String> id) {
        var map = new LinkedHashMap<String, T>();
        for (T row : rows) {
            if (map.putIfAbsent(id.apply(row), row) != null) {
                throw new DataCorruptException(file + " for patch " + patchId + " has duplicate id " + id.apply(row));
            }
        }
        return map;
    }

    private static void requireText(String patchId, String file, String value, String field) {
        if (value == null || value.isBlank()) {
            throw new DataCorruptException(file + " for patch " + patchId + " has a record without " + field);
        }
    }
}
