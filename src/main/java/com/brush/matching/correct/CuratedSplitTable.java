package com.brush.matching.correct;

import com.brush.matching.catalog.CatalogException;
import com.brush.matching.catalog.YamlMaps;
import com.brush.matching.rules.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated splits from {@code brush_splits.yaml}, keyed by normalized original text.
 * Entries that have not been validated are ignored.
 *
 * <pre>
 * brush_splits:
 *   - original: "Elite Zebra / DG B15"
 *     handle: "Elite Zebra"
 *     knot: "DG B15"
 *     validated: true
 *     should_not_split: false
 * </pre>
 */
public class CuratedSplitTable {
    private static final Logger log = LoggerFactory.getLogger(CuratedSplitTable.class);

    private static final String ROOT = "brush_splits";

    private final Map<String, CuratedSplit> splits;

    private CuratedSplitTable(Map<String, CuratedSplit> splits) {
        this.splits = Map.copyOf(splits);
    }

    public static CuratedSplitTable empty() {
        return new CuratedSplitTable(Map.of());
    }

    /**
     * Builds the table from a parsed {@code brush_splits.yaml}.
     *
     * @throws CatalogException if the mapping is malformed or an original repeats
     */
    public static CuratedSplitTable fromMapping(Map<String, Object> raw) {
        Object list = raw.get(ROOT);
        if (list == null) {
            return empty();
        }
        if (!(list instanceof List<?> items)) {
            throw new CatalogException(ROOT + ": expected a list");
        }
        Map<String, CuratedSplit> splits = new LinkedHashMap<>();
        int skipped = 0;
        for (int i = 0; i < items.size(); i++) {
            String where = ROOT + "[" + i + "]";
            Map<String, Object> fields = YamlMaps.asMapping(items.get(i), where);
            Object original = fields.get("original");
            if (original == null) {
                throw new CatalogException(where + ": 'original' is required");
            }
            if (!Boolean.TRUE.equals(fields.get("validated"))) {
                skipped++;
                continue;
            }
            boolean shouldNotSplit = Boolean.TRUE.equals(fields.get("should_not_split"));
            String handle = stringOrNull(fields.get("handle"));
            String knot = stringOrNull(fields.get("knot"));
            if (!shouldNotSplit && handle == null && knot == null) {
                throw new CatalogException(where + ": a validated split needs a handle or a knot");
            }
            String key = TextNormalizer.normalize(original.toString());
            CuratedSplit previous = splits.putIfAbsent(key,
                    new CuratedSplit(original.toString(), handle, knot, shouldNotSplit));
            if (previous != null) {
                throw new CatalogException(where + ": duplicate original '" + key + "'");
            }
        }
        log.info("brush_splits.loaded validated={} skipped={}", splits.size(), skipped);
        return new CuratedSplitTable(splits);
    }

    public Optional<CuratedSplit> find(String text) {
        return Optional.ofNullable(splits.get(TextNormalizer.normalize(text)));
    }

    /**
     * True if a reviewer marked the text as one that must not be split.
     */
    public boolean shouldNotSplit(String text) {
        return find(text).map(CuratedSplit::shouldNotSplit).orElse(false);
    }

    public int size() {
        return splits.size();
    }

    private static String stringOrNull(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().strip();
        return text.isEmpty() ? null : text;
    }
}
