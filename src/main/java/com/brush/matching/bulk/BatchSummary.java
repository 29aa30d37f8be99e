package com.brush.matching.bulk;

import com.brush.matching.core.model.MatchType;

import java.util.List;
import java.util.Map;

/**
 * Counts for one batch run.
 *
 * @param total        records read, including malformed ones
 * @param matched      records with a match
 * @param unmatched    well-formed records without a match
 * @param byMatchType  matched records per match type
 * @param errors       malformed records and I/O failures
 */
public record BatchSummary(
        long total,
        long matched,
        long unmatched,
        Map<MatchType, Long> byMatchType,
        List<BatchError> errors
) {
    public BatchSummary {
        byMatchType = byMatchType != null ? Map.copyOf(byMatchType) : Map.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Fraction of well-formed records that matched.
     */
    public double matchRate() {
        long processed = matched + unmatched;
        return processed == 0 ? 0.0 : (double) matched / processed;
    }

    /**
     * A record or stream failure.
     *
     * @param lineNumber 1-based input line, or 0 for a failure of the stream itself
     * @param input      the offending line, or an empty string
     * @param message    what went wrong
     */
    public record BatchError(long lineNumber, String input, String message) {}

    @Override
    public String toString() {
        return "BatchSummary{total=" + total +
                ", matched=" + matched +
                ", unmatched=" + unmatched +
                ", byMatchType=" + byMatchType +
                ", errors=" + errors.size() + '}';
    }
}
