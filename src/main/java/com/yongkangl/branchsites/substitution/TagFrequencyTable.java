package com.yongkangl.branchsites.substitution;

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.stat.Frequency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts grouped by tag. Used both for amino-acid composition (tag to residue counts)
 * and for substitutions (tag or {@code parent->child} transition key to substitution
 * pair counts). Tags keep their insertion order; entries within a tag are kept sorted.
 *
 * <p>Not synchronized: give each concurrent traversal its own table.
 */
public class TagFrequencyTable {
    /** Entry recorded under a {@code parent->child} key to mark a tag boundary. */
    public static final String TRANSITION = "transition";
    public static final String EMPTY = "-";
    public static final String NOT_AVAILABLE = "NA";

    private final Map<String, Frequency> tables = new LinkedHashMap<>();

    public void increment(String tag, String key) {
        frequency(tag).addValue(Validate.notNull(key, "key"));
    }

    /** Sets the count of {@code key} to one unless it is already present. */
    public void mark(String tag, String key) {
        Frequency frequency = frequency(tag);
        if (frequency.getCount(Validate.notNull(key, "key")) == 0) {
            frequency.addValue(key);
        }
    }

    private Frequency frequency(String tag) {
        Validate.notNull(tag, "tag");
        return tables.computeIfAbsent(tag, t -> new Frequency());
    }

    public TagFrequencyTable pooled(String tag) {
        TagFrequencyTable pooled = new TagFrequencyTable();
        Frequency merged = pooled.frequency(tag);
        for (Frequency frequency : tables.values()) {
            merged.merge(frequency);
        }
        return pooled;
    }

    public long getCount(String tag, String key) {
        Frequency frequency = tables.get(tag);
        return frequency == null ? 0 : frequency.getCount(key);
    }

    public long getTotal(String tag) {
        Frequency frequency = tables.get(tag);
        return frequency == null ? 0 : frequency.getSumFreq();
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tables.keySet());
    }

    public boolean contains(String tag) {
        return tables.containsKey(tag);
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    public Map<String, Long> counts(String tag) {
        Map<String, Long> counts = new LinkedHashMap<>();
        Frequency frequency = tables.get(tag);
        if (frequency != null) {
            Iterator<Map.Entry<Comparable<?>, Long>> it = frequency.entrySetIterator();
            while (it.hasNext()) {
                Map.Entry<Comparable<?>, Long> entry = it.next();
                counts.put(entry.getKey().toString(), entry.getValue());
            }
        }
        return counts;
    }

    // ties come back in sorted order
    public List<String> modes(String tag) {
        List<String> modes = new ArrayList<>();
        Frequency frequency = tables.get(tag);
        if (frequency != null) {
            for (Comparable<?> mode : frequency.getMode()) {
                modes.add(mode.toString());
            }
        }
        return modes;
    }

    /** {@code "A:3,G:1"}, or {@value #EMPTY} when the tag has no entries. */
    public String format(String tag) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Long> entry : counts(tag).entrySet()) {
            parts.add(entry.getKey() + ":" + entry.getValue());
        }
        return parts.isEmpty() ? EMPTY : String.join(",", parts);
    }

    /**
     * Every entry of every tag except transition markers, e.g. {@code "I:M:2,A:V:1"},
     * or {@value #NOT_AVAILABLE} when there is nothing to report.
     */
    public String formatAll() {
        List<String> parts = new ArrayList<>();
        for (String tag : tables.keySet()) {
            for (Map.Entry<String, Long> entry : counts(tag).entrySet()) {
                if (!TRANSITION.equals(entry.getKey())) {
                    parts.add(entry.getKey() + ":" + entry.getValue());
                }
            }
        }
        return parts.isEmpty() ? NOT_AVAILABLE : String.join(",", parts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagFrequencyTable)) return false;
        TagFrequencyTable other = (TagFrequencyTable) o;
        if (!tables.keySet().equals(other.tables.keySet())) return false;
        for (String tag : tables.keySet()) {
            if (!counts(tag).equals(other.counts(tag))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (String tag : tables.keySet()) {
            hash += tag.hashCode() ^ counts(tag).hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (String tag : tables.keySet()) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(tag).append("=").append(counts(tag));
        }
        return sb.append("}").toString();
    }
}
