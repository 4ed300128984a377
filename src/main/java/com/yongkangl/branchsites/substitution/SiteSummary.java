package com.yongkangl.branchsites.substitution;

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-site statistics derived from a composition table: majority residues and how one
 * group's residues compare with those of the other groups.
 */
public class SiteSummary {
    private final TagFrequencyTable composition;

    public SiteSummary(TagFrequencyTable composition) {
        this.composition = composition;
    }

    /** Alphabetically first on ties, {@value TagFrequencyTable#EMPTY} when the tag has no leaves. */
    public String majorityResidue(String tag) {
        List<String> modes = composition.modes(tag);
        return modes.isEmpty() ? TagFrequencyTable.EMPTY : modes.get(0);
    }

    public int diversity(String tag) {
        return composition.counts(tag).size();
    }

    public SortedSet<String> uniqueResidues(String focalTag, Collection<String> otherTags) {
        SortedSet<String> unique = new TreeSet<>(composition.counts(focalTag).keySet());
        for (String other : otherTags) {
            if (!other.equals(focalTag)) {
                unique.removeAll(composition.counts(other).keySet());
            }
        }
        return unique;
    }

    // groups without leaves are left out of the comparison
    public boolean hasDifferentMajority(String focalTag, Collection<String> otherTags) {
        if (composition.getTotal(focalTag) == 0) {
            return false;
        }
        String focalMajority = majorityResidue(focalTag);
        for (String other : otherTags) {
            if (other.equals(focalTag) || composition.getTotal(other) == 0) {
                continue;
            }
            if (!focalMajority.equals(majorityResidue(other))) {
                return true;
            }
        }
        return false;
    }
}
