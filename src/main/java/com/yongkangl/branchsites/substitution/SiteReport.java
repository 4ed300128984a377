package com.yongkangl.branchsites.substitution;

import com.yongkangl.branchsites.io.TreeNode;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tab-separated report rows for one alignment site. Site numbers are printed 1-based.
 */
public class SiteReport {
    public static final String ALL_LEAVES = "all";
    public static final String SITE_HEADER = "site\tcomposition\tsubstitutions\tmajority_residue";
    public static final String COMPARISON_HEADER =
            "site\tgroup\tcomposition\tmajority_residue\taa_diversity\tunique_aas\thas_diff_majority";

    private final TreeNode root;
    private final SubstitutionCounter counter;

    public SiteReport(TreeNode root, SubstitutionCounter counter) {
        this.root = root;
        this.counter = counter;
    }

    public String siteRow(int site, Map<String, String> codons) {
        TagFrequencyTable composition = new TagFrequencyTable();
        TagFrequencyTable substitutions = new TagFrequencyTable();
        counter.traverse(root, codons, composition, substitutions);

        // every tree has at least one leaf, so the pooled composition is never empty
        TagFrequencyTable pooled = composition.pooled(ALL_LEAVES);
        String majority = new SiteSummary(pooled).majorityResidue(ALL_LEAVES);
        return (site + 1) + "\t" + pooled.format(ALL_LEAVES)
                + "\t" + substitutions.formatAll() + "\t" + majority;
    }

    /** One row per group that has leaves at this site, in the order groups were first seen. */
    public List<String> comparisonRows(int site, Map<String, String> codons) {
        TagFrequencyTable composition = new TagFrequencyTable();
        counter.traverse(root, codons, composition, new TagFrequencyTable());

        SiteSummary summary = new SiteSummary(composition);
        List<String> rows = new ArrayList<>();
        for (String group : composition.getTags()) {
            String unique = StringUtils.defaultIfEmpty(
                    StringUtils.join(summary.uniqueResidues(group, composition.getTags()), ','),
                    TagFrequencyTable.NOT_AVAILABLE);
            rows.add((site + 1) + "\t" + group + "\t" + composition.format(group)
                    + "\t" + summary.majorityResidue(group)
                    + "\t" + summary.diversity(group)
                    + "\t" + unique
                    + "\t" + summary.hasDifferentMajority(group, composition.getTags()));
        }
        return rows;
    }
}
