package com.yongkangl.branchsites.substitution;

import com.yongkangl.branchsites.io.TreeNode;
import com.yongkangl.branchsites.util.GeneticCode;
import com.yongkangl.branchsites.util.Nucleotides;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.Map;

/**
 * Walks a parsed tree for one alignment site and accumulates leaf amino-acid composition
 * and parent to child amino-acid substitutions per tag.
 *
 * <p>A node takes the codon assigned to its name for the site, or inherits its parent's
 * codon when it has none. An edge whose two codons differ at a position where both carry
 * a valid base counts one substitution, keyed by the two translated residues in sorted
 * order ({@code "I:M"}) and filed under the child's tag. Edges crossing a tag boundary
 * are marked under {@code "parentTag->childTag"}.
 *
 * <p>The tree is only read. Codons travel down the recursion, so one tree can be walked
 * concurrently as long as every walk has its own tables.
 */
public class SubstitutionCounter {
    private final Map<String, String> labeler;
    private final String leafLabel;
    private final boolean ignoreLeaves;

    public SubstitutionCounter(Map<String, String> labeler) {
        this(labeler, null, false);
    }

    /**
     * @param labeler      node name to tag, normally the map recorded while parsing
     * @param leafLabel    when set, every leaf is counted under this tag
     * @param ignoreLeaves count each leaf under its parent's tag; ignored when
     *                     {@code leafLabel} is set
     */
    public SubstitutionCounter(Map<String, String> labeler, String leafLabel, boolean ignoreLeaves) {
        this.labeler = labeler == null ? Collections.emptyMap() : labeler;
        this.leafLabel = StringUtils.isEmpty(leafLabel) ? null : leafLabel;
        this.ignoreLeaves = ignoreLeaves;
    }

    public void traverse(TreeNode root, Map<String, String> siteCodons,
                         TagFrequencyTable composition, TagFrequencyTable substitutions) {
        Validate.notNull(root, "root");
        Validate.notNull(siteCodons, "siteCodons");
        Validate.notNull(composition, "composition");
        Validate.notNull(substitutions, "substitutions");
        visit(root, null, "", siteCodons, composition, substitutions);
    }

    private void visit(TreeNode node, TreeNode parent, String parentCodon, Map<String, String> siteCodons,
                       TagFrequencyTable composition, TagFrequencyTable substitutions) {
        String tag = tagOf(node);

        if (parent != null && !StringUtils.equals(parent.getTag(), node.getTag())) {
            substitutions.mark(parent.getTag() + "->" + node.getTag(), TagFrequencyTable.TRANSITION);
        }

        String codon = siteCodons.get(node.getName());
        if (codon == null) {
            codon = parentCodon;
        } else if (parent != null && !parentCodon.isEmpty() && !codon.isEmpty()
                && Nucleotides.countDifferences(parentCodon, codon) > 0) {
            substitutions.increment(tag, substitutionKey(parentCodon, codon));
        }

        if (node.isTip()) {
            composition.increment(compositionTag(tag, parent), GeneticCode.translate(codon));
        }

        for (int i = 0; i < node.getChildCount(); i++) {
            visit(node.getChild(i), node, codon, siteCodons, composition, substitutions);
        }
    }

    private String tagOf(TreeNode node) {
        String name = node.getName();
        if (!name.isEmpty() && labeler.containsKey(name)) {
            return labeler.get(name);
        }
        return node.getTag();
    }

    private String compositionTag(String tag, TreeNode parent) {
        if (leafLabel != null) {
            return leafLabel;
        }
        if (ignoreLeaves && parent != null) {
            return parent.getTag();
        }
        return tag;
    }

    /** Translated residues of both codons in sorted order, joined by {@code :}. */
    static String substitutionKey(String fromCodon, String toCodon) {
        String from = GeneticCode.translate(fromCodon);
        String to = GeneticCode.translate(toCodon);
        return from.compareTo(to) < 0 ? from + ":" + to : to + ":" + from;
    }
}
