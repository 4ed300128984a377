package com.yongkangl.branchsites.util;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Standard genetic code. Translation never fails: the gap codon becomes {@link #GAP}
 * and anything that is not one of the 64 sense/stop codons becomes {@link #UNKNOWN}.
 */
public final class GeneticCode {
    public static final String GAP = "-";
    public static final String UNKNOWN = "?";
    public static final String STOP = "*";

    private static final String GAP_CODON = "---";
    private static final Map<String, String> TABLE;

    static {
        // TCAG ordering, first position varies slowest
        String bases = "TCAG";
        String aminoAcids = "FFLLSSSSYY**CC*W"
                + "LLLLPPPPHHQQRRRR"
                + "IIIMTTTTNNKKSSRR"
                + "VVVVAAAADDEEGGGG";
        Map<String, String> table = new HashMap<>();
        int index = 0;
        for (int first = 0; first < 4; first++) {
            for (int second = 0; second < 4; second++) {
                for (int third = 0; third < 4; third++) {
                    String codon = "" + bases.charAt(first) + bases.charAt(second) + bases.charAt(third);
                    table.put(codon, String.valueOf(aminoAcids.charAt(index++)));
                }
            }
        }
        table.put(GAP_CODON, GAP);
        TABLE = Collections.unmodifiableMap(table);
    }

    private GeneticCode() {
    }

    public static String translate(String codon) {
        if (codon == null) {
            return UNKNOWN;
        }
        return TABLE.getOrDefault(codon, UNKNOWN);
    }
}
