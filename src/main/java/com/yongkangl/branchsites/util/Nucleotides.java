package com.yongkangl.branchsites.util;

public final class Nucleotides {
    private static final String BASES = "ACGT";

    private Nucleotides() {
    }

    public static boolean isBase(char c) {
        return BASES.indexOf(c) >= 0;
    }

    /**
     * Number of positions at which both codons carry a valid base and the bases differ.
     * Positions past the end of the shorter codon are not compared.
     */
    public static int countDifferences(String from, String to) {
        int length = Math.min(from.length(), to.length());
        int differences = 0;
        for (int i = 0; i < length; i++) {
            char a = from.charAt(i);
            char b = to.charAt(i);
            if (isBase(a) && isBase(b) && a != b) {
                differences++;
            }
        }
        return differences;
    }
}
