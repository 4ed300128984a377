package com.yongkangl.branchsites.substitution;

import com.yongkangl.branchsites.io.NewickParseResult;
import com.yongkangl.branchsites.io.NewickParser;
import com.yongkangl.branchsites.io.SiteCodonReader;
import com.yongkangl.branchsites.io.TagRules;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;

public class SiteReportTest {
    private NewickParseResult tree;
    private SiteCodonReader sites;
    private SiteReport report;

    @Before
    public void setUp() throws Exception {
        tree = NewickParser.parse("(((Human_FG:0.1,Chimp:0.1)Node1:0.2,Gorilla:0.3):0.1,Mouse:0.9);", false,
                TagRules.parse(Collections.singletonList("FG=foreground")));
        sites = new SiteCodonReader(Paths.get(getClass().getResource("/primates_sites.json").toURI()).toString());
        report = new SiteReport(tree.getRoot(), new SubstitutionCounter(tree.getTags()));
    }

    @Test
    public void testSiteRows() {
        assertEquals("1\tI:2,M:2\tI:M:2\tI", report.siteRow(0, sites.querySite(0)));
        assertEquals("2\tA:3,D:1\tA:A:1,A:D:1\tA", report.siteRow(1, sites.querySite(1)));
    }

    @Test
    public void testSiteWithoutSubstitutions() {
        // no root codon, so no edge has two codons to compare
        assertEquals("3\t-:1,?:1,W:2\tNA\tW", report.siteRow(2, sites.querySite(2)));
    }

    @Test
    public void testSiteWithoutCodons() {
        assertEquals("100\t?:4\tNA\t?", report.siteRow(99, sites.querySite(99)));
    }

    @Test
    public void testComparisonRows() {
        assertEquals(Arrays.asList(
                "1\tforeground\tM:1\tM\t1\tNA\ttrue",
                "1\tbackground\tI:2,M:1\tI\t2\tI\ttrue"),
                report.comparisonRows(0, sites.querySite(0)));
        assertEquals(Arrays.asList(
                "3\tforeground\t-:1\t-\t1\t-\ttrue",
                "3\tbackground\t?:1,W:2\tW\t2\t?,W\ttrue"),
                report.comparisonRows(2, sites.querySite(2)));
    }

    @Test
    public void testComparisonRowsWithLeafLabel() {
        SiteReport pooled = new SiteReport(tree.getRoot(),
                new SubstitutionCounter(tree.getTags(), SiteReport.ALL_LEAVES, false));
        assertEquals(Collections.singletonList("1\tall\tI:2,M:2\tI\t2\tI,M\tfalse"),
                pooled.comparisonRows(0, sites.querySite(0)));
    }

    @Test
    public void testHeaders() {
        assertEquals(4, SiteReport.SITE_HEADER.split("\t").length);
        assertEquals(7, SiteReport.COMPARISON_HEADER.split("\t").length);
    }
}
