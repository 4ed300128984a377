import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.yongkangl.branchsites.io.NewickParseResult;
import com.yongkangl.branchsites.io.NewickParser;
import com.yongkangl.branchsites.io.SiteCodonReader;
import com.yongkangl.branchsites.io.TagRules;
import com.yongkangl.branchsites.io.TreeNode;
import com.yongkangl.branchsites.substitution.SiteReport;
import com.yongkangl.branchsites.substitution.SubstitutionCounter;
import org.apache.commons.cli.*;

public class BranchSiteStats {
    public static void main(String[] args) {
        Options options = new Options();
        options.addOption(Option.builder("t").longOpt("tree").hasArg().required().desc("Newick tree file").build());
        options.addOption(Option.builder("s").longOpt("sites").hasArg().required().desc("Per-site codon map (JSON)").build());
        options.addOption("b", "bootstrap", false, "Read internal node labels as bootstrap values");
        options.addOption(Option.builder("r").longOpt("rule").hasArgs().desc("Tag rule substring=tag, in priority order").build());
        options.addOption("l", "leaf-label", true, "Count every leaf under this tag");
        options.addOption("i", "ignore-leaves", false, "Count leaves under their parent's tag");
        options.addOption("c", "comparison", false, "Report per-group statistics instead of per-site rows");
        options.addOption("p", "threads", true, "Number of worker threads");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = null;

        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            System.err.println("Error parsing command line: " + e.getMessage());
            new HelpFormatter().printHelp("BranchSiteStats", options);
            System.exit(1);
        }

        int threads = 1;
        if (cmd.hasOption("threads")) {
            try {
                threads = Integer.parseInt(cmd.getOptionValue("threads"));
            } catch (NumberFormatException e) {
                System.err.println("Invalid number for threads");
                System.exit(1);
            }
            if (threads < 1) {
                System.err.println("Number of threads must be positive");
                System.exit(1);
            }
        }

        TagRules tagRules = TagRules.none();
        if (cmd.hasOption("rule")) {
            try {
                tagRules = TagRules.parse(Arrays.asList(cmd.getOptionValues("rule")));
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                System.exit(1);
            }
        }

        String treeText = "";
        try (BufferedReader reader = new BufferedReader(new FileReader(cmd.getOptionValue("tree")))) {
            StringBuilder sb = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                sb.append(line).append('\n');
            }
            treeText = sb.toString();
        } catch (IOException e) {
            System.err.println("Error reading file: " + e.getMessage());
            System.exit(1);
        }

        SiteCodonReader siteReader = null;
        try {
            siteReader = new SiteCodonReader(cmd.getOptionValue("sites"));
        } catch (IOException e) {
            System.err.println("Error reading site codons: " + e.getMessage());
            System.exit(1);
        }

        NewickParseResult parsed = NewickParser.parse(treeText, cmd.hasOption("bootstrap"), tagRules);
        if (!parsed.isSuccess()) {
            System.err.println("Error parsing tree at offset " + parsed.getError().getOffset() + ": "
                    + parsed.getError().getMessage());
            System.exit(1);
        }
        TreeNode root = parsed.getRoot();
        System.err.println("Parsed tree with " + root.countNodes() + " nodes, "
                + siteReader.getSiteCount() + " sites");

        SubstitutionCounter counter = new SubstitutionCounter(parsed.getTags(),
                cmd.getOptionValue("leaf-label"), cmd.hasOption("ignore-leaves"));
        boolean comparison = cmd.hasOption("comparison");
        SiteReport report = new SiteReport(root, counter);

        List<Integer> sites = new ArrayList<>(siteReader.getSites());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<String>>> rows = new ArrayList<>();
            for (int site : sites) {
                Map<String, String> codons = siteReader.querySite(site);
                rows.add(executor.submit(() -> comparison
                        ? report.comparisonRows(site, codons)
                        : Collections.singletonList(report.siteRow(site, codons))));
            }
            System.out.println(comparison ? SiteReport.COMPARISON_HEADER : SiteReport.SITE_HEADER);
            for (Future<List<String>> row : rows) {
                for (String line : row.get()) {
                    System.out.println(line);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted while processing sites");
            System.exit(1);
        } catch (ExecutionException e) {
            System.err.println("Error processing site: " + e.getCause());
            System.exit(1);
        } finally {
            executor.shutdown();
        }
    }
}
