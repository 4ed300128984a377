package com.yongkangl.branchsites.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reads per-site codon assignments, one map of node name to codon per alignment site.
 * Accepts either the site map itself, {@code {"0": {"Node1": "ATG", ...}, "1": ...}},
 * or a whole results document, in which case the map under {@code substitutions/0} is used.
 */
public class SiteCodonReader {
    private final SortedMap<Integer, Map<String, String>> sites;

    public SiteCodonReader(String filePath) throws IOException {
        this(new ObjectMapper().readTree(new File(filePath)));
    }

    public SiteCodonReader(JsonNode document) throws IOException {
        JsonNode siteMap = document;
        if (document.has("substitutions")) {
            siteMap = document.path("substitutions").path("0");
        }
        if (!siteMap.isObject()) {
            throw new IOException("Expected an object of per-site codon maps");
        }

        ObjectMapper mapper = new ObjectMapper();
        Map<String, Map<String, String>> raw;
        try {
            raw = mapper.convertValue(siteMap, new TypeReference<LinkedHashMap<String, Map<String, String>>>() {});
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed per-site codon map: " + e.getMessage(), e);
        }

        sites = new TreeMap<>();
        for (Map.Entry<String, Map<String, String>> e : raw.entrySet()) {
            int site;
            try {
                site = Integer.parseInt(e.getKey().trim());
            } catch (NumberFormatException ex) {
                throw new IOException("Invalid site index: " + e.getKey(), ex);
            }
            Map<String, String> codons = e.getValue() == null ? Collections.emptyMap() : e.getValue();
            sites.put(site, Collections.unmodifiableMap(new LinkedHashMap<>(codons)));
        }
    }

    public Set<Integer> getSites() {
        return Collections.unmodifiableSet(sites.keySet());
    }

    public Map<String, String> querySite(int site) {
        return sites.getOrDefault(site, Collections.emptyMap());
    }

    public int getSiteCount() {
        return sites.size();
    }
}
