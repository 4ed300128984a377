package com.yongkangl.branchsites.io;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered name-substring to tag rules. The first rule whose substring occurs in a
 * node name decides the tag of that node.
 */
public class TagRules {
    public static final String DEFAULT_INTERNAL_TAG = "test";
    public static final String DEFAULT_LEAF_TAG = "background";

    private static final TagRules NONE = new TagRules(new LinkedHashMap<>());

    private final Map<String, String> triggers;

    private TagRules(LinkedHashMap<String, String> triggers) {
        this.triggers = Collections.unmodifiableMap(triggers);
    }

    public static TagRules none() {
        return NONE;
    }

    public static TagRules of(Map<String, String> triggers) {
        Validate.notNull(triggers, "triggers");
        return new TagRules(new LinkedHashMap<>(triggers));
    }

    /**
     * Reads rules written as {@code substring=tag}, keeping their order.
     */
    public static TagRules parse(List<String> rules) {
        LinkedHashMap<String, String> triggers = new LinkedHashMap<>();
        for (String rule : rules) {
            if (!StringUtils.contains(rule, '=')) {
                throw new IllegalArgumentException("Tag rule must look like substring=tag: " + rule);
            }
            String tag = StringUtils.substringAfterLast(rule, "=");
            if (tag.isEmpty()) {
                throw new IllegalArgumentException("Tag rule has an empty tag: " + rule);
            }
            triggers.putIfAbsent(StringUtils.substringBeforeLast(rule, "="), tag);
        }
        return new TagRules(triggers);
    }

    /**
     * Tag of a node whose definition just completed. Unmatched internal nodes are
     * tagged {@value #DEFAULT_INTERNAL_TAG} and unmatched leaves {@value #DEFAULT_LEAF_TAG};
     * downstream group statistics rely on that split.
     */
    public String resolve(String name, boolean internal) {
        for (Map.Entry<String, String> trigger : triggers.entrySet()) {
            if (name.contains(trigger.getKey())) {
                return trigger.getValue();
            }
        }
        return internal ? DEFAULT_INTERNAL_TAG : DEFAULT_LEAF_TAG;
    }

    public Map<String, String> asMap() {
        return triggers;
    }

    public boolean isEmpty() {
        return triggers.isEmpty();
    }
}
