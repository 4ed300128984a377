package com.yongkangl.branchsites.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of a parsed tree. Each node owns its children; there is no parent link.
 * Fields are only written by {@link NewickParser}, so a parsed tree can be shared
 * between threads.
 */
public class TreeNode {
    private static final String SPECIAL_CHARACTERS = "()[]{}:;,'\" \t";

    private String name = "";
    private String branchAttribute = "";
    private String annotation = "";
    private String supportValue;
    private String tag;
    private final List<TreeNode> children;

    TreeNode() {
        this.children = new ArrayList<>();
    }

    void setName(String name) {
        this.name = name;
    }

    void setBranchAttribute(String branchAttribute) {
        this.branchAttribute = branchAttribute;
    }

    void setAnnotation(String annotation) {
        this.annotation = annotation;
    }

    void setSupportValue(String supportValue) {
        this.supportValue = supportValue;
    }

    void setTag(String tag) {
        this.tag = tag;
    }

    void addChild(TreeNode child) {
        children.add(child);
    }

    public String getName() {
        return name;
    }

    public String getBranchAttribute() {
        return branchAttribute;
    }

    public String getAnnotation() {
        return annotation;
    }

    /** Support value of an internal node read in bootstrap mode, {@code null} otherwise. */
    public String getSupportValue() {
        return supportValue;
    }

    public String getTag() {
        return tag;
    }

    public int getChildCount() {
        return children.size();
    }

    public TreeNode getChild(int i) {
        return children.get(i);
    }

    public List<TreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isTip() {
        return children.isEmpty();
    }

    public int countNodes() {
        int count = 1;
        for (TreeNode child : children) {
            count += child.countNodes();
        }
        return count;
    }

    /**
     * Newick text of this subtree with the closing {@code ;}. Reparsing it gives the same tree
     * only for input where every attribute and annotation follows its node's name.
     */
    public String constructNewick() {
        return this + ";";
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!children.isEmpty()) {
            sb.append("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(",");
                sb.append(children.get(i).toString());
            }
            sb.append(")");
        }
        if (supportValue != null) {
            sb.append(supportValue);
        } else {
            sb.append(quoteIfNeeded(name));
        }
        if (!annotation.isEmpty()) {
            sb.append("{").append(annotation).append("}");
        }
        if (!branchAttribute.isEmpty()) {
            sb.append(":").append(branchAttribute);
        }
        return sb.toString();
    }

    private static String quoteIfNeeded(String name) {
        for (int i = 0; i < name.length(); i++) {
            if (SPECIAL_CHARACTERS.indexOf(name.charAt(i)) >= 0) {
                return "'" + name.replace("'", "''") + "'";
            }
        }
        return name;
    }
}
