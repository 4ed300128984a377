package com.yongkangl.branchsites.io;

import java.util.Collections;
import java.util.Map;

/**
 * Either a parsed tree together with the name to tag map recorded while parsing,
 * or the syntax error that stopped the parser.
 */
public final class NewickParseResult {
    private final TreeNode root;
    private final Map<String, String> tags;
    private final NewickSyntaxError error;

    private NewickParseResult(TreeNode root, Map<String, String> tags, NewickSyntaxError error) {
        this.root = root;
        this.tags = tags;
        this.error = error;
    }

    static NewickParseResult success(TreeNode root, Map<String, String> tags) {
        return new NewickParseResult(root, Collections.unmodifiableMap(tags), null);
    }

    static NewickParseResult failure(NewickSyntaxError error) {
        return new NewickParseResult(null, Collections.emptyMap(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public TreeNode getRoot() {
        if (error != null) {
            throw new IllegalStateException("Tree could not be parsed: " + error.getMessage());
        }
        return root;
    }

    /** Node name to tag, in the order node definitions completed. Empty on failure. */
    public Map<String, String> getTags() {
        return tags;
    }

    public NewickSyntaxError getError() {
        return error;
    }
}
