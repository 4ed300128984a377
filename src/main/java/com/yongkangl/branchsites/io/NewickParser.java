package com.yongkangl.branchsites.io;

import org.apache.commons.lang3.Validate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Character-level state machine for Newick trees.
 *
 * <p>Names may be quoted with {@code '} or {@code "}; a doubled delimiter inside a quoted
 * name stands for one literal delimiter. Text after {@code :} is kept verbatim as the
 * branch attribute and text inside {@code {...}} as the annotation. Every node is tagged
 * with {@link TagRules} as soon as its definition completes, and the name/tag pair is
 * recorded in the result. In bootstrap mode the unquoted text after an internal node's
 * closing parenthesis is its support value instead of its name.
 *
 * <p>A parser instance reads one input; it is not thread-safe, but separate instances
 * share nothing.
 */
public class NewickParser {
    public static final String ROOT_NAME = "root";

    private enum State {
        AWAITING_ROOT,
        BODY,
        QUOTED_NAME,
        BRANCH_LENGTH,
        ANNOTATION
    }

    private final String input;
    private final boolean bootstrapValues;
    private final TagRules tagRules;

    private State state;
    private final StringBuilder name = new StringBuilder();
    private final StringBuilder attribute = new StringBuilder();
    private final StringBuilder annotation = new StringBuilder();
    private boolean quotedName;
    private char quoteDelimiter;
    private final Deque<TreeNode> cladeStack = new ArrayDeque<>();
    private final Map<String, String> tags = new LinkedHashMap<>();

    public NewickParser(String input) {
        this(input, false, TagRules.none());
    }

    public NewickParser(String input, boolean bootstrapValues, TagRules tagRules) {
        this.input = Validate.notNull(input, "input");
        this.bootstrapValues = bootstrapValues;
        this.tagRules = Validate.notNull(tagRules, "tagRules");
    }

    public static NewickParseResult parse(String input, boolean bootstrapValues, TagRules tagRules) {
        return new NewickParser(input, bootstrapValues, tagRules).parse();
    }

    public NewickParseResult parse() {
        Validate.validState(state == null, "NewickParser instances parse a single input");
        state = State.AWAITING_ROOT;
        TreeNode root = new TreeNode();
        cladeStack.push(root);

        int position = 0;
        scan:
        while (position < input.length()) {
            char current = input.charAt(position);
            switch (state) {
                case AWAITING_ROOT:
                    if (current == '(') {
                        openChild();
                        state = State.BODY;
                    }
                    break;
                case BODY:
                case BRANCH_LENGTH:
                    if (current == ':') {
                        state = State.BRANCH_LENGTH;
                    } else if (current == ',' || current == ')') {
                        if (cladeStack.size() <= 1) {
                            return error(position);
                        }
                        finishNodeDefinition();
                        state = State.BODY;
                        if (current == ',') {
                            openChild();
                        }
                    } else if (current == '(') {
                        if (name.length() > 0) {
                            return error(position);
                        }
                        openChild();
                    } else if (current == '\'' || current == '"') {
                        if (state != State.BODY || name.length() > 0 || attribute.length() > 0
                                || annotation.length() > 0) {
                            return error(position);
                        }
                        quoteDelimiter = current;
                        quotedName = true;
                        state = State.QUOTED_NAME;
                    } else if (current == '{') {
                        if (annotation.length() > 0) {
                            return error(position);
                        }
                        state = State.ANNOTATION;
                    } else if (current == ';') {
                        break scan;
                    } else if (!Character.isWhitespace(current)) {
                        if (state == State.BRANCH_LENGTH) {
                            attribute.append(current);
                        } else {
                            name.append(current);
                        }
                    }
                    break;
                case QUOTED_NAME:
                    if (current == quoteDelimiter) {
                        if (position + 1 < input.length() && input.charAt(position + 1) == quoteDelimiter) {
                            name.append(quoteDelimiter);
                            position++;
                        } else {
                            state = State.BODY;
                        }
                    } else {
                        name.append(current);
                    }
                    break;
                case ANNOTATION:
                    if (current == '}') {
                        state = State.BRANCH_LENGTH;
                    } else if (current == '{') {
                        return error(position);
                    } else {
                        annotation.append(current);
                    }
                    break;
                default:
                    return error(position);
            }
            position++;
        }

        if (cladeStack.size() != 1 || state == State.QUOTED_NAME || state == State.ANNOTATION) {
            return error(input.length() - 1);
        }
        finishRoot(root);
        return NewickParseResult.success(root, tags);
    }

    private void openChild() {
        TreeNode child = new TreeNode();
        cladeStack.peek().addChild(child);
        cladeStack.push(child);
    }

    private void finishNodeDefinition() {
        TreeNode node = cladeStack.pop();
        applyPendingText(node, "");
        recordTag(node);
        clearBuffers();
    }

    private void finishRoot(TreeNode root) {
        applyPendingText(root, ROOT_NAME);
        recordTag(root);
        clearBuffers();
    }

    private void applyPendingText(TreeNode node, String defaultName) {
        String text = name.toString();
        if (bootstrapValues && !node.isTip() && !quotedName) {
            node.setName(defaultName);
            if (!text.isEmpty()) {
                node.setSupportValue(text);
            }
        } else {
            node.setName(text.isEmpty() ? defaultName : text);
        }
        node.setBranchAttribute(attribute.toString());
        node.setAnnotation(annotation.toString());
    }

    private void recordTag(TreeNode node) {
        String tag = tagRules.resolve(node.getName(), !node.isTip());
        node.setTag(tag);
        tags.put(node.getName(), tag);
    }

    private void clearBuffers() {
        name.setLength(0);
        attribute.setLength(0);
        annotation.setLength(0);
        quotedName = false;
    }

    private NewickParseResult error(int position) {
        return NewickParseResult.failure(NewickSyntaxError.at(input, position));
    }
}
