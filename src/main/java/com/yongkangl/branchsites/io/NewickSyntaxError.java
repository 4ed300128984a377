package com.yongkangl.branchsites.io;

/**
 * Position and surrounding text of the first character the parser could not accept.
 */
public final class NewickSyntaxError {
    static final int CONTEXT_WIDTH = 20;

    private final int offset;
    private final char character;
    private final String before;
    private final String after;

    private NewickSyntaxError(int offset, char character, String before, String after) {
        this.offset = offset;
        this.character = character;
        this.before = before;
        this.after = after;
    }

    static NewickSyntaxError at(String input, int offset) {
        if (input.isEmpty()) {
            return new NewickSyntaxError(0, ' ', "", "");
        }
        int position = Math.max(0, Math.min(offset, input.length() - 1));
        String before = input.substring(Math.max(0, position - CONTEXT_WIDTH), position);
        String after = input.substring(position + 1, Math.min(input.length(), position + 1 + CONTEXT_WIDTH));
        return new NewickSyntaxError(position, input.charAt(position), before, after);
    }

    public int getOffset() {
        return offset;
    }

    public char getCharacter() {
        return character;
    }

    public String getContextBefore() {
        return before;
    }

    public String getContextAfter() {
        return after;
    }

    public String getMessage() {
        return "Unexpected '" + character + "' in '" + before + character + "[ERROR HERE]" + after + "'";
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
