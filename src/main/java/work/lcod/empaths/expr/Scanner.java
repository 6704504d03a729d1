package work.lcod.empaths.expr;

import work.lcod.empaths.api.Resolution;

/**
 * Byte-level scanning of string literals and bare identifiers.
 *
 * <p>Path syntax is ASCII; literal content is copied through untouched, so any text can appear
 * between the quotes.
 */
final class Scanner {
    private Scanner() {}

    /**
     * Reads a literal whose opening quote sits at {@code index}. A backslash makes the next
     * character literal. An unterminated literal runs to the end of the path.
     */
    static Resolution readLiteral(String path, int index, char quote) {
        index++;
        int start = index;
        boolean escaping = false;
        boolean hasEscapes = false;

        while (index < path.length()) {
            char c = path.charAt(index);
            if (escaping) {
                escaping = false;
                hasEscapes = true;
                index++;
                continue;
            }
            if (c == quote) {
                break;
            }
            if (c == '\\') {
                escaping = true;
            }
            index++;
        }

        if (!hasEscapes) {
            return new Resolution(path.substring(start, index), index + 1);
        }

        var sb = new StringBuilder(index - start);
        escaping = false;
        for (int i = start; i < index; i++) {
            char c = path.charAt(i);
            if (escaping) {
                escaping = false;
                sb.append(c);
                continue;
            }
            if (c == '\\') {
                escaping = true;
                continue;
            }
            sb.append(c);
        }
        return new Resolution(sb.toString(), index + 1);
    }

    /**
     * Reads from {@code index} up to the next space, {@code !} or {@code =}.
     */
    static Resolution readUntilTerminator(String path, int index) {
        int start = index;
        while (index < path.length()) {
            char c = path.charAt(index);
            if (c == ' ' || c == '!' || c == '=') {
                break;
            }
            index++;
        }
        return new Resolution(path.substring(start, index), index);
    }
}
