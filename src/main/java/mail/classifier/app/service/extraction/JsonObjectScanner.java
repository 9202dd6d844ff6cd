package mail.classifier.app.service.extraction;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Finds the first balanced JSON object or array inside free text.
 *
 * <p>Tracks three pieces of state: whether the cursor is inside a string literal, whether
 * the previous character was a backslash escape, and a stack of open brackets. Brackets
 * inside strings are ignored. A closer that does not match the innermost opener, or a
 * closer with nothing open, ends the scan with no result.
 */
public final class JsonObjectScanner {

    private JsonObjectScanner() {
    }

    public static Optional<String> firstComplete(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        int start = -1;
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (start < 0) {
                if (ch == '{' || ch == '[') {
                    start = i;
                    open.push(ch);
                }
                continue;
            }
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            switch (ch) {
                case '"':
                    inString = true;
                    break;
                case '{':
                case '[':
                    open.push(ch);
                    break;
                case '}':
                case ']':
                    if (open.isEmpty()) {
                        return Optional.empty();
                    }
                    char opener = open.pop();
                    if ((opener == '{' && ch != '}') || (opener == '[' && ch != ']')) {
                        return Optional.empty();
                    }
                    if (open.isEmpty()) {
                        return Optional.of(text.substring(start, i + 1));
                    }
                    break;
                default:
                    break;
            }
        }
        return Optional.empty();
    }

    /**
     * Removes a leading ```lang fence and its closing fence, if present.
     */
    public static String stripCodeFences(String text) {
        if (text == null) {
            return "";
        }
        String s = text.strip();
        if (!s.startsWith("```")) {
            return s;
        }
        String[] lines = s.split("\\R", -1);
        int from = 1;
        int to = lines.length;
        if (to > from && lines[to - 1].strip().startsWith("```")) {
            to--;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (i > from) {
                sb.append('\n');
            }
            sb.append(lines[i]);
        }
        return sb.toString().strip();
    }
}
