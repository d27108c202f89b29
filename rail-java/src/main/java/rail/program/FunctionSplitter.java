package rail.program;

import rail.lexer.LiteralReader;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a source document into function spans. A function starts at a
 * {@code $} in the first column of a line and runs until the next one;
 * anything before the first header is not part of any function.
 */
public final class FunctionSplitter {
    public static final char HEADER = '$';

    private FunctionSplitter() {}

    public static List<String> split(String source) {
        List<String> spans = new ArrayList<>();
        int start = -1;
        int lineStart = 0;

        while (lineStart <= source.length()) {
            if (lineStart < source.length() && source.charAt(lineStart) == HEADER) {
                if (start >= 0) spans.add(source.substring(start, lineStart - 1)); // без '\n'
                start = lineStart;
            }
            int nl = source.indexOf('\n', lineStart);
            if (nl < 0) break;
            lineStart = nl + 1;
        }
        if (start >= 0) spans.add(source.substring(start));
        return spans;
    }

    // открывающая ' должна быть в строке заголовка
    public static Optional<String> functionName(String span) {
        int i = 0;
        while (i < span.length() && span.charAt(i) != '\'') {
            if (span.charAt(i) == '\n') return Optional.empty();
            i++;
        }
        if (i >= span.length()) return Optional.empty();

        int begin = ++i;
        while (i < span.length() && LiteralReader.isNameChar(span.charAt(i))) i++;

        if (i < span.length() && span.charAt(i) == '\'') {
            return Optional.of(span.substring(begin, i));
        }
        return Optional.empty();
    }
}
