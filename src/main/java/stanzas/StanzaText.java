package stanzas;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw input cut into physical lines. Each line keeps the terminator it was written with
 * ({@code ""} for a last line without one).
 */
final class StanzaText {

    static final char BOM = '\uFEFF';

    private static final Pattern TERMINATOR = Pattern.compile("\r\n|\n|\r");
    private static final String DEFAULT_SEPARATOR = "\n";

    final String source;
    final List<String> lines;
    final List<String> terminators;
    final String lineSeparator;

    private StanzaText(String source, List<String> lines, List<String> terminators, String lineSeparator) {
        this.source = source;
        this.lines = lines;
        this.terminators = terminators;
        this.lineSeparator = lineSeparator;
    }

    /**
     * The line separator used for new lines is the first terminator in the text, {@code \n} if there is none.
     */
    static StanzaText from(String text) {
        String source = text == null ? "" : text;
        if (!source.isEmpty() && source.charAt(0) == BOM) {
            source = source.substring(1);
        }

        List<String> lines = new ArrayList<>();
        List<String> terminators = new ArrayList<>();
        Matcher matcher = TERMINATOR.matcher(source);
        int lineStart = 0;
        while (matcher.find()) {
            lines.add(source.substring(lineStart, matcher.start()));
            terminators.add(matcher.group());
            lineStart = matcher.end();
        }
        if (lineStart < source.length()) {
            lines.add(source.substring(lineStart));
            terminators.add("");
        }

        String separator = terminators.isEmpty() || terminators.get(0).isEmpty()
                ? DEFAULT_SEPARATOR
                : terminators.get(0);
        return new StanzaText(source, lines, terminators, separator);
    }
}
