package stanzas;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies every physical line as blank, comment, stanza header or attribute.
 * No line is ever rejected: anything that is not blank, a comment or a header is an attribute.
 */
final class StanzaParser {

    private static final Pattern STANZA_PATTERN = Pattern.compile("^([^\\s=]+):[ \\t]*$");

    StanzaDocument parse(String text) {
        StanzaText parsed = StanzaText.from(text);
        List<Line> lines = new ArrayList<>(parsed.lines.size() + 1);
        for (int i = 0; i < parsed.lines.size(); i++) {
            lines.add(classify(parsed.lines.get(i)).terminatedBy(parsed.terminators.get(i)));
        }
        // an empty file still has one (blank) line
        if (lines.isEmpty()) {
            lines.add(Line.blank(StringUtils.EMPTY));
        }
        return new StanzaDocument(parsed.source, lines, parsed.lineSeparator);
    }

    static Line classify(String rawLine) {
        if (StringUtils.isBlank(rawLine)) {
            return Line.blank(rawLine);
        }

        String leftTrimmed = StringUtils.stripStart(rawLine, null);
        if (isCommentLine(leftTrimmed)) {
            return Line.comment(rawLine);
        }

        String stanza = extractStanzaName(rawLine);
        if (stanza != null) {
            return Line.stanza(rawLine, stanza);
        }

        int eq = rawLine.indexOf('=');
        if (eq < 0) {
            return Line.attribute(rawLine, rawLine.trim(), null);
        }
        String name = rawLine.substring(0, eq).trim();
        String value = rawLine.substring(eq + 1).trim();
        return Line.attribute(rawLine, name, value);
    }

    static boolean isCommentLine(String trimmedLeft) {
        return trimmedLeft.startsWith("#") || trimmedLeft.startsWith(";");
    }

    static String extractStanzaName(String rawLine) {
        Matcher matcher = STANZA_PATTERN.matcher(rawLine);
        if (!matcher.matches()) {
            return null;
        }
        return matcher.group(1);
    }
}
