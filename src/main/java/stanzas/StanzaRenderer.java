package stanzas;

import org.apache.commons.lang3.StringUtils;

import java.util.List;

final class StanzaRenderer {

    static final String INDENT = "  ";

    private StanzaRenderer() {
    }

    static Line header(String stanza) {
        return Line.stanza(stanza + ":", stanza);
    }

    static Line separator() {
        return Line.blank("");
    }

    static Line attribute(String name, String value, boolean topLevel, boolean noExtraSpaces) {
        StringBuilder sb = new StringBuilder();
        if (!topLevel) {
            sb.append(INDENT);
        }
        sb.append(name);
        if (value != null) {
            sb.append(noExtraSpaces ? "=" : " = ").append(value);
        }
        return Line.attribute(sb.toString(), name, value);
    }

    /**
     * Parsed lines keep their own line ending; new lines, and a last line that had none, get {@code ls}.
     */
    static String render(List<Line> lines, String ls) {
        if (lines.isEmpty()) {
            return ls;
        }
        StringBuilder out = new StringBuilder();
        for (Line line : lines) {
            out.append(line.text).append(StringUtils.defaultIfEmpty(line.terminator, ls));
        }
        return out.toString();
    }
}
