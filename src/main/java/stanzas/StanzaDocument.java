package stanzas;

import java.util.Collections;
import java.util.List;

final class StanzaDocument {
    final String source;
    final List<Line> lines;
    final String lineSeparator;

    StanzaDocument(String source, List<Line> lines, String lineSeparator) {
        this.source = source;
        this.lines = Collections.unmodifiableList(lines);
        this.lineSeparator = lineSeparator;
    }
}
