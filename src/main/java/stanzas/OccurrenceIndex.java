package stanzas;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scope ranges and attribute occurrences of a parsed document, built in one pass.
 */
final class OccurrenceIndex {

    private final List<Scope> scopes;
    private final Map<OccurrenceKey, List<Integer>> occurrences;

    private OccurrenceIndex(List<Scope> scopes, Map<OccurrenceKey, List<Integer>> occurrences) {
        this.scopes = scopes;
        this.occurrences = occurrences;
    }

    static OccurrenceIndex build(List<Line> lines) {
        List<Scope> scopes = new ArrayList<>();
        Map<OccurrenceKey, List<Integer>> occurrences = new HashMap<>();

        Scope current = new Scope(0, null, -1, 0);
        scopes.add(current);
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line.isStanza()) {
                current.end = i;
                current = new Scope(scopes.size(), line.name, i, i + 1);
                scopes.add(current);
            } else if (line.isAttribute()) {
                occurrences.computeIfAbsent(new OccurrenceKey(current.ordinal, line.name), k -> new ArrayList<>())
                        .add(i);
                current.lastAttribute = i;
            }
        }
        current.end = lines.size();
        return new OccurrenceIndex(scopes, occurrences);
    }

    Scope topLevel() {
        return scopes.get(0);
    }

    /**
     * @param stanza stanza name, {@code null} for the top-level scope
     * @return the first scope opened by a header with this name, or {@code null}
     */
    Scope findScope(String stanza) {
        if (stanza == null) {
            return topLevel();
        }
        for (int i = 1; i < scopes.size(); i++) {
            Scope scope = scopes.get(i);
            if (stanza.equals(scope.name)) {
                return scope;
            }
        }
        return null;
    }

    /**
     * Every scope opened by a header with this name, in file order; the top-level scope alone for {@code null}.
     */
    List<Scope> findScopes(String stanza) {
        if (stanza == null) {
            return Collections.singletonList(topLevel());
        }
        List<Scope> found = new ArrayList<>();
        for (int i = 1; i < scopes.size(); i++) {
            if (stanza.equals(scopes.get(i).name)) {
                found.add(scopes.get(i));
            }
        }
        return found;
    }

    List<Integer> occurrences(Scope scope, String attribute) {
        List<Integer> found = occurrences.get(new OccurrenceKey(scope.ordinal, attribute));
        return found == null ? Collections.emptyList() : Collections.unmodifiableList(found);
    }

    List<Scope> scopes() {
        return Collections.unmodifiableList(scopes);
    }

    /**
     * Half-open line range {@code [start, end)} of one scope. For a stanza, {@code header} is the
     * index of its header line and {@code start} the line after it; the top-level scope has no header.
     */
    static final class Scope {
        final int ordinal;
        final String name;
        final int header;
        final int start;
        int end;
        int lastAttribute = -1;

        Scope(int ordinal, String name, int header, int start) {
            this.ordinal = ordinal;
            this.name = name;
            this.header = header;
            this.start = start;
        }

        boolean isTopLevel() {
            return header < 0;
        }

        /**
         * Where new attribute lines go: right after the last attribute of the scope, else right after
         * the header, else at the top of the file.
         */
        int insertionPoint() {
            if (lastAttribute >= 0) {
                return lastAttribute + 1;
            }
            return start;
        }
    }
}
