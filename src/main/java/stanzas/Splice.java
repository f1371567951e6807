package stanzas;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Deletions and insertions addressed by positions in the original line list, so recording
 * an edit never shifts the positions of the next one. Lines inserted at {@code i} come out
 * just before original line {@code i}.
 */
final class Splice {

    private final Set<Integer> deletions = new TreeSet<>();
    private final Map<Integer, List<Line>> insertions = new TreeMap<>();

    void delete(int index) {
        deletions.add(index);
    }

    void deleteRange(int from, int to) {
        for (int i = from; i < to; i++) {
            deletions.add(i);
        }
    }

    void insert(int position, List<Line> lines) {
        insertions.computeIfAbsent(position, k -> new ArrayList<>()).addAll(lines);
    }

    boolean isEmpty() {
        return deletions.isEmpty() && insertions.isEmpty();
    }

    List<Line> applyTo(List<Line> lines) {
        List<Line> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            List<Line> inserted = insertions.get(i);
            if (inserted != null) {
                result.addAll(inserted);
            }
            if (!deletions.contains(i)) {
                result.add(lines.get(i));
            }
        }
        List<Line> tail = insertions.get(lines.size());
        if (tail != null) {
            result.addAll(tail);
        }
        return result;
    }
}
