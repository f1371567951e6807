package stanzas;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which edit satisfies an intent and records it as a {@link Splice}.
 */
final class StanzaMutator {

    static final String MISSING_VALUE_MESSAGE =
            "Parameter 'value(s)' must be defined if state=present and allow_no_value=False.";

    private static final Logger log = LoggerFactory.getLogger(StanzaMutator.class);

    Mutation mutate(StanzaDocument document, StanzaIntent intent) {
        List<Line> lines = document.lines;
        OccurrenceIndex index = OccurrenceIndex.build(lines);
        String stanza = StringUtils.isEmpty(intent.getStanza()) ? null : intent.getStanza();
        OccurrenceIndex.Scope scope = index.findScope(stanza);
        Splice splice = new Splice();

        ChangeReason reason;
        if (StringUtils.isEmpty(intent.getAttribute())) {
            reason = intent.getState() == State.ABSENT
                    ? removeStanza(lines, index.findScopes(stanza), splice)
                    : addStanza(lines, stanza, scope, splice);
        } else if (intent.getState() == State.ABSENT) {
            reason = removeAttribute(lines, index, scope, intent, splice);
        } else if (scope == null) {
            reason = addStanzaWithAttribute(lines, stanza, intent, splice);
        } else if (intent.isExclusive()) {
            reason = replaceAttribute(lines, index, scope, intent, splice);
        } else {
            reason = mergeAttribute(lines, index, scope, intent, splice);
        }

        log.debug("stanza={} attr={} state={} exclusive={} -> {}", stanza, intent.getAttribute(),
                intent.getState(), intent.isExclusive(), reason);
        return new Mutation(splice, reason);
    }

    private ChangeReason addStanza(List<Line> lines, String stanza, OccurrenceIndex.Scope scope, Splice splice) {
        if (scope != null) {
            return ChangeReason.OK;
        }
        splice.insert(lines.size(), newStanza(lines, stanza));
        return ChangeReason.ONLY_STANZA_ADDED;
    }

    /**
     * Removes every stanza with the name, duplicates included.
     */
    private ChangeReason removeStanza(List<Line> lines, List<OccurrenceIndex.Scope> scopes, Splice splice) {
        for (OccurrenceIndex.Scope scope : scopes) {
            if (scope.isTopLevel() && lines.subList(scope.start, scope.end).stream().allMatch(Line::isBlank)) {
                continue;
            }
            int from = scope.isTopLevel() ? scope.start : scope.header;
            splice.deleteRange(from, scope.end);
        }
        return splice.isEmpty() ? ChangeReason.OK : ChangeReason.STANZA_REMOVED;
    }

    private ChangeReason addStanzaWithAttribute(List<Line> lines, String stanza, StanzaIntent intent, Splice splice) {
        List<Line> added = newStanza(lines, stanza);
        added.addAll(render(intent, desiredValues(intent), false));
        splice.insert(lines.size(), added);
        return ChangeReason.STANZA_AND_ATTR_ADDED;
    }

    /**
     * The attribute's value set must become exactly the desired one. Occurrences holding a desired
     * value stay where they are; missing values go right after the last one kept.
     */
    private ChangeReason replaceAttribute(List<Line> lines, OccurrenceIndex index, OccurrenceIndex.Scope scope,
                                          StanzaIntent intent, Splice splice) {
        Set<String> desired = desiredValues(intent);
        List<Integer> found = index.occurrences(scope, intent.getAttribute());
        if (found.isEmpty()) {
            splice.insert(scope.insertionPoint(), render(intent, desired, scope.isTopLevel()));
            return ChangeReason.ATTR_ADDED;
        }

        Set<String> current = currentValues(lines, found);
        if (current.equals(desired)) {
            return ChangeReason.OK;
        }

        Set<String> retained = new LinkedHashSet<>();
        int lastRetained = -1;
        for (int i : found) {
            String value = lines.get(i).value;
            if (desired.contains(value)) {
                retained.add(value);
                lastRetained = i;
            } else {
                splice.delete(i);
            }
        }

        Set<String> missing = new LinkedHashSet<>(desired);
        missing.removeAll(retained);
        int position = lastRetained < 0 ? found.get(0) : lastRetained + 1;
        splice.insert(position, render(intent, missing, scope.isTopLevel()));
        return ChangeReason.ATTR_CHANGED;
    }

    private ChangeReason mergeAttribute(List<Line> lines, OccurrenceIndex index, OccurrenceIndex.Scope scope,
                                        StanzaIntent intent, Splice splice) {
        List<Integer> found = index.occurrences(scope, intent.getAttribute());
        Set<String> missing = desiredValues(intent);
        missing.removeAll(currentValues(lines, found));
        if (missing.isEmpty()) {
            return ChangeReason.OK;
        }
        splice.insert(scope.insertionPoint(), render(intent, missing, scope.isTopLevel()));
        return ChangeReason.ATTR_ADDED;
    }

    private ChangeReason removeAttribute(List<Line> lines, OccurrenceIndex index, OccurrenceIndex.Scope scope,
                                         StanzaIntent intent, Splice splice) {
        if (scope == null) {
            return ChangeReason.OK;
        }
        List<Integer> found = index.occurrences(scope, intent.getAttribute());
        if (intent.isExclusive()) {
            found.forEach(splice::delete);
        } else {
            Set<String> targets = dedupe(intent.getValues());
            for (int i : found) {
                if (targets.contains(lines.get(i).value)) {
                    splice.delete(i);
                }
            }
        }
        return splice.isEmpty() ? ChangeReason.OK : ChangeReason.ATTR_CHANGED;
    }

    private static List<Line> newStanza(List<Line> lines, String stanza) {
        List<Line> added = new ArrayList<>();
        if (lines.isEmpty() || !lines.get(lines.size() - 1).isBlank()) {
            added.add(StanzaRenderer.separator());
        }
        added.add(StanzaRenderer.header(stanza));
        return added;
    }

    private static List<Line> render(StanzaIntent intent, Collection<String> values, boolean topLevel) {
        List<Line> rendered = new ArrayList<>(values.size());
        for (String value : values) {
            rendered.add(StanzaRenderer.attribute(intent.getAttribute(), value, topLevel, intent.isNoExtraSpaces()));
        }
        return rendered;
    }

    /**
     * Deduplicated requested values; a present intent without values but with
     * {@code allowNoValue} asks for the bare attribute, modelled as a single {@code null}.
     */
    static Set<String> desiredValues(StanzaIntent intent) {
        Set<String> desired = dedupe(intent.getValues());
        if (desired.isEmpty()) {
            Validate.isTrue(intent.isAllowNoValue(), MISSING_VALUE_MESSAGE);
            desired.add(null);
        }
        return desired;
    }

    static Set<String> dedupe(List<String> values) {
        Set<String> unique = new LinkedHashSet<>();
        if (values == null) {
            return unique;
        }
        for (String value : values) {
            if (value != null) {
                unique.add(value);
            }
        }
        return unique;
    }

    private static Set<String> currentValues(List<Line> lines, List<Integer> found) {
        Set<String> current = new LinkedHashSet<>();
        for (int i : found) {
            current.add(lines.get(i).value);
        }
        return current;
    }

    static final class Mutation {
        final Splice splice;
        final ChangeReason reason;

        Mutation(Splice splice, ChangeReason reason) {
            this.splice = splice;
            this.reason = reason;
        }
    }
}
