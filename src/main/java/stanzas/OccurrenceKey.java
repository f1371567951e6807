package stanzas;

import lombok.Data;

/**
 * Identity of an attribute inside one scope. Scope ordinal 0 is the top-level scope,
 * every stanza header opens the next ordinal, so two headers with the same name never share a key.
 */
@Data
final class OccurrenceKey {
    private final int scope;
    private final String attribute;
}
