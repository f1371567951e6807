package stanzas;

public interface StanzaService {

    /**
     * Computes the smallest edit of {@code text} that satisfies {@code intent}.
     * Lines the edit does not touch come back exactly as they were.
     *
     * @param text   full file content, may start with a byte-order mark
     * @param intent the desired state of one attribute or one stanza
     * @return the new content, whether it differs and why
     */
    EditResult apply(String text, StanzaIntent intent);
}
