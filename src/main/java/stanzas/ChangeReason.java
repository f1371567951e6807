package stanzas;

/**
 * The outcome of one edit as reported to callers. {@link #OK} is the only outcome that leaves
 * the document untouched.
 */
public enum ChangeReason {
    OK("OK"),
    STANZA_AND_ATTR_ADDED("stanza and attr added"),
    ONLY_STANZA_ADDED("only stanza added"),
    ATTR_ADDED("attr added"),
    ATTR_CHANGED("attr changed"),
    STANZA_REMOVED("stanza removed");

    private final String code;

    ChangeReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isChanged() {
        return this != OK;
    }

    public static ChangeReason fromCode(String code) {
        for (ChangeReason reason : values()) {
            if (reason.code.equals(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown change reason: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
