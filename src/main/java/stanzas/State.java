package stanzas;

import java.util.Locale;

public enum State {
    PRESENT, ABSENT;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static State fromCode(String code) {
        for (State state : values()) {
            if (state.getCode().equals(code)) {
                return state;
            }
        }
        throw new InvalidIntentException("value of state must be one of: absent, present, got: " + code);
    }
}
