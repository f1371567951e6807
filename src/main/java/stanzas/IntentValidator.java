package stanzas;

/**
 * Checks performed before an intent is handed to the engine.
 */
public class IntentValidator {

    public static final String MISSING_VALUE_MESSAGE = StanzaMutator.MISSING_VALUE_MESSAGE;
    public static final String MUTUALLY_EXCLUSIVE_MESSAGE = "parameters are mutually exclusive: value|values";

    public void validate(StanzaIntent intent) {
        if (intent == null) {
            throw new InvalidIntentException("Intent is required.");
        }
        if (intent.getState() == null) {
            throw new InvalidIntentException("value of state must be one of: absent, present, got: null");
        }
        if (intent.getState() == State.PRESENT
                && !intent.isAllowNoValue()
                && StanzaMutator.dedupe(intent.getValues()).isEmpty()) {
            throw new InvalidIntentException(MISSING_VALUE_MESSAGE);
        }
    }
}
