package stanzas;

import org.apache.commons.lang3.BooleanUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads edit requests from YAML:
 * <pre>
 * - stanza: drinks
 *   attr: fav
 *   values: [lemonade, cocktail]
 *   exclusive: false
 * - stanza: mysqld
 *   attr: skip-name
 *   allow_no_value: yes
 * </pre>
 */
public class StanzaTaskLoader {

    static final String KEY_STANZA = "stanza";
    static final String KEY_ATTR = "attr";
    static final String KEY_VALUE = "value";
    static final String KEY_VALUES = "values";
    static final String KEY_STATE = "state";
    static final String KEY_EXCLUSIVE = "exclusive";
    static final String KEY_ALLOW_NO_VALUE = "allow_no_value";
    static final String KEY_NO_EXTRA_SPACES = "no_extra_spaces";

    private static final Logger log = LoggerFactory.getLogger(StanzaTaskLoader.class);

    private final Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    private final IntentValidator validator = new IntentValidator();

    public List<StanzaIntent> load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public List<StanzaIntent> load(String yamlText) {
        return load(new StringReader(yamlText == null ? "" : yamlText));
    }

    public List<StanzaIntent> load(Reader reader) {
        Object root = yaml.load(reader);
        if (root == null) {
            return Collections.emptyList();
        }
        if (!(root instanceof List)) {
            throw new InvalidIntentException("Expected a list of tasks, got: " + root.getClass().getSimpleName());
        }
        List<StanzaIntent> intents = new ArrayList<>();
        for (Object entry : (List<?>) root) {
            if (!(entry instanceof Map)) {
                throw new InvalidIntentException("Expected a task mapping, got: " + entry);
            }
            intents.add(toIntent((Map<?, ?>) entry));
        }
        return intents;
    }

    StanzaIntent toIntent(Map<?, ?> task) {
        if (!task.containsKey(KEY_STANZA)) {
            log.warn("Rejected task without stanza: {}", task);
            throw new InvalidIntentException("Parameter 'stanza' is required.");
        }
        Object value = task.get(KEY_VALUE);
        Object values = task.get(KEY_VALUES);
        if (value != null && values != null) {
            log.warn("Rejected task with both value and values: {}", task);
            throw new InvalidIntentException(IntentValidator.MUTUALLY_EXCLUSIVE_MESSAGE);
        }

        StanzaIntent intent = StanzaIntent.builder()
                .stanza(asString(task.get(KEY_STANZA)))
                .attribute(asString(task.get(KEY_ATTR)))
                .values(value != null ? toValues(Collections.singletonList(value)) : toValues(values))
                .state(task.get(KEY_STATE) == null ? State.PRESENT : State.fromCode(asString(task.get(KEY_STATE))))
                .exclusive(asBoolean(task.get(KEY_EXCLUSIVE), true))
                .allowNoValue(asBoolean(task.get(KEY_ALLOW_NO_VALUE), false))
                .noExtraSpaces(asBoolean(task.get(KEY_NO_EXTRA_SPACES), false))
                .build();
        try {
            validator.validate(intent);
        } catch (InvalidIntentException e) {
            log.warn("Rejected task {}: {}", task, e.getMessage());
            throw e;
        }
        return intent;
    }

    private static List<String> toValues(Object raw) {
        List<String> result = new ArrayList<>();
        if (raw == null) {
            return result;
        }
        if (!(raw instanceof List)) {
            result.add(raw.toString());
            return result;
        }
        for (Object item : (List<?>) raw) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static String asString(Object raw) {
        return raw == null ? null : raw.toString();
    }

    private static boolean asBoolean(Object raw, boolean defaultValue) {
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        Boolean parsed = BooleanUtils.toBooleanObject(raw.toString());
        if (parsed == null) {
            throw new InvalidIntentException("Not a boolean: " + raw);
        }
        return parsed;
    }
}
