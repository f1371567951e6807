package stanzas;

import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StanzaFileScenarioTest {

    private static final String VALUE_SCENARIO = "src/test/resources/stanza_file/scenarios/01-value.yml";
    private static final String VALUES_SCENARIO = "src/test/resources/stanza_file/scenarios/02-values.yml";

    private final StanzaFile stanzaFile = new StanzaFile();
    private final StanzaTaskLoader loader = new StanzaTaskLoader();

    @Test
    void singleValueScenario() throws Exception {
        replay(VALUE_SCENARIO);
    }

    @Test
    void multiValueScenario() throws Exception {
        replay(VALUES_SCENARIO);
    }

    private void replay(String scenario) throws Exception {
        List<Map<String, Object>> steps = new Yaml(new SafeConstructor(new LoaderOptions()))
                .load(Files.readString(Paths.get(scenario)));

        var content = "";
        for (Map<String, Object> step : steps) {
            var name = (String) step.get("name");
            if (step.containsKey("reset")) {
                content = (String) step.get("reset");
                continue;
            }

            var intent = loader.toIntent((Map<?, ?>) step.get("task"));
            var result = stanzaFile.apply(content, intent);

            var msg = (String) step.get("msg");
            assertEquals(msg, result.getMessage(), name);
            assertEquals(ChangeReason.fromCode(msg), result.getReason(), name);
            assertEquals(!"OK".equals(msg), result.isChanged(), name);
            if (step.containsKey("content")) {
                assertEquals(step.get("content"), result.getText(), name);
            }

            var again = stanzaFile.apply(result.getText(), intent);
            assertEquals(ChangeReason.OK, again.getReason(), "repeat of " + name);

            content = result.getText();
        }
    }
}
