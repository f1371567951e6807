package stanzas;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StanzaFileEditorTest {

    private static final String ENCODING_INPUT = "src/test/resources/stanza_file/files/encoding_input.conf";
    private static final String ENCODING_TASKS = "src/test/resources/stanza_file/files/encoding_tasks.yml";
    private static final String ENCODING_EXPECTED = "src/test/resources/stanza_file/files/encoding_expected.conf";

    @TempDir
    Path tempDir;

    private static StanzaIntent fav(String value) {
        return StanzaIntent.builder().stanza("drinks").attribute("fav").values(List.of(value)).build();
    }

    @Test
    void apply_createsMissingFile() throws Exception {
        var path = tempDir.resolve("new.conf");

        var result = new StanzaFileEditor().apply(path, fav("lemonade"));

        assertTrue(result.isChanged());
        assertEquals(ChangeReason.STANZA_AND_ATTR_ADDED, result.getReason());
        assertEquals("", result.getBefore());
        assertEquals("\ndrinks:\n  fav = lemonade\n", Files.readString(path));
    }

    @Test
    void apply_missingFileWithoutCreateFails() {
        var path = tempDir.resolve("missing.conf");
        var editor = new StanzaFileEditor(EditorOptions.builder().create(false).build());

        var e = assertThrows(StanzaFileException.class, () -> editor.apply(path, fav("lemonade")));
        assertEquals("Destination " + path + " does not exist!", e.getMessage());
        assertFalse(Files.exists(path));
    }

    @Test
    void apply_missingFileNotWrittenWhenNothingChanges() throws Exception {
        var path = tempDir.resolve("missing.conf");
        var intent = StanzaIntent.builder().stanza("drinks").attribute("fav").state(State.ABSENT).build();

        var result = new StanzaFileEditor().apply(path, intent);

        assertFalse(result.isChanged());
        assertFalse(Files.exists(path));
    }

    @Test
    void apply_checkModeLeavesFileAlone() throws Exception {
        var path = tempDir.resolve("drinks.conf");
        Files.writeString(path, "drinks:\n  fav = lemonade\n");
        var editor = new StanzaFileEditor(EditorOptions.builder().checkMode(true).build());

        var result = editor.apply(path, fav("water"));

        assertTrue(result.isChanged());
        assertEquals(ChangeReason.ATTR_CHANGED, result.getReason());
        assertEquals("drinks:\n  fav = water\n", result.getAfter());
        assertEquals("drinks:\n  fav = lemonade\n", Files.readString(path));
    }

    @Test
    void apply_backupKeepsOriginal() throws Exception {
        var path = tempDir.resolve("drinks.conf");
        Files.writeString(path, "drinks:\n  fav = lemonade\n");
        var editor = new StanzaFileEditor(EditorOptions.builder().backup(true).build());

        var result = editor.apply(path, fav("water"));

        assertNotNull(result.getBackupFile());
        assertTrue(result.getBackupFile().getFileName().toString().startsWith("drinks.conf."));
        assertTrue(result.getBackupFile().getFileName().toString().endsWith("~"));
        assertEquals("drinks:\n  fav = lemonade\n", Files.readString(result.getBackupFile()));
        assertEquals("drinks:\n  fav = water\n", Files.readString(path));
    }

    @Test
    void apply_noBackupWhenUnchanged() throws Exception {
        var path = tempDir.resolve("drinks.conf");
        Files.writeString(path, "drinks:\n  fav = lemonade\n");
        var editor = new StanzaFileEditor(EditorOptions.builder().backup(true).build());

        var result = editor.apply(path, fav("lemonade"));

        assertFalse(result.isChanged());
        assertNull(result.getBackupFile());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(path), files.collect(Collectors.toList()));
        }
    }

    @Test
    void applyAll_chainsTasksAndWritesOnce() throws Exception {
        var path = tempDir.resolve("logging.ini");
        Files.copy(Paths.get(ENCODING_INPUT), path);
        var intents = new StanzaTaskLoader().load(Paths.get(ENCODING_TASKS));

        var results = new StanzaFileEditor().applyAll(path, intents);

        assertEquals(intents.size(), results.size());
        assertEquals(Files.readString(Paths.get(ENCODING_EXPECTED)), Files.readString(path));
        for (int i = 1; i < results.size(); i++) {
            assertEquals(results.get(i - 1).getAfter(), results.get(i).getBefore());
        }
        assertEquals(Files.readString(path), results.get(results.size() - 1).getAfter());
    }

    @Test
    void applyAll_invalidIntentStopsBeforeReading() {
        var path = tempDir.resolve("missing.conf");
        var editor = new StanzaFileEditor(EditorOptions.builder().create(false).build());
        var invalid = StanzaIntent.builder().stanza("drinks").attribute("fav").build();

        assertThrows(InvalidIntentException.class, () -> editor.applyAll(path, List.of(fav("water"), invalid)));
    }

    @Test
    void apply_rewritesWithoutByteOrderMark() throws Exception {
        var path = tempDir.resolve("bom.conf");
        Files.writeString(path, "\uFEFFdrinks:\r\n  fav = lemonade\r\n");

        new StanzaFileEditor().apply(path, fav("water"));

        assertEquals("drinks:\r\n  fav = water\r\n", Files.readString(path));
    }
}
