package stanzas;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Applies intents to a file on disk. All text decisions are delegated to a {@link StanzaService};
 * this class only reads, backs up and writes.
 */
public class StanzaFileEditor {

    private static final Logger log = LoggerFactory.getLogger(StanzaFileEditor.class);
    private static final DateTimeFormatter BACKUP_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd@HH:mm:ss");

    private final StanzaService service;
    private final EditorOptions options;
    private final IntentValidator validator = new IntentValidator();

    public StanzaFileEditor() {
        this(new StanzaFile(), EditorOptions.builder().build());
    }

    public StanzaFileEditor(EditorOptions options) {
        this(new StanzaFile(), options);
    }

    public StanzaFileEditor(StanzaService service, EditorOptions options) {
        this.service = service;
        this.options = options;
    }

    public FileEditResult apply(Path path, StanzaIntent intent) throws StanzaFileException {
        return applyAll(path, Collections.singletonList(intent)).get(0);
    }

    /**
     * Applies the intents in order, each one to the output of the previous one, and writes the file
     * at most once.
     */
    public List<FileEditResult> applyAll(Path path, List<StanzaIntent> intents) throws StanzaFileException {
        for (StanzaIntent intent : intents) {
            validator.validate(intent);
        }

        String original = read(path);
        String current = original;
        boolean changed = false;
        List<EditResult> edits = new ArrayList<>(intents.size());
        for (StanzaIntent intent : intents) {
            EditResult edit = service.apply(current, intent);
            edits.add(edit);
            changed |= edit.isChanged();
            current = edit.getText();
        }

        Path backupFile = null;
        if (changed) {
            if (options.isCheckMode()) {
                log.info("Check mode, not writing {}", path);
            } else {
                backupFile = options.isBackup() ? backup(path) : null;
                write(path, current);
            }
        }

        List<FileEditResult> results = new ArrayList<>(edits.size());
        String before = original;
        for (EditResult edit : edits) {
            results.add(FileEditResult.builder()
                    .changed(edit.isChanged())
                    .reason(edit.getReason())
                    .path(path)
                    .backupFile(backupFile)
                    .before(before)
                    .after(edit.getText())
                    .build());
            before = edit.getText();
        }
        return results;
    }

    private String read(Path path) throws StanzaFileException {
        if (!Files.exists(path)) {
            if (!options.isCreate()) {
                throw new StanzaFileException(String.format("Destination %s does not exist!", path));
            }
            return "";
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StanzaFileException(String.format("Unable to read %s", path), e);
        }
    }

    private Path backup(Path path) throws StanzaFileException {
        if (!Files.exists(path)) {
            return null;
        }
        String stamp = LocalDateTime.now().format(BACKUP_TIMESTAMP);
        Path backupFile = path.resolveSibling(path.getFileName() + "." + stamp + "~");
        try {
            Files.copy(path, backupFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw new StanzaFileException(String.format("Unable to back up %s to %s", path, backupFile), e);
        }
        log.info("Backed up {} to {}", path, backupFile);
        return backupFile;
    }

    private void write(Path path, String text) throws StanzaFileException {
        Path dir = path.toAbsolutePath().getParent();
        Path tmp;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, ".stanza_file", ".tmp");
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StanzaFileException(String.format("Unable to create temporary file in %s", dir), e);
        }

        try {
            move(tmp, path);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StanzaFileException(String.format("Unable to move temporary file %s to %s", tmp, path), e);
        }
        log.info("Wrote {}", path);
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}", tmp, e);
        }
    }
}
