package stanzas;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class FileEditResult {
    private boolean changed;
    private ChangeReason reason;
    private Path path;
    private Path backupFile;
    private String before;
    private String after;

    public String getMessage() {
        return reason == null ? null : reason.getCode();
    }
}
