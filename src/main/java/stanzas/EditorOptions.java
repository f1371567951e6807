package stanzas;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class EditorOptions {
    /** Treat a missing file as empty instead of failing. */
    @Builder.Default
    private boolean create = true;
    /** Keep a timestamped copy of the file before overwriting it. */
    private boolean backup;
    /** Report what would change without writing anything. */
    private boolean checkMode;
}
