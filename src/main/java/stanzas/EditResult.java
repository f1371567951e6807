package stanzas;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class EditResult {
    private String text;
    private boolean changed;
    private ChangeReason reason;

    public String getMessage() {
        return reason == null ? null : reason.getCode();
    }
}
