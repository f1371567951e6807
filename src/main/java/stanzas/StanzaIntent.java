package stanzas;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * "Attribute {@code attribute} with values {@code values} must be {@code state} in stanza {@code stanza}".
 * <ul>
 *     <li>{@code stanza == null} addresses the attributes above the first stanza header.</li>
 *     <li>{@code attribute == null} addresses the stanza itself.</li>
 * </ul>
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class StanzaIntent {
    private String stanza;
    private String attribute;
    @Builder.Default
    private List<String> values = new ArrayList<>();
    @Builder.Default
    private State state = State.PRESENT;
    @Builder.Default
    private boolean exclusive = true;
    private boolean allowNoValue;
    private boolean noExtraSpaces;
}
