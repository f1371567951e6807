package stanzas;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Format-preserving editor for stanza files:
 * <pre>
 * # comment
 * top_level = value
 *
 * drinks:
 *   fav = lemonade
 *   fav = cocktail
 *   bare_flag
 * </pre>
 * Every call parses the text afresh, so an instance holds no state and may be shared.
 */
public class StanzaFile implements StanzaService {

    private static final Logger log = LoggerFactory.getLogger(StanzaFile.class);

    private final StanzaParser parser = new StanzaParser();
    private final StanzaMutator mutator = new StanzaMutator();

    @Override
    public EditResult apply(String text, StanzaIntent intent) {
        StanzaDocument document = parser.parse(text);
        StanzaMutator.Mutation mutation = mutator.mutate(document, intent);

        if (!mutation.reason.isChanged()) {
            return EditResult.builder()
                    .text(document.source)
                    .changed(false)
                    .reason(ChangeReason.OK)
                    .build();
        }

        List<Line> lines = mutation.splice.applyTo(document.lines);
        String rendered = StanzaRenderer.render(lines, document.lineSeparator);
        log.debug("{} lines -> {} lines ({})", document.lines.size(), lines.size(), mutation.reason);
        return EditResult.builder()
                .text(rendered)
                .changed(true)
                .reason(mutation.reason)
                .build();
    }
}
