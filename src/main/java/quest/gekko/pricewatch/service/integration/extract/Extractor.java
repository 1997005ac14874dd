package quest.gekko.pricewatch.service.integration.extract;

import org.jsoup.nodes.Document;

import java.util.Optional;

/**
 * One way of reading product attributes out of a fetched page. Strategies are tried in
 * order and the first one that yields a plausible price wins.
 */
public interface Extractor {
    String name();

    /** Empty when this strategy finds no usable price on the page. */
    Optional<ExtractedAttributes> extract(Document page);
}
