package com.roboticsradar.pipeline.service.source;

import com.roboticsradar.pipeline.config.SourceSettings;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.SourceKind;
import reactor.core.publisher.Flux;

/**
 * Turns one external source into a finite stream of normalized {@link Item}s.
 *
 * <p>The returned flux is lazy and can be re-subscribed to fetch again. Entries that cannot
 * be parsed are logged and skipped; a source that cannot be reached at all terminates the
 * flux with a {@link SourceUnavailableException}.
 */
public interface SourceAdapter {

    SourceKind kind();

    Flux<Item> fetch(SourceSettings source);
}
