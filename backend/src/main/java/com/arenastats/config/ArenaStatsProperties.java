package com.arenastats.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Arena stats runtime settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "arenastats")
public class ArenaStatsProperties {

    private Parser parser = new Parser();
    private Cards cards = new Cards();

    @Getter
    @Setter
    public static class Parser {
        /**
         * Upper bound on lines buffered for one multi-line JSON payload. 0 keeps buffering until
         * the payload parses or the file ends.
         */
        private int maxBufferedLines = 0;
    }

    @Getter
    @Setter
    public static class Cards {
        /**
         * Arena-id keyed card index written by the bulk card download job.
         */
        private String indexPath = "data/scryfall/arena_id_index.json";
    }
}
