package com.arenastats.replay;

import java.util.Map;

/**
 * A rendered replay together with display names for the cards it references.
 */
public record MatchReplay(String matchId, ReplayResult result, Map<Integer, String> cardNames) {

    public MatchReplay {
        cardNames = Map.copyOf(cardNames);
    }

    public String cardName(int grpId) {
        return cardNames.get(grpId);
    }
}
