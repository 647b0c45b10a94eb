package com.arenastats.parser;

import com.arenastats.parser.model.DeckCardEntry;
import com.arenastats.parser.model.ObjectFacts;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes classified payloads into {@link GameEvent} values. A recognised key holding a value of
 * the wrong JSON type is rejected with {@link IllegalArgumentException}.
 */
public class GameEventDecoder {

    private static final String GAME_STATE_MESSAGE_TYPE = "GREMessageType_GameStateMessage";
    private static final String ZONE_TRANSFER_ANNOTATION = "AnnotationType_ZoneTransfer";

    private final ObjectMapper objectMapper;

    public GameEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GameEvent decode(RawEvent event) {
        return switch (event.kind()) {
            case MATCH_STATE -> decodeMatchState(event.payload().get("matchGameRoomStateChangedEvent"));
            case GRE_EVENT -> decodeGreEvent(event.payload().get("greToClientEvent"));
            case COURSE_DECK, DECK_UPSERT, DECK_SET -> decodeDeck(event.payload());
            case GAME_STATE -> GameEvent.Unclassified.INSTANCE;
        };
    }

    private GameEvent decodeMatchState(JsonNode stateEvent) {
        JsonNode roomInfo = optionalObject(stateEvent, "gameRoomInfo");
        JsonNode config = optionalObject(roomInfo, "gameRoomConfig");

        List<GameEvent.ReservedPlayer> players = new ArrayList<>();
        for (JsonNode player : optionalArray(config, "reservedPlayers")) {
            players.add(new GameEvent.ReservedPlayer(
                    optionalText(player, "playerName"),
                    optionalText(player, "userId"),
                    optionalInt(player, "systemSeatId"),
                    optionalText(player, "eventId")));
        }

        GameEvent.FinalMatchResult finalResult = null;
        JsonNode finalResultNode = optionalObject(roomInfo, "finalMatchResult");
        if (finalResultNode != null) {
            List<GameEvent.ResultEntry> entries = new ArrayList<>();
            for (JsonNode entry : optionalArray(finalResultNode, "resultList")) {
                entries.add(new GameEvent.ResultEntry(
                        optionalText(entry, "scope"),
                        optionalInt(entry, "winningTeamId"),
                        optionalText(entry, "reason")));
            }
            finalResult = new GameEvent.FinalMatchResult(optionalInt(finalResultNode, "winningTeamId"), entries);
        }

        return new GameEvent.MatchStateChanged(
                optionalText(config, "matchId"),
                optionalText(roomInfo, "stateType"),
                List.copyOf(players),
                finalResult);
    }

    private GameEvent decodeGreEvent(JsonNode greEvent) {
        if (greEvent != null && !greEvent.isNull() && !greEvent.isObject()) {
            throw new IllegalArgumentException("Field 'greToClientEvent' must be an object");
        }
        List<GameEvent.GameStateMessage> messages = new ArrayList<>();
        for (JsonNode message : optionalArray(greEvent, "greToClientMessages")) {
            if (!GAME_STATE_MESSAGE_TYPE.equals(optionalText(message, "type"))) {
                continue;
            }
            JsonNode gameState = optionalObject(message, "gameStateMessage");
            messages.add(decodeGameState(gameState));
        }
        return new GameEvent.GreMessageBatch(List.copyOf(messages));
    }

    private GameEvent.GameStateMessage decodeGameState(JsonNode gameState) {
        Integer gameStateId = optionalInt(gameState, "gameStateId");

        JsonNode turnInfoNode = optionalObject(gameState, "turnInfo");
        GameEvent.TurnInfo turnInfo = turnInfoNode == null
                ? GameEvent.TurnInfo.EMPTY
                : new GameEvent.TurnInfo(
                        intOrZero(optionalInt(turnInfoNode, "turnNumber")),
                        textOrEmpty(optionalText(turnInfoNode, "phase")),
                        textOrEmpty(optionalText(turnInfoNode, "step")),
                        optionalInt(turnInfoNode, "activePlayer"));

        JsonNode gameInfoNode = optionalObject(gameState, "gameInfo");
        GameEvent.GameInfo gameInfo = gameInfoNode == null || gameInfoNode.isEmpty()
                ? null
                : new GameEvent.GameInfo(
                        optionalText(gameInfoNode, "superFormat"),
                        optionalText(gameInfoNode, "type"));

        List<GameEvent.PlayerLife> players = new ArrayList<>();
        for (JsonNode player : optionalArray(gameState, "players")) {
            Integer seat = optionalInt(player, "systemSeatNumber");
            Integer life = optionalInt(player, "lifeTotal");
            if (seat != null && life != null) {
                players.add(new GameEvent.PlayerLife(seat, life));
            }
        }

        List<GameEvent.GameObject> objects = new ArrayList<>();
        for (JsonNode object : optionalArray(gameState, "gameObjects")) {
            Integer instanceId = optionalInt(object, "instanceId");
            if (instanceId != null) {
                objects.add(new GameEvent.GameObject(instanceId, decodeObjectFacts(object)));
            }
        }

        List<GameEvent.LegalAction> actions = new ArrayList<>();
        for (JsonNode entry : optionalArray(gameState, "actions")) {
            JsonNode action = optionalObject(entry, "action");
            if (action == null || action.isEmpty()) {
                continue;
            }
            JsonNode manaCost = action.get("manaCost");
            actions.add(new GameEvent.LegalAction(
                    optionalInt(entry, "seatId"),
                    textOrEmpty(optionalText(action, "actionType")),
                    optionalInt(action, "instanceId"),
                    optionalInt(action, "grpId"),
                    optionalInt(action, "abilityGrpId"),
                    manaCost == null || manaCost.isNull() ? null : manaCost.deepCopy()));
        }

        List<GameEvent.ZoneTransferAnnotation> transfers = new ArrayList<>();
        for (JsonNode annotation : optionalArray(gameState, "annotations")) {
            if (!containsText(optionalArray(annotation, "type"), ZONE_TRANSFER_ANNOTATION)) {
                continue;
            }
            Integer zoneSrc = null;
            Integer zoneDest = null;
            String category = null;
            for (JsonNode detail : optionalArray(annotation, "details")) {
                String key = optionalText(detail, "key");
                if ("zone_src".equals(key)) {
                    zoneSrc = firstInt(detail, "valueInt32");
                } else if ("zone_dest".equals(key)) {
                    zoneDest = firstInt(detail, "valueInt32");
                } else if ("category".equals(key)) {
                    category = firstText(detail, "valueString");
                }
            }
            List<Integer> affectedIds = new ArrayList<>();
            for (JsonNode affected : optionalArray(annotation, "affectedIds")) {
                affectedIds.add(requireInt(affected, "affectedIds"));
            }
            transfers.add(new GameEvent.ZoneTransferAnnotation(
                    List.copyOf(affectedIds), zoneSrc, zoneDest, category));
        }

        return new GameEvent.GameStateMessage(
                intOrZero(gameStateId),
                turnInfo,
                gameInfo,
                List.copyOf(players),
                List.copyOf(objects),
                List.copyOf(actions),
                List.copyOf(transfers));
    }

    private ObjectFacts decodeObjectFacts(JsonNode object) {
        return new ObjectFacts(
                optionalInt(object, "grpId"),
                optionalText(object, "type"),
                textList(object, "cardTypes"),
                textList(object, "subtypes"),
                textList(object, "color"),
                optionalInt(optionalObject(object, "power"), "value"),
                optionalInt(optionalObject(object, "toughness"), "value"),
                optionalInt(object, "ownerSeatId"),
                optionalInt(object, "controllerSeatId"));
    }

    private GameEvent decodeDeck(JsonNode payload) {
        GameEvent decoded = decodeDeckContainer(payload);
        if (decoded instanceof GameEvent.Unclassified) {
            JsonNode request = payload.get("request");
            if (request != null && request.isTextual()) {
                decoded = decodeDeckContainer(parseEmbedded(request.textValue()));
            } else if (request != null && request.isObject()) {
                decoded = decodeDeckContainer(request);
            }
        }
        return decoded;
    }

    private GameEvent decodeDeckContainer(JsonNode container) {
        if (container == null || !container.isObject()) {
            return GameEvent.Unclassified.INSTANCE;
        }
        JsonNode summary;
        JsonNode deck;
        if (container.has("CourseDeckSummary")) {
            summary = optionalObject(container, "CourseDeckSummary");
            deck = optionalObject(container, "CourseDeck");
        } else if (container.has("Summary")) {
            summary = optionalObject(container, "Summary");
            deck = optionalObject(container, "Deck");
        } else {
            summary = null;
            deck = optionalObject(container, "CourseDeck");
        }

        boolean hasSummary = summary != null && !summary.isEmpty();
        boolean hasDeck = deck != null && !deck.isEmpty();
        if (!hasSummary && !hasDeck) {
            return GameEvent.Unclassified.INSTANCE;
        }

        String format = null;
        if (hasSummary) {
            for (JsonNode attribute : optionalArray(summary, "Attributes")) {
                if ("Format".equals(optionalText(attribute, "name"))) {
                    format = optionalText(attribute, "value");
                }
            }
        }

        List<DeckCardEntry> mainDeck = null;
        if (hasDeck) {
            mainDeck = new ArrayList<>();
            for (JsonNode card : optionalArray(deck, "MainDeck")) {
                Integer cardId = card.isObject() ? optionalInt(card, "cardId") : null;
                if (cardId != null && cardId != 0) {
                    Integer quantity = optionalInt(card, "quantity");
                    mainDeck.add(new DeckCardEntry(cardId, quantity != null ? quantity : 1));
                }
            }
            mainDeck = List.copyOf(mainDeck);
        }

        return new GameEvent.DeckSubmitted(
                hasSummary ? optionalText(summary, "DeckId") : null,
                hasSummary ? optionalText(summary, "Name") : null,
                format,
                mainDeck);
    }

    private JsonNode parseEmbedded(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static JsonNode optionalObject(JsonNode parent, String field) {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Field '" + field + "' must be an object");
        }
        return node;
    }

    private static Iterable<JsonNode> optionalArray(JsonNode parent, String field) {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("Field '" + field + "' must be an array");
        }
        return node;
    }

    private static String optionalText(JsonNode parent, String field) {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a scalar");
        }
        return node.asText();
    }

    private static Integer optionalInt(JsonNode parent, String field) {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return requireInt(node, field);
    }

    private static int requireInt(JsonNode node, String field) {
        if (!node.isIntegralNumber()) {
            throw new IllegalArgumentException("Field '" + field + "' must be an integer");
        }
        return node.intValue();
    }

    private static Integer firstInt(JsonNode parent, String field) {
        for (JsonNode value : optionalArray(parent, field)) {
            return requireInt(value, field);
        }
        return null;
    }

    private static String firstText(JsonNode parent, String field) {
        for (JsonNode value : optionalArray(parent, field)) {
            return value.isNull() ? null : value.asText();
        }
        return null;
    }

    private static List<String> textList(JsonNode parent, String field) {
        List<String> values = new ArrayList<>();
        for (JsonNode value : optionalArray(parent, field)) {
            values.add(value.asText());
        }
        return values;
    }

    private static boolean containsText(Iterable<JsonNode> values, String expected) {
        for (JsonNode value : values) {
            if (expected.equals(value.asText())) {
                return true;
            }
        }
        return false;
    }

    private static int intOrZero(Integer value) {
        return value != null ? value : 0;
    }

    private static String textOrEmpty(String value) {
        return value != null ? value : "";
    }
}
