package com.arenastats.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builders for single-line client log payloads used across tests.
 */
public final class LogLines {

    public static final String LOGGER_PREFIX = "[UnityCrossThreadLogger]1/15/2024 3:45:12 PM";

    private LogLines() {
    }

    public static Path write(Path dir, String... lines) throws IOException {
        Path log = dir.resolve("Player.log");
        Files.write(log, List.of(lines), StandardCharsets.UTF_8);
        return log;
    }

    public static String player(String name, String userId, int seat, String eventId) {
        return "{\"playerName\":\"" + name + "\",\"userId\":\"" + userId + "\",\"systemSeatId\":" + seat
                + ",\"eventId\":\"" + eventId + "\"}";
    }

    public static String matchPlaying(String matchId, long timestamp, String... players) {
        return "{\"matchGameRoomStateChangedEvent\":{\"gameRoomInfo\":{"
                + "\"stateType\":\"MatchGameRoomStateType_Playing\","
                + "\"gameRoomConfig\":{\"matchId\":\"" + matchId + "\",\"reservedPlayers\":["
                + String.join(",", players) + "]}}},\"timestamp\":\"" + timestamp + "\"}";
    }

    public static String matchCompleted(String matchId, long timestamp, int winningSeat) {
        return "{\"matchGameRoomStateChangedEvent\":{\"gameRoomInfo\":{"
                + "\"stateType\":\"MatchGameRoomStateType_MatchCompleted\","
                + "\"gameRoomConfig\":{\"matchId\":\"" + matchId + "\"},"
                + "\"finalMatchResult\":{\"winningTeamId\":" + winningSeat + ",\"resultList\":["
                + "{\"scope\":\"MatchScope_Game\",\"winningTeamId\":" + winningSeat + ",\"reason\":\"ResultReason_Game\"},"
                + "{\"scope\":\"MatchScope_Match\",\"winningTeamId\":" + winningSeat + ",\"reason\":\"ResultReason_Game\"}"
                + "]}}},\"timestamp\":\"" + timestamp + "\"}";
    }

    public static String greEvent(String... gameStates) {
        return "{\"greToClientEvent\":{\"greToClientMessages\":[" + String.join(",", gameStates) + "]}}";
    }

    /**
     * A game state message. Each part is a {@code "key":value} fragment of the message body.
     */
    public static String gameState(int gameStateId, String... parts) {
        StringBuilder body = new StringBuilder("\"gameStateId\":").append(gameStateId);
        for (String part : parts) {
            body.append(',').append(part);
        }
        return "{\"type\":\"GREMessageType_GameStateMessage\",\"gameStateMessage\":{" + body + "}}";
    }

    public static String turnInfo(int turnNumber, String phase, int activePlayer) {
        return "\"turnInfo\":{\"turnNumber\":" + turnNumber + ",\"phase\":\"" + phase
                + "\",\"step\":\"Step_None\",\"activePlayer\":" + activePlayer + "}";
    }

    public static String gameInfo(String superFormat, String type) {
        return "\"gameInfo\":{\"superFormat\":\"" + superFormat + "\",\"type\":\"" + type + "\"}";
    }

    public static String lifeTotals(int... seatLifePairs) {
        String players = IntStream.range(0, seatLifePairs.length / 2)
                .mapToObj(i -> "{\"systemSeatNumber\":" + seatLifePairs[2 * i]
                        + ",\"lifeTotal\":" + seatLifePairs[2 * i + 1] + "}")
                .collect(Collectors.joining(","));
        return "\"players\":[" + players + "]";
    }

    public static String gameObjects(String... objects) {
        return "\"gameObjects\":[" + String.join(",", objects) + "]";
    }

    public static String card(int instanceId, int grpId, String type) {
        return "{\"instanceId\":" + instanceId + ",\"grpId\":" + grpId + ",\"type\":\"" + type
                + "\",\"ownerSeatId\":2,\"controllerSeatId\":2,\"cardTypes\":[\"CardType_Creature\"]}";
    }

    public static String actions(String... actions) {
        return "\"actions\":[" + String.join(",", actions) + "]";
    }

    public static String action(int seatId, String actionType, int instanceId, int grpId) {
        return "{\"seatId\":" + seatId + ",\"action\":{\"actionType\":\"" + actionType + "\",\"instanceId\":"
                + instanceId + ",\"grpId\":" + grpId + "}}";
    }

    public static String annotations(String... annotations) {
        return "\"annotations\":[" + String.join(",", annotations) + "]";
    }

    public static String zoneTransfer(int instanceId, int fromZone, int toZone, String category) {
        return "{\"affectedIds\":[" + instanceId + "],\"type\":[\"AnnotationType_ZoneTransfer\"],\"details\":["
                + "{\"key\":\"zone_src\",\"valueInt32\":[" + fromZone + "]},"
                + "{\"key\":\"zone_dest\",\"valueInt32\":[" + toZone + "]},"
                + "{\"key\":\"category\",\"valueString\":[\"" + category + "\"]}]}";
    }
}
