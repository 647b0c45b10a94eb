package com.arenastats.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Streams a client log line by line and lifts out the JSON payloads it recognises.
 * Payloads may sit on their own line, trail a logger prefix, or span several lines.
 */
public class LogEventExtractor {

    private static final Logger log = LoggerFactory.getLogger(LogEventExtractor.class);

    private static final Pattern LOGGER_TIMESTAMP = Pattern.compile(
            "\\[UnityCrossThreadLogger\\](\\d+/\\d+/\\d+\\s+\\d+:\\d+:\\d+\\s+[AP]M)");
    private static final Pattern JSON_START = Pattern.compile("^\\s*\\{");
    private static final Pattern TRAILING_JSON = Pattern.compile("(\\{.*\\})\\s*$");
    private static final DateTimeFormatter LOGGER_TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("M/d/yyyy h:mm:ss a", Locale.US);

    private final Path logPath;
    private final ObjectMapper objectMapper;
    private final int maxBufferedLines;

    private OffsetDateTime lastLoggerTimestamp;

    public LogEventExtractor(Path logPath, ObjectMapper objectMapper, int maxBufferedLines) {
        this.logPath = logPath;
        this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.maxBufferedLines = maxBufferedLines;
    }

    /**
     * Reads the whole log, handing every classified payload to the sink in file order.
     *
     * @param sink Receiver of classified events
     */
    public void extract(Consumer<RawEvent> sink) {
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(logPath), decoder))) {
            extract(reader, sink);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read log file " + logPath, e);
        }
    }

    void extract(BufferedReader reader, Consumer<RawEvent> sink) throws IOException {
        lastLoggerTimestamp = null;
        List<String> buffer = new ArrayList<>();
        boolean accumulating = false;
        int lineNumber = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String stripped = line.strip();
            trackLoggerTimestamp(line);

            if (accumulating) {
                buffer.add(stripped);
                Optional<JsonNode> parsed = tryParse(String.join("\n", buffer));
                if (parsed.isPresent()) {
                    accumulating = false;
                    buffer.clear();
                    emit(parsed.get(), lineNumber, sink);
                } else if (maxBufferedLines > 0 && buffer.size() >= maxBufferedLines) {
                    log.warn("Dropping unterminated JSON block of {} lines ending at line {}",
                            buffer.size(), lineNumber);
                    accumulating = false;
                    buffer.clear();
                }
                continue;
            }

            if (JSON_START.matcher(stripped).find()) {
                Optional<JsonNode> parsed = tryParse(stripped);
                if (parsed.isPresent()) {
                    emit(parsed.get(), lineNumber, sink);
                } else {
                    accumulating = true;
                    buffer.add(stripped);
                }
                continue;
            }

            Matcher trailing = TRAILING_JSON.matcher(stripped);
            if (trailing.find()) {
                Optional<JsonNode> parsed = tryParse(trailing.group(1));
                if (parsed.isPresent()) {
                    emit(parsed.get(), lineNumber, sink);
                }
            }
        }

        if (accumulating) {
            log.debug("Discarding {} buffered lines of incomplete JSON at end of file", buffer.size());
        }
    }

    /**
     * Maps a payload's top-level keys to an event kind. Unrecognised payloads yield nothing.
     */
    public static Optional<LogEventKind> classify(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Optional.empty();
        }
        if (payload.has("matchGameRoomStateChangedEvent")) {
            return Optional.of(LogEventKind.MATCH_STATE);
        }
        if (payload.has("greToClientEvent")) {
            return Optional.of(LogEventKind.GRE_EVENT);
        }
        if (payload.has("CourseDeck") || payload.has("CourseDeckSummary")) {
            return Optional.of(LogEventKind.COURSE_DECK);
        }
        String serialized = payload.toString();
        if (payload.has("request") && serialized.contains("DeckUpsertDeckV2")) {
            return Optional.of(LogEventKind.DECK_UPSERT);
        }
        if (payload.has("request") && serialized.contains("EventSetDeckV2")) {
            return Optional.of(LogEventKind.DECK_SET);
        }
        if (serialized.contains("gameStateMessage")) {
            return Optional.of(LogEventKind.GAME_STATE);
        }
        return Optional.empty();
    }

    private void emit(JsonNode payload, int lineNumber, Consumer<RawEvent> sink) {
        classify(payload).ifPresent(kind -> sink.accept(new RawEvent(
                kind,
                payload,
                readTimestamp(payload),
                lineNumber,
                lastLoggerTimestamp)));
    }

    private Optional<JsonNode> tryParse(String text) {
        try {
            return Optional.of(objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private void trackLoggerTimestamp(String line) {
        Matcher matcher = LOGGER_TIMESTAMP.matcher(line);
        if (!matcher.lookingAt()) {
            return;
        }
        try {
            lastLoggerTimestamp = LocalDateTime.parse(matcher.group(1), LOGGER_TIMESTAMP_FORMAT)
                    .atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable logger timestamp '{}'", matcher.group(1));
        }
    }

    private static Long readTimestamp(JsonNode payload) {
        JsonNode timestamp = payload.get("timestamp");
        if (timestamp == null || timestamp.isNull()) {
            return null;
        }
        if (timestamp.isIntegralNumber()) {
            long value = timestamp.longValue();
            return value != 0 ? value : null;
        }
        if (timestamp.isTextual()) {
            try {
                long value = Long.parseLong(timestamp.textValue().trim());
                return value != 0 ? value : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
