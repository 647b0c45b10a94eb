package com.arenastats.parser;

import com.arenastats.parser.model.MatchAggregate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Parser for MTG Arena client logs. Validates the file up front, then reconstructs every match
 * in a single streaming pass.
 */
public class MatchLogParser {

    private static final Logger log = LoggerFactory.getLogger(MatchLogParser.class);

    private static final int HEADER_BYTES = 4096;
    private static final List<String> LOG_MARKERS = List.of("Unity", "MTGA", "Wizards");

    private final Path logPath;
    private final ObjectMapper objectMapper;
    private final int maxBufferedLines;
    private final MatchStateReducer reducer = new MatchStateReducer();

    public MatchLogParser(Path logPath) {
        this(logPath, new ObjectMapper(), 0);
    }

    /**
     * @param logPath Path to the client log
     * @param objectMapper Mapper used to read embedded JSON
     * @param maxBufferedLines Cap on lines buffered for one multi-line payload, 0 for none
     * @throws LogFileNotFoundException if the file does not exist
     * @throws InvalidLogFormatException if the file is empty or cannot be decoded
     */
    public MatchLogParser(Path logPath, ObjectMapper objectMapper, int maxBufferedLines) {
        this.logPath = logPath;
        this.objectMapper = objectMapper;
        this.maxBufferedLines = maxBufferedLines;
        validate();
    }

    public Path getLogPath() {
        return logPath;
    }

    /**
     * Parses the log and returns every match found, plus the events that had to be skipped.
     *
     * @return Matches in order of first appearance and non-fatal errors in line order
     */
    public ParseResult parseMatches() {
        LogEventExtractor extractor = new LogEventExtractor(logPath, objectMapper, maxBufferedLines);
        GameEventDecoder decoder = new GameEventDecoder(objectMapper);
        AtomicReference<ParserState> state = new AtomicReference<>(ParserState.initial());
        List<ParseError> errors = new ArrayList<>();

        extractor.extract(raw -> {
            try {
                GameEvent event = decoder.decode(raw);
                state.set(reducer.apply(state.get(), event, raw));
            } catch (RuntimeException e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                errors.add(new ParseError(raw.kind(), raw.lineNumber(), message));
                log.warn("Error processing {} event at line {}: {}", raw.kind(), raw.lineNumber(), message);
            }
        });

        List<MatchAggregate> matches = state.get().finish();
        if (!errors.isEmpty()) {
            log.info("Completed with {} non-fatal parse errors", errors.size());
        }
        log.info("Parsed {} match(es) from {}", matches.size(), logPath);
        return new ParseResult(matches, errors);
    }

    private void validate() {
        if (!Files.isRegularFile(logPath)) {
            throw new LogFileNotFoundException(String.valueOf(logPath));
        }

        byte[] header;
        try {
            if (Files.size(logPath) == 0) {
                throw new InvalidLogFormatException("Log file is empty", String.valueOf(logPath));
            }
            try (InputStream in = Files.newInputStream(logPath)) {
                header = in.readNBytes(HEADER_BYTES);
            }
        } catch (IOException e) {
            throw new InvalidLogFormatException("Cannot read log file", String.valueOf(logPath), e);
        }

        String headerText;
        try {
            headerText = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(header))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidLogFormatException("Log file encoding error", "Cannot decode file: " + e.getMessage(), e);
        }
        if (headerText.isEmpty()) {
            throw new InvalidLogFormatException("Log file encoding error", "No decodable text in " + logPath);
        }

        if (LOG_MARKERS.stream().noneMatch(headerText::contains)) {
            log.warn("File may not be a valid MTGA log: {}", logPath);
        }
    }
}
