package com.arenastats.parser;

import com.arenastats.parser.model.MatchAggregate;

import java.util.List;

public record ParseResult(List<MatchAggregate> matches, List<ParseError> errors) {

    public ParseResult {
        matches = List.copyOf(matches);
        errors = List.copyOf(errors);
    }
}
