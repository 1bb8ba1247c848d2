package com.dcruver.ideatree.nlp;

import lombok.Value;

import java.util.List;

/**
 * Untrusted oracle output as it crosses into the engine: either free text to be
 * decoded, or the argument payloads of one or more tool calls.
 */
@Value
public class RawProposal {

    public enum Kind {
        TEXT,
        TOOL_CALLS
    }

    Kind kind;
    String text;
    List<String> toolArguments;

    public static RawProposal text(String text) {
        return new RawProposal(Kind.TEXT, text, List.of());
    }

    public static RawProposal toolCalls(List<String> arguments) {
        return new RawProposal(Kind.TOOL_CALLS, null, List.copyOf(arguments));
    }
}
