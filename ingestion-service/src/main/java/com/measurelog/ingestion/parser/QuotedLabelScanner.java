package com.measurelog.ingestion.parser;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Attributes quoted values to the quoted label immediately before them.
 *
 * <pre>
 *   AWAIT_LABEL --token names a field-----> AWAIT_VALUE(field)
 *   AWAIT_LABEL --any other label---------> AWAIT_VALUE(none)   (its value is dropped)
 *   AWAIT_VALUE --token-------------------> AWAIT_LABEL         (token assigned, or dropped)
 * </pre>
 *
 * Every label owns the token after it, known or not, so an ignored note such as
 * "operator note" "check units" cannot shift the pairs that follow. A token consumed as a
 * value is never re-read as a label. The first token of a block is a label only when it
 * names a field; otherwise it is the block's unlabelled leading value and is dropped.
 * Labels resolve through {@link SectionField#fromLabel(String)}.
 */
public final class QuotedLabelScanner {

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    private enum State { AWAIT_LABEL, AWAIT_VALUE }

    private QuotedLabelScanner() {
    }

    public static List<String> quotedTokens(String block) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = QUOTED.matcher(block);
        while (matcher.find()) {
            tokens.add(matcher.group(1));
        }
        return tokens;
    }

    public static Map<SectionField, String> scan(List<String> tokens) {
        Map<SectionField, String> assigned = new EnumMap<>(SectionField.class);
        State state = State.AWAIT_LABEL;
        SectionField pending = null;

        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            switch (state) {
                case AWAIT_LABEL -> {
                    pending = SectionField.fromLabel(token);
                    if (pending != null || i > 0) {
                        state = State.AWAIT_VALUE;
                    }
                }
                case AWAIT_VALUE -> {
                    if (pending != null) {
                        assigned.put(pending, token);
                    }
                    pending = null;
                    state = State.AWAIT_LABEL;
                }
            }
        }
        return assigned;
    }
}
