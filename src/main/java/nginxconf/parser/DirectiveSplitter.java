package nginxconf.parser;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Quote-aware splitter for a single trimmed line.
 * <p>
 * The first {@code #} outside quotes starts the comment. The rest is cut into fragments on unquoted
 * {@code ;}; an unquoted opening brace stays in its fragment and ends splitting for the whole line.
 * Quote characters are kept verbatim and an unterminated quote swallows the rest of the line.
 */
public class DirectiveSplitter {

    private static final char COMMENT = '#';
    private static final char TERMINATOR = ';';
    private static final char BLOCK_OPEN = '{';

    public SplitLine split(String line) {
        String trimmed = StringUtils.trimToEmpty(line);

        QuoteState quotes = new QuoteState();
        int commentStart = -1;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (quotes.accept(c)) {
                continue;
            }
            if (c == COMMENT) {
                commentStart = i;
                break;
            }
        }

        String comment = null;
        String text = trimmed;
        if (commentStart >= 0) {
            comment = trimmed.substring(commentStart + 1).trim();
            text = trimmed.substring(0, commentStart).trim();
        }

        if (text.isEmpty()) {
            return new SplitLine(comment, text, List.of(), quotes.isOpen());
        }

        QuoteState fragmentQuotes = new QuoteState();
        List<String> fragments = splitFragments(text, fragmentQuotes);
        return new SplitLine(comment, text, fragments, fragmentQuotes.isOpen());
    }

    /**
     * Whether a quote opened in {@code text} is still open at its end.
     */
    public boolean endsInsideQuote(String text) {
        QuoteState quotes = new QuoteState();
        for (int i = 0; i < text.length(); i++) {
            quotes.accept(text.charAt(i));
        }
        return quotes.isOpen();
    }

    private static List<String> splitFragments(String text, QuoteState quotes) {
        List<String> fragments = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quotes.accept(c)) {
                current.append(c);
                continue;
            }
            if (c == TERMINATOR) {
                addFragment(fragments, current);
                current.setLength(0);
            } else if (c == BLOCK_OPEN) {
                current.append(c);
                addFragment(fragments, current);
                return fragments;
            } else {
                current.append(c);
            }
        }

        addFragment(fragments, current);
        return fragments;
    }

    private static void addFragment(List<String> fragments, CharSequence raw) {
        String fragment = raw.toString().trim();
        if (!fragment.isEmpty()) {
            fragments.add(fragment);
        }
    }

    private static final class QuoteState {
        private char quote;

        /**
         * Feeds one character; returns true if it was a quote character or lies inside a quoted span.
         */
        boolean accept(char c) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                return true;
            }
            if (c == '\'' || c == '"') {
                quote = c;
                return true;
            }
            return false;
        }

        boolean isOpen() {
            return quote != 0;
        }
    }
}
