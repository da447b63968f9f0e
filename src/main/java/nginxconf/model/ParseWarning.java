package nginxconf.model;

import lombok.Value;

/**
 * A structural problem the parser recovered from without changing the shape of the tree.
 */
@Value
public class ParseWarning {

    public enum Kind {
        STRAY_CLOSING_BRACE,
        UNTERMINATED_QUOTE,
        UNCLOSED_BLOCK
    }

    Kind kind;
    int lineNumber;
    String message;

    @Override
    public String toString() {
        return "line " + lineNumber + ": " + message;
    }
}
