package nginxconf.parser;

import lombok.Value;

import java.util.List;

/**
 * Result of splitting one physical line: the trailing comment (or {@code null}), the directive text left
 * once the comment is removed, and the directive fragments cut from that text.
 */
@Value
public class SplitLine {

    String comment;
    String directiveText;
    List<String> fragments;
    boolean unterminatedQuote;

    public boolean hasComment() {
        return comment != null;
    }

    public boolean isCommentOnly() {
        return directiveText.isEmpty();
    }
}
