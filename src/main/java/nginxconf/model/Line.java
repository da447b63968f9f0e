package nginxconf.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * A single statement of a block: a comment, an include, a directive or the opening line of a child block.
 * Comment lines have an empty name and no arguments; their text is the only entry of {@link #getComments()}.
 */
@Value
@Builder(toBuilder = true)
public class Line {

    LineType type;

    @Builder.Default
    String name = StringUtils.EMPTY;

    @Singular
    List<String> arguments;

    @Singular
    List<String> comments;

    @EqualsAndHashCode.Exclude
    int lineNumber;

    public static Line comment(String text, int lineNumber) {
        return Line.builder()
                .type(LineType.COMMENT)
                .comment(text)
                .lineNumber(lineNumber)
                .build();
    }

    public boolean hasComments() {
        return !comments.isEmpty();
    }
}
