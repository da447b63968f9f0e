package nginxconf.render;

import nginxconf.model.Block;
import nginxconf.model.Line;
import nginxconf.model.NginxConfig;
import nginxconf.parser.DirectiveSplitter;
import nginxconf.parser.ParserOptions;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Writes a parsed configuration back as text, one statement per line, indenting each nesting level.
 * Comments attached to a statement are appended after it; the output parses back into the same structure.
 */
public class ConfigPrinter {

    private static final String LS = "\n";

    private final String indent;
    private final DirectiveSplitter splitter = new DirectiveSplitter();

    public ConfigPrinter() {
        this(ParserOptions.defaults());
    }

    public ConfigPrinter(ParserOptions options) {
        this.indent = options.getIndent();
    }

    public String print(NginxConfig config) {
        StringBuilder out = new StringBuilder();
        printContents(out, config.getRootBlock(), 0);
        return out.toString();
    }

    private void printContents(StringBuilder out, Block block, int level) {
        String prefix = StringUtils.repeat(indent, level);
        int childIndex = 0;
        for (Line line : block.getLines()) {
            switch (line.getType()) {
                case COMMENT:
                    String text = String.join(" ", line.getComments());
                    out.append(prefix).append(text.isEmpty() ? "#" : "# " + text).append(LS);
                    break;
                case BLOCK:
                    Block child = block.getBlocks().get(childIndex++);
                    String header = statement(child.getName(), child.getArguments());
                    out.append(prefix)
                            .append(header.isEmpty() ? "{" : header + " {")
                            .append(commentSuffix(child.getComments()))
                            .append(LS);
                    printContents(out, child, level + 1);
                    out.append(prefix).append("}").append(LS);
                    break;
                case INCLUDE:
                case DIRECTIVE:
                default:
                    String statement = statement(line.getName(), line.getArguments());
                    out.append(prefix).append(statement);
                    // an open quote would swallow the terminator and the comment on reparse
                    if (!splitter.endsInsideQuote(statement)) {
                        out.append(';').append(commentSuffix(line.getComments()));
                    }
                    out.append(LS);
                    break;
            }
        }
    }

    private static String statement(String name, List<String> arguments) {
        if (arguments.isEmpty()) {
            return name;
        }
        return name + " " + String.join(" ", arguments);
    }

    private static String commentSuffix(List<String> comments) {
        if (comments.isEmpty()) {
            return StringUtils.EMPTY;
        }
        return " # " + String.join(" ", comments);
    }
}
