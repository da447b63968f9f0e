package nginxconf.render;

import nginxconf.model.Block;
import nginxconf.model.Line;
import nginxconf.model.LineType;
import nginxconf.model.NginxConfig;

import java.util.List;

/**
 * Renders a configuration as a box-drawing tree.
 * <p>
 * Each block lists its lines first ({@code BlockStart} entries included) and then its child blocks,
 * each child followed by its own contents. An entry gets the closing connector only when nothing else
 * follows it at the same level.
 */
public class TreePrinter {

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String PIPE_INDENT = "│   ";
    private static final String SPACE_INDENT = "    ";
    private static final String LS = "\n";

    public String print(NginxConfig config) {
        StringBuilder out = new StringBuilder();
        out.append("Configuration File: ").append(config.getFilePath()).append(LS);
        out.append(LAST_BRANCH).append("Root").append(LS);
        printBlock(out, config.getRootBlock(), SPACE_INDENT);
        return out.toString();
    }

    private static void printBlock(StringBuilder out, Block block, String prefix) {
        List<Line> lines = block.getLines();
        List<Block> blocks = block.getBlocks();

        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            boolean last = i == lines.size() - 1 && blocks.isEmpty();
            out.append(prefix).append(last ? LAST_BRANCH : BRANCH).append(describe(line)).append(LS);

            if (line.getType() != LineType.COMMENT && line.hasComments()) {
                printComments(out, line.getComments(), prefix + (last ? SPACE_INDENT : PIPE_INDENT), true);
            }
        }

        for (int i = 0; i < blocks.size(); i++) {
            Block child = blocks.get(i);
            boolean last = i == blocks.size() - 1;
            out.append(prefix).append(last ? LAST_BRANCH : BRANCH).append("Block: ").append(header(child)).append(LS);

            String nextPrefix = prefix + (last ? SPACE_INDENT : PIPE_INDENT);
            boolean empty = child.getLines().isEmpty() && child.getBlocks().isEmpty();
            printComments(out, child.getComments(), nextPrefix, empty);
            printBlock(out, child, nextPrefix);
        }
    }

    private static void printComments(StringBuilder out, List<String> comments, String prefix, boolean closeLast) {
        for (int j = 0; j < comments.size(); j++) {
            boolean last = closeLast && j == comments.size() - 1;
            out.append(prefix).append(last ? LAST_BRANCH : BRANCH).append("Comment: ").append(comments.get(j)).append(LS);
        }
    }

    private static String describe(Line line) {
        if (line.getType() == LineType.COMMENT) {
            return line.getType().getLabel() + ": " + String.join(" ", line.getComments());
        }
        return line.getType().getLabel() + ": " + statement(line.getName(), line.getArguments());
    }

    private static String header(Block block) {
        String header = statement(block.getName(), block.getArguments()) + " {}";
        if (!block.getComments().isEmpty()) {
            header += " (Comments: " + block.getComments().size() + ")";
        }
        return header;
    }

    private static String statement(String name, List<String> arguments) {
        return arguments.isEmpty() ? name : name + " " + String.join(" ", arguments);
    }
}
