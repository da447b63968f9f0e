package nginxconf.parser;

import lombok.extern.slf4j.Slf4j;
import nginxconf.model.Block;
import nginxconf.model.Line;
import nginxconf.model.LineType;
import nginxconf.model.NginxConfig;
import nginxconf.model.ParseWarning;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a {@link NginxConfig} tree from configuration text, one physical line at a time.
 * <p>
 * Parsing never fails on malformed structure: a stray closing brace at root depth is ignored, blocks left
 * open at the end of input stay in the tree as built, and an unterminated quote runs to the end of its
 * line. Each of these is reported as a {@link ParseWarning} on the result.
 */
@Slf4j
public class ConfigParser {

    private static final String BLOCK_CLOSE = "}";
    private static final char BLOCK_OPEN = '{';

    private final ParserOptions options;
    private final DirectiveSplitter splitter;

    public ConfigParser() {
        this(ParserOptions.defaults());
    }

    public ConfigParser(ParserOptions options) {
        this.options = Validate.notNull(options, "options");
        this.splitter = new DirectiveSplitter();
    }

    public NginxConfig parse(Path path) {
        Validate.notNull(path, "path");
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigReadException(path, e);
        }
        return parse(path.toString(), lines);
    }

    public NginxConfig parse(String sourceName, String text) {
        Validate.notNull(text, "text");
        return parse(sourceName, text.lines().collect(Collectors.toList()));
    }

    public NginxConfig parse(String sourceName, List<String> lines) {
        Validate.notNull(sourceName, "sourceName");
        Validate.notNull(lines, "lines");

        ParseContext ctx = new ParseContext();
        for (String rawLine : lines) {
            ctx.lineNumber++;
            String trimmed = StringUtils.trimToEmpty(rawLine);
            if (trimmed.isEmpty()) {
                continue;
            }
            processLine(ctx, trimmed);
        }

        NginxConfig config = ctx.toResult(sourceName);
        log.debug("Parsed {}: {} lines, {} blocks, {} warnings",
                sourceName, ctx.lineNumber, config.getRootBlock().countBlocks(), config.getWarnings().size());
        return config;
    }

    private void processLine(ParseContext ctx, String line) {
        SplitLine split = splitter.split(line);
        if (split.isUnterminatedQuote()) {
            ctx.warn(ParseWarning.Kind.UNTERMINATED_QUOTE, "unterminated quote runs to the end of the line");
        }

        if (split.isCommentOnly()) {
            if (split.hasComment()) {
                ctx.current().addLine(Line.comment(split.getComment(), ctx.lineNumber));
            }
            return;
        }

        if (BLOCK_CLOSE.equals(split.getDirectiveText())) {
            ctx.closeBlock();
            return;
        }

        String comment = split.getComment();
        for (String fragment : split.getFragments()) {
            List<String> words = Arrays.asList(StringUtils.split(fragment));
            if (words.isEmpty()) {
                continue;
            }
            List<String> comments = comment == null ? List.of() : List.of(comment);

            if (fragment.charAt(fragment.length() - 1) == BLOCK_OPEN) {
                ctx.openBlock(blockName(words), blockArguments(words), comments);
            } else {
                ctx.current().addLine(Line.builder()
                        .type(lineType(words.get(0)))
                        .name(words.get(0))
                        .arguments(words.subList(1, words.size()))
                        .comments(comments)
                        .lineNumber(ctx.lineNumber)
                        .build());
            }
            comment = null;
        }
    }

    private LineType lineType(String name) {
        return options.getIncludeDirective().equals(name) ? LineType.INCLUDE : LineType.DIRECTIVE;
    }

    private static String blockName(List<String> words) {
        String name = words.get(0);
        return words.size() == 1 ? StringUtils.removeEnd(name, String.valueOf(BLOCK_OPEN)) : name;
    }

    private static List<String> blockArguments(List<String> words) {
        if (words.size() == 1) {
            return List.of();
        }
        List<String> arguments = new ArrayList<>(words.subList(1, words.size() - 1));
        String last = StringUtils.removeEnd(words.get(words.size() - 1), String.valueOf(BLOCK_OPEN));
        if (!last.isEmpty()) {
            arguments.add(last);
        }
        return arguments;
    }

    private final class ParseContext {
        private final Block root = Block.root();
        private final Deque<Block> stack = new ArrayDeque<>();
        private final List<ParseWarning> warnings = new ArrayList<>();
        private int lineNumber;

        ParseContext() {
            stack.push(root);
        }

        Block current() {
            return stack.peek();
        }

        void openBlock(String name, List<String> arguments, List<String> comments) {
            Block parent = current();
            Block child = new Block(name, arguments, comments, parent, lineNumber);
            parent.addBlock(child);
            stack.push(child);
        }

        void closeBlock() {
            if (stack.size() > 1) {
                stack.pop();
            } else {
                warn(ParseWarning.Kind.STRAY_CLOSING_BRACE, "closing brace without an open block ignored");
            }
        }

        void warn(ParseWarning.Kind kind, String message) {
            warn(kind, lineNumber, message);
        }

        void warn(ParseWarning.Kind kind, int line, String message) {
            ParseWarning warning = new ParseWarning(kind, line, message);
            warnings.add(warning);
            if (options.isLogWarnings()) {
                log.warn("{}", warning);
            }
        }

        NginxConfig toResult(String sourceName) {
            while (stack.size() > 1) {
                Block open = stack.pop();
                warn(ParseWarning.Kind.UNCLOSED_BLOCK, open.getLineNumber(),
                        "block '" + open.getName() + "' is not closed before the end of " + sourceName);
            }
            return new NginxConfig(root, sourceName, warnings);
        }
    }
}
