package nginxconf.mappers;

import lombok.extern.slf4j.Slf4j;
import nginxconf.model.Block;
import nginxconf.model.Line;
import nginxconf.model.LineType;
import nginxconf.model.NginxConfig;
import nginxconf.parser.ConfigParser;
import nginxconf.parser.DirectiveSplitter;
import nginxconf.parser.ParserOptions;
import nginxconf.parser.SplitLine;
import nginxconf.render.ConfigPrinter;
import org.apache.commons.lang3.NotImplementedException;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens an nginx configuration into {@code http[0].server[1].listen[0]} style keys and writes an edited
 * map back using the structure remembered under {@link #META_KEY}.
 * <p>
 * The index after a name counts earlier lines of the same name in the same block, blocks and directives alike.
 * A {@code .}, {@code [}, {@code ]} or backslash inside a name is escaped with a backslash.
 * Comment-only lines have no key; they are kept as long as the block holding them is.
 */
@Slf4j
public class FlatNginx implements FlatService {

    public static final String META_KEY = "\u0000__flat_nginx_meta__";
    private static final String SOURCE_NAME = "<flat>";
    private static final String COMMENT_SEPARATOR = "\n";
    private static final DirectiveSplitter SPLITTER = new DirectiveSplitter();

    private final ConfigParser parser;
    private final ConfigPrinter printer;

    public FlatNginx() {
        this(ParserOptions.defaults());
    }

    public FlatNginx(ParserOptions options) {
        this.parser = new ConfigParser(options);
        this.printer = new ConfigPrinter(options);
    }

    @Override
    public Map<String, FileDataItem> flatToMap(String data) {
        Map<String, FileDataItem> result = new LinkedHashMap<>();
        NginxConfig config = parser.parse(SOURCE_NAME, data == null ? StringUtils.EMPTY : data);

        flattenBlock(config.getRootBlock(), StringUtils.EMPTY, result);

        result.put(META_KEY, FileDataItem.builder()
                .key(META_KEY)
                .value(config)
                .build());
        return result;
    }

    @Override
    public String flatToString(Map<String, FileDataItem> data) {
        if (data == null || data.isEmpty()) {
            return StringUtils.EMPTY;
        }
        NginxConfig meta = extractMeta(data);

        Set<String> used = new HashSet<>();
        Block root = Block.root();
        rebuildBlock(meta.getRootBlock(), root, StringUtils.EMPTY, data, used);

        for (String key : data.keySet()) {
            if (!META_KEY.equals(key) && !used.contains(key)) {
                log.warn("Key '{}' has no place in the configuration structure, skipped", key);
            }
        }
        return printer.print(new NginxConfig(root, meta.getFilePath()));
    }

    @Override
    public void validate(Map<String, FileDataItem> data) {
        throw new NotImplementedException("Validation of nginx configuration files is not implemented yet.");
    }

    private static void flattenBlock(Block block, String path, Map<String, FileDataItem> result) {
        KeyCounter counter = new KeyCounter(path);
        int childIndex = 0;
        for (Line line : block.getLines()) {
            if (line.getType() == LineType.COMMENT) {
                continue;
            }
            String key = counter.next(line.getName());
            result.put(key, FileDataItem.builder()
                    .key(key)
                    .value(String.join(" ", line.getArguments()))
                    .comment(joinComments(line.getComments()))
                    .type(line.getType())
                    .lineNumber(line.getLineNumber())
                    .build());
            if (line.getType() == LineType.BLOCK) {
                flattenBlock(block.getBlocks().get(childIndex++), key + ".", result);
            }
        }
    }

    private static void rebuildBlock(Block source, Block target, String path,
                                     Map<String, FileDataItem> data, Set<String> used) {
        KeyCounter counter = new KeyCounter(path);
        int childIndex = 0;
        for (Line line : source.getLines()) {
            if (line.getType() == LineType.COMMENT) {
                target.addLine(line);
                continue;
            }
            String key = counter.next(line.getName());
            Block sourceChild = line.getType() == LineType.BLOCK ? source.getBlocks().get(childIndex++) : null;
            FileDataItem item = data.get(key);
            if (item == null) {
                continue;
            }
            used.add(key);

            List<String> arguments = splitValue(item.getValue());
            List<String> comments = splitComments(item.getComment());
            checkStatement(key, line.getName(), arguments, sourceChild != null);
            if (sourceChild != null) {
                Block child = new Block(line.getName(), arguments, comments, target, line.getLineNumber());
                target.addBlock(child);
                rebuildBlock(sourceChild, child, key + ".", data, used);
            } else {
                target.addLine(line.toBuilder()
                        .clearArguments()
                        .arguments(arguments)
                        .clearComments()
                        .comments(comments)
                        .build());
            }
        }
    }

    /**
     * Rejects a value that would parse back as something other than this one line, e.g. one carrying an
     * unquoted {@code ;}, brace or {@code #}.
     */
    private static void checkStatement(String key, String name, List<String> arguments, boolean block) {
        String statement = arguments.isEmpty() ? name : name + " " + String.join(" ", arguments);
        String text = block ? StringUtils.trimToEmpty(statement + " {") : statement;
        SplitLine split = SPLITTER.split(text);

        boolean single = !split.hasComment()
                && split.getFragments().size() == 1
                && split.getFragments().get(0).equals(text);
        boolean opensBlock = single
                && !split.isUnterminatedQuote()
                && text.charAt(text.length() - 1) == '{';
        if (!single || opensBlock != block) {
            throw new IllegalArgumentException("Value of '" + key + "' changes the configuration structure: " + arguments);
        }
    }

    private static NginxConfig extractMeta(Map<String, FileDataItem> data) {
        FileDataItem meta = data.get(META_KEY);
        if (meta == null || !(meta.getValue() instanceof NginxConfig)) {
            throw new IllegalArgumentException("Flat nginx data has no structure metadata under " + META_KEY.substring(1));
        }
        return (NginxConfig) meta.getValue();
    }

    private static List<String> splitValue(Object value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.asList(StringUtils.split(value.toString()));
    }

    private static String joinComments(List<String> comments) {
        return comments.isEmpty() ? null : String.join(COMMENT_SEPARATOR, comments);
    }

    private static List<String> splitComments(String comment) {
        if (StringUtils.isBlank(comment)) {
            return List.of();
        }
        List<String> comments = new ArrayList<>();
        for (String part : comment.split(COMMENT_SEPARATOR)) {
            String trimmed = StringUtils.removeStart(part.trim(), "#").trim();
            if (!trimmed.isEmpty()) {
                comments.add(trimmed);
            }
        }
        return comments;
    }

    private static final class KeyCounter {
        private final String path;
        private final Map<String, Integer> seen = new HashMap<>();

        KeyCounter(String path) {
            this.path = path;
        }

        String next(String name) {
            int index = seen.merge(name, 1, Integer::sum) - 1;
            return path + escape(name) + "[" + index + "]";
        }

        private static String escape(String name) {
            StringBuilder escaped = new StringBuilder(name.length());
            for (int i = 0; i < name.length(); i++) {
                char c = name.charAt(i);
                if (c == '\\' || c == '.' || c == '[' || c == ']') {
                    escaped.append('\\');
                }
                escaped.append(c);
            }
            return escaped.toString();
        }
    }
}
