package nginxconf.render;

import nginxconf.model.Block;
import nginxconf.model.Line;
import nginxconf.model.LineType;
import nginxconf.model.NginxConfig;
import nginxconf.parser.ConfigParser;
import nginxconf.parser.ParserOptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigPrinterTest {

    private static final String INPUT_1 = "src/test/resources/flat_mapper/nginx/input_1.conf";
    private static final String EXPECTED_PRINT_1 = "src/test/resources/flat_mapper/nginx/expected_print_1.conf";

    private final ConfigParser parser = new ConfigParser();

    @Test
    void printsWithTwoSpaceIndent() throws Exception {
        var config = parser.parse(Paths.get(INPUT_1));

        var actual = new ConfigPrinter().print(config);

        var expected = Files.readString(Paths.get(EXPECTED_PRINT_1));
        assertEquals(expected, actual);
    }

    @Test
    void reparsingPrintedOutputKeepsStructure() throws Exception {
        var original = parser.parse(Paths.get(INPUT_1));
        var printed = new ConfigPrinter().print(original);

        var reparsed = parser.parse("printed", printed);

        assertEquals(outline(original.getRootBlock()), outline(reparsed.getRootBlock()));
        assertEquals(original.getRootBlock(), reparsed.getRootBlock());
    }

    @Test
    void printingIsStableAfterOneRoundTrip() {
        var printer = new ConfigPrinter();
        var once = printer.print(parser.parse("a", "a 1; b 2 ;c 3 # x\nm {\n   n \"o;p\";\n}\n{\n}"));
        var twice = printer.print(parser.parse("b", once));

        assertEquals(once, twice);
        assertEquals("a 1; # x\nb 2;\nc 3;\nm {\n  n \"o;p\";\n}\n{\n}\n", once);
    }

    @Test
    void openQuoteIsPrintedWithoutTerminator() {
        var quiet = new ConfigParser(ParserOptions.builder().logWarnings(false).build());
        var printer = new ConfigPrinter();
        var original = quiet.parse("a", "return 200 'oops;\nlisten 80;");

        var printed = printer.print(original);
        var reparsed = quiet.parse("b", printed);

        assertEquals("return 200 'oops;\nlisten 80;\n", printed);
        assertEquals(List.of("200", "'oops;"), reparsed.getRootBlock().getLines().get(0).getArguments());
        assertEquals(original.getRootBlock(), reparsed.getRootBlock());
        assertEquals(printed, printer.print(reparsed));
    }

    @Test
    void indentComesFromOptions() {
        var options = ParserOptions.builder().indent("\t").build();
        var config = new ConfigParser(options).parse("test", "a {\nb {\nc;\n}\n}");

        assertEquals("a {\n\tb {\n\t\tc;\n\t}\n}\n", new ConfigPrinter(options).print(config));
    }

    @Test
    void emptyConfigPrintsNothing() {
        assertEquals("", new ConfigPrinter().print(new NginxConfig(Block.root(), "empty")));
    }

    private static List<String> outline(Block block) {
        List<String> result = new ArrayList<>();
        int child = 0;
        for (Line line : block.getLines()) {
            result.add(line.getType() + " " + line.getName() + " " + line.getArguments());
            if (line.getType() == LineType.BLOCK) {
                result.add("{");
                result.addAll(outline(block.getBlocks().get(child++)));
                result.add("}");
            }
        }
        return result;
    }
}
