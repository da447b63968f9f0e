package nginxconf.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BlockTest {

    @Test
    void blockLineCannotBeAddedWithoutChild() {
        var root = Block.root();
        var line = Line.builder().type(LineType.BLOCK).name("http").build();

        assertThrows(IllegalArgumentException.class, () -> root.addLine(line));
        assertTrue(root.getLines().isEmpty());
        assertTrue(root.getBlocks().isEmpty());
    }

    @Test
    void addBlockKeepsLinesAndBlocksAligned() {
        var root = Block.root();
        root.addLine(Line.comment("top", 1));
        var http = new Block("http", List.of(), List.of("main"), root, 2);
        root.addBlock(http);

        assertEquals(2, root.getLines().size());
        var blockLine = root.getLines().get(1);
        assertEquals(LineType.BLOCK, blockLine.getType());
        assertEquals("http", blockLine.getName());
        assertEquals(List.of("main"), blockLine.getComments());
        assertSame(http, root.getBlocks().get(0));
    }

    @Test
    void childOfAnotherParentIsRejected() {
        var root = Block.root();
        var other = Block.root();
        var orphan = new Block("server", List.of(), List.of(), other, 1);

        assertThrows(IllegalArgumentException.class, () -> root.addBlock(orphan));
    }

    @Test
    void countBlocksIncludesNestedBlocks() {
        var root = Block.root();
        var http = new Block("http", List.of(), List.of(), root, 1);
        root.addBlock(http);
        var server = new Block("server", List.of(), List.of(), http, 2);
        http.addBlock(server);
        server.addBlock(new Block("location", List.of("/"), List.of(), server, 3));
        root.addBlock(new Block("events", List.of(), List.of(), root, 5));

        assertEquals(4, root.countBlocks());
        assertEquals(1, server.countBlocks());
        assertEquals(3, server.getBlocks().get(0).depth());
    }
}
