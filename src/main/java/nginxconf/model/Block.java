package nginxconf.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named scope delimited by braces. The root block has no parent.
 * <p>
 * Every {@link LineType#BLOCK} entry of {@link #getLines()} matches, in order, one entry of {@link #getBlocks()}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Block {

    public static final String ROOT_NAME = "<root>";

    private final String name;
    private final List<String> arguments;
    private final List<String> comments;
    private final List<Line> lines = new ArrayList<>();
    private final List<Block> blocks = new ArrayList<>();

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final Block parent;

    @EqualsAndHashCode.Exclude
    private final int lineNumber;

    public Block(String name, List<String> arguments, List<String> comments, Block parent, int lineNumber) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
        this.comments = List.copyOf(comments);
        this.parent = parent;
        this.lineNumber = lineNumber;
    }

    public static Block root() {
        return new Block(ROOT_NAME, List.of(), List.of(), null, 0);
    }

    public boolean isRoot() {
        return parent == null;
    }

    public List<Line> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public List<Block> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Appends a comment, include or directive line. Child blocks go through {@link #addBlock(Block)}.
     */
    public void addLine(Line line) {
        if (line.getType() == LineType.BLOCK) {
            throw new IllegalArgumentException("Block line '" + line.getName() + "' must be added with addBlock");
        }
        lines.add(line);
    }

    /**
     * Appends {@code child} and its {@link LineType#BLOCK} line together, keeping both lists aligned.
     */
    public void addBlock(Block child) {
        if (child.getParent() != this) {
            throw new IllegalArgumentException("Block " + child.getName() + " belongs to another parent");
        }
        blocks.add(child);
        lines.add(Line.builder()
                .type(LineType.BLOCK)
                .name(child.getName())
                .arguments(child.getArguments())
                .comments(child.getComments())
                .lineNumber(child.getLineNumber())
                .build());
    }

    /**
     * Number of blocks below this one, at any depth.
     */
    public int countBlocks() {
        int count = blocks.size();
        for (Block child : blocks) {
            count += child.countBlocks();
        }
        return count;
    }

    public int depth() {
        int depth = 0;
        for (Block b = parent; b != null; b = b.parent) {
            depth++;
        }
        return depth;
    }
}
