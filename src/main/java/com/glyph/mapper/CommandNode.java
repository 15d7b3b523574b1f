package com.glyph.mapper;

import java.util.List;

/**
 * A command with its nested child commands.
 */
public record CommandNode(CommandRecord command, List<CommandNode> children) {

    public CommandNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static CommandNode leaf(CommandRecord command) {
        return new CommandNode(command, List.of());
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
