package com.forgebot.worker.event;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A bot command parsed out of a comment body.
 *
 * The first non-blank line starting with the bot-mention prefix wins, e.g.
 * for prefix "/packit" the line "/packit propose-downstream f38 f39" yields
 * command "propose-downstream" with arguments ["f38", "f39"]. At most two
 * arguments are split off; the second one keeps the rest of the line.
 */
public record CommentCommand(String command, List<String> arguments) {

    public CommentCommand {
        arguments = List.copyOf(arguments);
    }

    public static Optional<CommentCommand> parse(String comment, String prefix) {
        if (comment == null || comment.isBlank()) {
            return Optional.empty();
        }
        for (String line : comment.strip().split("\n")) {
            String stripped = line.strip();
            if (stripped.isEmpty()) continue;

            // mark + command + up to two arguments
            String[] parts = stripped.split("\\s+", 4);
            if (parts[0].equals(prefix) && parts.length > 1) {
                return Optional.of(new CommentCommand(parts[1],
                        Arrays.asList(parts).subList(2, parts.length)));
            }
        }
        return Optional.empty();
    }
}
