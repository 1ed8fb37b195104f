package com.forgebot.worker.event;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CommentCommandTest {

    @Test
    void parse_commandWithoutArguments() {
        Optional<CommentCommand> cmd = CommentCommand.parse("/packit build", "/packit");

        assertThat(cmd).isPresent();
        assertThat(cmd.get().command()).isEqualTo("build");
        assertThat(cmd.get().arguments()).isEmpty();
    }

    @Test
    void parse_atMostTwoArgumentsAreSplitOff() {
        CommentCommand cmd = CommentCommand.parse("/packit propose-downstream f38 f39 rawhide", "/packit")
                .orElseThrow();

        assertThat(cmd.command()).isEqualTo("propose-downstream");
        // the last argument keeps the rest of the line
        assertThat(cmd.arguments()).containsExactly("f38", "f39 rawhide");
    }

    @Test
    void parse_firstLineWithPrefixWins() {
        String comment = """
                Thanks for the release!

                /packit test
                /packit build
                """;

        assertThat(CommentCommand.parse(comment, "/packit"))
                .map(CommentCommand::command)
                .contains("test");
    }

    @Test
    void parse_prefixMustBeTheFirstToken() {
        assertThat(CommentCommand.parse("please /packit build", "/packit")).isEmpty();
        assertThat(CommentCommand.parse("/packitbuild", "/packit")).isEmpty();
    }

    @Test
    void parse_emptyOrPrefixOnly_yieldsNoCommand() {
        assertThat(CommentCommand.parse(null, "/packit")).isEmpty();
        assertThat(CommentCommand.parse("   ", "/packit")).isEmpty();
        assertThat(CommentCommand.parse("/packit", "/packit")).isEmpty();
        assertThat(CommentCommand.parse("LGTM", "/packit")).isEmpty();
    }

    @Test
    void parse_leadingWhitespaceIsIgnored() {
        assertThat(CommentCommand.parse("   /packit   copr-build  ", "/packit"))
                .contains(new CommentCommand("copr-build", List.of()));
    }
}
