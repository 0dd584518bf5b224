package com.workflow.command;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;
import com.workflow.condition.impl.DisjunctionNode;
import com.workflow.condition.impl.NotNode;
import com.workflow.condition.impl.OrNode;
import com.workflow.exception.CommandConditionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CommandConditionBuilder.
 */
class CommandConditionBuilderTest {

    private static final String ISSUES_GUARD =
            "(github.event_name == 'issues') && (contains(github.event.issue.body, '/bot'))";

    private CommandConditionBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new CommandConditionBuilder(CommentEventTable.defaults());
    }

    // =====================================================================
    // Command-only workflows
    // =====================================================================

    @Test
    @DisplayName("Single command on issues gives a single guard")
    void shouldBuildIssuesGuard() {
        ConditionNode node = builder.build(List.of("bot"), List.of("issues"), false);

        assertEquals(ISSUES_GUARD, node.render());
    }

    @Test
    @DisplayName("Several commands on the same field are OR'ed")
    void shouldCombineCommandNames() {
        ConditionNode node = builder.build(List.of("bot", "helper"), List.of("issues"), false);

        assertEquals("(github.event_name == 'issues') && (contains(github.event.issue.body, '/bot')"
                + " || contains(github.event.issue.body, '/helper'))", node.render());
    }

    @Test
    @DisplayName("Issue comments require the issue not to be a pull request")
    void shouldRestrictIssueComments() {
        ConditionNode node = builder.build(List.of("bot"), List.of("issue_comment"), false);

        assertEquals("(github.event_name == 'issue_comment') && ((contains(github.event.comment.body, '/bot'))"
                + " && (github.event.issue.pull_request == null))", node.render());
    }

    @Test
    @DisplayName("Pull request comments use issue_comment and require a pull request")
    void shouldRestrictPullRequestComments() {
        ConditionNode node = builder.build(List.of("bot"), List.of("pull_request_comment"), false);

        assertEquals("(github.event_name == 'issue_comment') && ((contains(github.event.comment.body, '/bot'))"
                + " && (github.event.issue.pull_request != null))", node.render());
    }

    @Test
    @DisplayName("Each event checks its own body property")
    void shouldUseEventBodyProperty() {
        assertEquals("(github.event_name == 'pull_request') && (contains(github.event.pull_request.body, '/bot'))",
                builder.build(List.of("bot"), List.of("pull_request"), false).render());
        assertEquals("(github.event_name == 'pull_request_review_comment')"
                        + " && (contains(github.event.comment.body, '/bot'))",
                builder.build(List.of("bot"), List.of("pull_request_review_comment"), false).render());
        assertEquals("(github.event_name == 'discussion') && (contains(github.event.discussion.body, '/bot'))",
                builder.build(List.of("bot"), List.of("discussion"), false).render());
        assertEquals("(github.event_name == 'discussion_comment') && (contains(github.event.comment.body, '/bot'))",
                builder.build(List.of("bot"), List.of("discussion_comment"), false).render());
    }

    @Test
    @DisplayName("Guards follow a fixed order and are joined by a flat disjunction")
    void shouldOrderGuardsIndependentlyOfRequest() {
        ConditionNode node = builder.build(List.of("bot"), List.of("discussion", "issues"), false);

        assertEquals(ConditionType.DISJUNCTION, node.getType());
        assertEquals(ISSUES_GUARD + " || (github.event_name == 'discussion')"
                + " && (contains(github.event.discussion.body, '/bot'))", node.render());
    }

    @Test
    @DisplayName("Review comment guard precedes the pull request guard")
    void shouldOrderReviewCommentBeforePullRequest() {
        ConditionNode node = builder.build(List.of("bot"),
                List.of("pull_request", "pull_request_review_comment"), false);

        assertEquals("(github.event_name == 'pull_request_review_comment')"
                + " && (contains(github.event.comment.body, '/bot'))"
                + " || (github.event_name == 'pull_request') && (contains(github.event.pull_request.body, '/bot'))",
                node.render());
    }

    @Test
    @DisplayName("Events outside the fixed guard order follow in table order")
    void shouldAppendCustomEventsLast() {
        CommentEventTable table = new CommentEventTable(List.of(
                new CommentEventMapping("release", List.of("published"), false, false, "github.event.release.body"),
                new CommentEventMapping("issues", List.of("opened"), false, false, "github.event.issue.body")));

        ConditionNode node = new CommandConditionBuilder(table).build(List.of("bot"), null, false);

        assertEquals(ISSUES_GUARD + " || (github.event_name == 'release')"
                + " && (contains(github.event.release.body, '/bot'))", node.render());
    }

    @Test
    @DisplayName("No events means every comment event")
    void shouldDefaultToAllEvents() {
        ConditionNode node = builder.build(List.of("bot"), List.of(), false);

        assertEquals(7, ((DisjunctionNode) node).getTerms().size());
        assertEquals(node.render(), builder.build(List.of("bot"), null, false).render());
    }

    // =====================================================================
    // Workflows with other triggers
    // =====================================================================

    @Test
    @DisplayName("Other triggers pass through when the event is not a comment event")
    void shouldAllowOtherEvents() {
        ConditionNode node = builder.build(List.of("bot"), List.of("issues"), true);

        assertEquals("((github.event_name == 'issues') && (" + ISSUES_GUARD + "))"
                + " || (!(github.event_name == 'issues'))", node.render());

        OrNode or = (OrNode) node;
        NotNode fallthrough = (NotNode) or.getRight();
        assertEquals("github.event_name == 'issues'", fallthrough.getChild().render());
    }

    @Test
    @DisplayName("Issue and pull request comments share one discriminator term")
    void shouldDeduplicateDiscriminator() {
        ConditionNode node = builder.build(List.of("bot"), List.of("issue_comment", "pull_request_comment"), true);

        NotNode fallthrough = (NotNode) ((OrNode) node).getRight();
        assertEquals(ConditionType.COMPARISON, fallthrough.getChild().getType());
        assertEquals("github.event_name == 'issue_comment'", fallthrough.getChild().render());
        assertTrue(node.render().endsWith("|| (!(github.event_name == 'issue_comment'))"));
    }

    @Test
    @DisplayName("Discriminator lists each platform event once")
    void shouldListDistinctPlatformEvents() {
        ConditionNode node = builder.build(List.of("bot"), null, true);

        NotNode fallthrough = (NotNode) ((OrNode) node).getRight();
        DisjunctionNode events = (DisjunctionNode) fallthrough.getChild();
        assertEquals(List.of(
                "github.event_name == 'issues'",
                "github.event_name == 'issue_comment'",
                "github.event_name == 'pull_request'",
                "github.event_name == 'pull_request_review_comment'",
                "github.event_name == 'discussion'",
                "github.event_name == 'discussion_comment'"
        ), events.getTerms().stream().map(ConditionNode::render).toList());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @Test
    @DisplayName("No command names is an error")
    void shouldRejectMissingNames() {
        CommandConditionException e = assertThrows(CommandConditionException.class,
                () -> builder.build(List.of(), List.of("issues"), false));
        assertEquals("no command names provided", e.getMessage());
        assertThrows(CommandConditionException.class, () -> builder.build(null, null, false));
    }

    @Test
    @DisplayName("Unknown events are dropped; none left is an error")
    void shouldRejectUnknownEvents() {
        assertEquals(ISSUES_GUARD, builder.build(List.of("bot"), List.of("push", "issues"), false).render());

        CommandConditionException e = assertThrows(CommandConditionException.class,
                () -> builder.build(List.of("bot"), List.of("push", "schedule"), true));
        assertTrue(e.getMessage().startsWith("no valid comment events specified"));
        assertTrue(e.getMessage().contains("[bot]"));
    }
}
