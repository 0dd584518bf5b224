package com.workflow.command;

import java.util.List;

/**
 * Describes a comment-bearing trigger event and where its user-authored text lives.
 *
 * @param eventName    Event identifier used in command configuration (e.g. "issues", "pull_request_comment")
 * @param types        Activity types of the event (e.g. "created", "edited")
 * @param prComment    True if this is issue_comment restricted to pull requests
 * @param issueComment True if this is issue_comment restricted to issues
 * @param bodyProperty Property path of the text a command is searched in
 */
public record CommentEventMapping(
        String eventName,
        List<String> types,
        boolean prComment,
        boolean issueComment,
        String bodyProperty
) {
    /**
     * Platform event that issue and pull request comments are both delivered as.
     */
    public static final String ISSUE_COMMENT_EVENT = "issue_comment";

    public CommentEventMapping {
        types = types == null ? List.of() : List.copyOf(types);
    }

    /**
     * Name of the platform event this mapping is actually delivered as.
     * Comments restricted to issues or to pull requests both arrive as issue_comment.
     */
    public String actualEventName() {
        return prComment || issueComment ? ISSUE_COMMENT_EVENT : eventName;
    }
}
