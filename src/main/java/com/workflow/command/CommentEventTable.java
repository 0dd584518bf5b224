package com.workflow.command;

import com.workflow.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable table of comment-bearing events, in declaration order.
 */
public class CommentEventTable {

    private static final Logger log = LoggerFactory.getLogger(CommentEventTable.class);

    /**
     * Classpath location of the bundled event table.
     */
    public static final String DEFAULT_PATH = "classpath:comment-events.yaml";

    private static final String PULL_REQUEST_COMMENT_EVENT = "pull_request_comment";

    private final List<CommentEventMapping> mappings;

    public CommentEventTable(List<CommentEventMapping> mappings) {
        this.mappings = List.copyOf(mappings);
    }

    /**
     * Load the bundled event table.
     */
    public static CommentEventTable defaults() {
        return ConfigLoader.loadCommentEvents(DEFAULT_PATH);
    }

    /**
     * All mappings in table order.
     */
    public List<CommentEventMapping> all() {
        return mappings;
    }

    public Optional<CommentEventMapping> findByIdentifier(String identifier) {
        for (CommentEventMapping mapping : mappings) {
            if (mapping.eventName().equals(identifier)) {
                return Optional.of(mapping);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve event identifiers against the table.
     * Null or empty input selects every event; unknown identifiers are dropped.
     *
     * @param identifiers Requested event identifiers
     * @return Matching mappings in the order requested
     */
    public List<CommentEventMapping> filter(List<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            log.debug("No command events specified, using all {} events", mappings.size());
            return mappings;
        }

        List<CommentEventMapping> result = new ArrayList<>();
        for (String identifier : identifiers) {
            Optional<CommentEventMapping> mapping = findByIdentifier(identifier);
            if (mapping.isPresent()) {
                result.add(mapping.get());
            } else {
                log.warn("Ignoring unknown command event '{}'", identifier);
            }
        }
        return result;
    }

    public static List<String> eventNames(List<CommentEventMapping> mappings) {
        return mappings.stream().map(CommentEventMapping::eventName).toList();
    }

    /**
     * Platform event name for an identifier. Both pull_request_comment and issue_comment
     * are delivered as issue_comment.
     */
    public String actualEventName(String identifier) {
        return findByIdentifier(identifier)
                .map(CommentEventMapping::actualEventName)
                .orElse(identifier);
    }

    /**
     * Merge mappings into the events a workflow trigger section declares.
     * <p>
     * When both issue_comment and pull_request_comment are present they collapse into a single
     * unrestricted issue_comment mapping placed last. Otherwise pull_request_comment is rewritten
     * to issue_comment, keeping its types and pull request restriction.
     */
    public static List<CommentEventMapping> mergeForTriggers(List<CommentEventMapping> mappings) {
        boolean hasIssueComment = false;
        boolean hasPrComment = false;
        for (CommentEventMapping mapping : mappings) {
            switch (mapping.eventName()) {
                case CommentEventMapping.ISSUE_COMMENT_EVENT -> hasIssueComment = true;
                case PULL_REQUEST_COMMENT_EVENT -> hasPrComment = true;
                default -> {
                }
            }
        }

        List<CommentEventMapping> result = new ArrayList<>();
        if (hasIssueComment && hasPrComment) {
            String bodyProperty = null;
            for (CommentEventMapping mapping : mappings) {
                if (isCommentEvent(mapping)) {
                    bodyProperty = mapping.bodyProperty();
                    continue;
                }
                result.add(mapping);
            }
            result.add(new CommentEventMapping(CommentEventMapping.ISSUE_COMMENT_EVENT,
                    List.of("created", "edited"), false, false, bodyProperty));
            return result;
        }

        for (CommentEventMapping mapping : mappings) {
            if (PULL_REQUEST_COMMENT_EVENT.equals(mapping.eventName())) {
                result.add(new CommentEventMapping(CommentEventMapping.ISSUE_COMMENT_EVENT,
                        mapping.types(), true, false, mapping.bodyProperty()));
            } else {
                result.add(mapping);
            }
        }
        return result;
    }

    private static boolean isCommentEvent(CommentEventMapping mapping) {
        return CommentEventMapping.ISSUE_COMMENT_EVENT.equals(mapping.eventName())
                || PULL_REQUEST_COMMENT_EVENT.equals(mapping.eventName());
    }

    @Override
    public String toString() {
        return "CommentEventTable" + eventNames(mappings);
    }
}
