package com.workflow.command;

import com.workflow.condition.ConditionNode;
import com.workflow.exception.CommandConditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.workflow.condition.Conditions.*;

/**
 * Builds the condition that gates a workflow on a slash command appearing in the
 * text of the triggering event.
 * <p>
 * For every enabled comment event the guard is {@code event_name == '<event>' && <command check>},
 * where the command check looks for {@code /<name>} in the event's body property. Issue comments
 * and pull request comments share the issue_comment event and are told apart by
 * {@code github.event.issue.pull_request}. When the workflow has other triggers as well, the
 * result becomes {@code (commentEvents && guard) || !(commentEvents)} so those triggers are
 * never suppressed.
 */
public class CommandConditionBuilder {

    private static final Logger log = LoggerFactory.getLogger(CommandConditionBuilder.class);

    /**
     * Set on issue_comment payloads when the commented issue is a pull request.
     */
    public static final String ISSUE_PULL_REQUEST_PROPERTY = "github.event.issue.pull_request";

    /**
     * Order guards are emitted in. Events missing from this list follow in table order.
     */
    static final List<String> GUARD_ORDER = List.of(
            "issues", "issue_comment", "pull_request_comment", "pull_request_review_comment",
            "pull_request", "discussion", "discussion_comment");

    private final CommentEventTable eventTable;

    public CommandConditionBuilder(CommentEventTable eventTable) {
        this.eventTable = eventTable;
    }

    /**
     * Build the event-aware command condition.
     *
     * @param commandNames          Command names that trigger the workflow, without the leading '/'
     * @param enabledEvents         Event identifiers the command is active on; null or empty means all
     * @param hasOtherTriggerEvents Whether the workflow is also triggered by non-command events
     * @return Condition tree
     * @throws CommandConditionException if no names are given or no event resolves
     */
    public ConditionNode build(List<String> commandNames, List<String> enabledEvents, boolean hasOtherTriggerEvents) {
        log.debug("Building event-aware command condition: commands={}, events={}, hasOtherEvents={}",
                commandNames, enabledEvents, hasOtherTriggerEvents);

        if (commandNames == null || commandNames.isEmpty()) {
            throw new CommandConditionException("no command names provided");
        }

        List<CommentEventMapping> filtered = eventTable.filter(enabledEvents);
        Set<String> enabledNames = new LinkedHashSet<>(CommentEventTable.eventNames(filtered));

        // Guard order is fixed regardless of the order events were requested in
        List<ConditionNode> guards = new ArrayList<>();
        for (CommentEventMapping mapping : guardOrder()) {
            if (enabledNames.contains(mapping.eventName())) {
                guards.add(buildGuard(mapping, commandNames));
            }
        }

        if (guards.isEmpty()) {
            throw new CommandConditionException("no valid comment events specified for commands "
                    + commandNames + " - at least one event must be enabled");
        }
        ConditionNode commandCondition = disjunction(false, guards);

        if (!hasOtherTriggerEvents) {
            return commandCondition;
        }

        // One discriminator term per distinct platform event
        Set<String> actualEvents = new LinkedHashSet<>();
        for (CommentEventMapping mapping : filtered) {
            actualEvents.add(mapping.actualEventName());
        }
        List<ConditionNode> eventTerms = new ArrayList<>();
        for (String actualEvent : actualEvents) {
            eventTerms.add(eventTypeEquals(actualEvent));
        }
        ConditionNode commentEvents = disjunction(false, eventTerms);

        log.debug("Command condition covers {} comment events over {} platform events",
                guards.size(), actualEvents.size());

        return or(
                and(commentEvents, commandCondition),
                not(commentEvents)
        );
    }

    private List<CommentEventMapping> guardOrder() {
        List<CommentEventMapping> ordered = new ArrayList<>();
        for (String eventName : GUARD_ORDER) {
            eventTable.findByIdentifier(eventName).ifPresent(ordered::add);
        }
        for (CommentEventMapping mapping : eventTable.all()) {
            if (!GUARD_ORDER.contains(mapping.eventName())) {
                ordered.add(mapping);
            }
        }
        return ordered;
    }

    private ConditionNode buildGuard(CommentEventMapping mapping, List<String> commandNames) {
        ConditionNode commandCheck = buildCommandCheck(mapping.bodyProperty(), commandNames);
        ConditionNode eventCheck = eventTypeEquals(mapping.actualEventName());

        if (mapping.issueComment()) {
            return and(eventCheck, and(commandCheck,
                    equalTo(property(ISSUE_PULL_REQUEST_PROPERTY), nullLiteral())));
        }
        if (mapping.prComment()) {
            return and(eventCheck, and(commandCheck,
                    notEqualTo(property(ISSUE_PULL_REQUEST_PROPERTY), nullLiteral())));
        }
        return and(eventCheck, commandCheck);
    }

    private static ConditionNode buildCommandCheck(String bodyProperty, List<String> commandNames) {
        List<ConditionNode> checks = new ArrayList<>(commandNames.size());
        for (String commandName : commandNames) {
            checks.add(contains(property(bodyProperty), string("/" + commandName)));
        }
        return disjunction(false, checks);
    }
}
