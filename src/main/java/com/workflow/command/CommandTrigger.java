package com.workflow.command;

import com.workflow.condition.ConditionNode;

import java.util.List;

/**
 * Slash command trigger of a workflow.
 *
 * @param names          Command names without the leading '/'
 * @param events         Event identifiers the command is active on; empty means all comment events
 * @param hasOtherEvents Whether the workflow declares other trigger events besides the command
 */
public record CommandTrigger(List<String> names, List<String> events, boolean hasOtherEvents) {

    public CommandTrigger {
        names = names == null ? List.of() : List.copyOf(names);
        events = events == null ? List.of() : List.copyOf(events);
    }

    /**
     * Build the gating condition for this trigger.
     */
    public ConditionNode toCondition(CommandConditionBuilder builder) {
        return builder.build(names, events, hasOtherEvents);
    }
}
