package com.workflow.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.exception.CommandConditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factory for creating a CommandTrigger from the {@code on:} section of workflow frontmatter.
 * <p>
 * Accepted shapes for the command entry ({@code slash_command}, or the deprecated {@code command}):
 * <pre>
 * slash_command: bot            # or "/bot"
 * slash_command: [bot, helper]
 * slash_command:
 *   name: bot                   # or a list of names
 *   events: [issues, issue_comment]   # or "*" or a single event
 * </pre>
 */
public class CommandTriggerFactory {

    private static final Logger log = LoggerFactory.getLogger(CommandTriggerFactory.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String SLASH_COMMAND_KEY = "slash_command";
    public static final String LEGACY_COMMAND_KEY = "command";
    public static final String WORKFLOW_DISPATCH_KEY = "workflow_dispatch";

    /**
     * Keys of the {@code on:} section that are not trigger events.
     */
    private static final Set<String> NON_EVENT_KEYS = Set.of(
            SLASH_COMMAND_KEY, LEGACY_COMMAND_KEY, "stop-after", "reaction");

    private static final String ALL_EVENTS = "*";

    private CommandTriggerFactory() {
    }

    /**
     * Create a CommandTrigger from the {@code on:} section.
     *
     * @param on The {@code on:} map of the frontmatter
     * @return Command trigger
     * @throws CommandConditionException if the section has no usable command entry
     */
    public static CommandTrigger fromFrontmatter(Map<String, Object> on) {
        if (on == null) {
            throw new CommandConditionException("no command names provided");
        }

        Object commandValue;
        if (on.containsKey(SLASH_COMMAND_KEY)) {
            commandValue = on.get(SLASH_COMMAND_KEY);
        } else {
            commandValue = on.get(LEGACY_COMMAND_KEY);
            if (commandValue != null) {
                log.warn("'on.{}' is deprecated, use 'on.{}'", LEGACY_COMMAND_KEY, SLASH_COMMAND_KEY);
            }
        }

        List<String> names = new ArrayList<>();
        List<String> events = null;

        if (commandValue instanceof Map<?, ?> commandMap) {
            addNames(commandMap.get("name"), names);
            events = parseEvents(commandMap.get("events"));
        } else {
            addNames(commandValue, names);
        }

        if (names.isEmpty()) {
            throw new CommandConditionException("no command names provided");
        }

        boolean hasOtherEvents = on.keySet().stream().anyMatch(key -> !NON_EVENT_KEYS.contains(key));
        log.debug("Parsed command trigger: names={}, events={}, hasOtherEvents={}", names, events, hasOtherEvents);
        return new CommandTrigger(names, events, hasOtherEvents);
    }

    /**
     * Create a CommandTrigger from a JSON document holding the {@code on:} section.
     */
    public static CommandTrigger fromJson(String json) {
        return fromFrontmatter(parseJson(json));
    }

    /**
     * Parse the events field of a command entry.
     * Null, "*" or an empty list mean every comment event and yield null.
     */
    public static List<String> parseEvents(Object eventsValue) {
        if (eventsValue == null) {
            return null;
        }

        if (eventsValue instanceof String str) {
            if (ALL_EVENTS.equals(str)) {
                return null;
            }
            return List.of(str);
        }

        if (eventsValue instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof String str) {
                    result.add(str);
                }
            }
            if (!result.isEmpty()) {
                return result;
            }
        }

        log.warn("Could not parse command events '{}', using all events", eventsValue);
        return null;
    }

    /**
     * Parse a slash command shorthand such as "/bot".
     *
     * @param input Trigger value
     * @return Command name, or null when the input is not a shorthand
     * @throws CommandConditionException if the input is a bare '/'
     */
    public static String parseShorthand(String input) {
        if (input == null || !input.startsWith("/")) {
            return null;
        }
        String commandName = input.substring(1);
        if (commandName.isEmpty()) {
            throw new CommandConditionException("slash command shorthand cannot be empty after '/'");
        }
        log.debug("Parsed slash command shorthand: {} -> {}", input, commandName);
        return commandName;
    }

    /**
     * Expand a shorthand command into the {@code on:} section it stands for:
     * the slash command plus manual dispatch.
     */
    public static Map<String, Object> expandShorthand(String commandName) {
        Map<String, Object> on = new LinkedHashMap<>();
        on.put(SLASH_COMMAND_KEY, commandName);
        on.put(WORKFLOW_DISPATCH_KEY, null);
        return on;
    }

    private static void addNames(Object value, List<String> names) {
        if (value instanceof String str) {
            addName(str, names);
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String str) {
                    addName(str, names);
                }
            }
        }
    }

    private static void addName(String value, List<String> names) {
        if (!value.isBlank()) {
            names.add(toCommandName(value));
        }
    }

    private static String toCommandName(String value) {
        String trimmed = value.trim();
        String shorthand = parseShorthand(trimmed);
        return shorthand != null ? shorthand : trimmed;
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new CommandConditionException("Invalid trigger JSON: " + e.getOriginalMessage(), e);
        }
    }
}
