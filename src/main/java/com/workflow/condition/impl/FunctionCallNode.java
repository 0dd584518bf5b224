package com.workflow.condition.impl;

import com.workflow.condition.ConditionNode;
import com.workflow.condition.ConditionType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Function call such as {@code startsWith(github.ref, 'refs/tags/')} or {@code cancelled()}.
 */
public class FunctionCallNode implements ConditionNode {

    private final String functionName;
    private final List<ConditionNode> arguments;

    public FunctionCallNode(String functionName, List<ConditionNode> arguments) {
        this.functionName = functionName;
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<ConditionNode> getArguments() {
        return arguments;
    }

    @Override
    public String render() {
        return functionName + "(" + arguments.stream()
                .map(ConditionNode::render)
                .collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.FUNCTION_CALL;
    }

    @Override
    public String toString() {
        return "CALL(" + functionName + ", " + arguments + ")";
    }
}
