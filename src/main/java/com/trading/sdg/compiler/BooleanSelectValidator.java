package com.trading.sdg.compiler;

import java.util.List;

import com.trading.sdg.api.DataType;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;

/**
 * Conditional selects need exactly one condition and one value per branch,
 * and both branches must carry compatible types.
 */
public final class BooleanSelectValidator implements SpecialNodeValidator {

    @Override
    public boolean supports(String type) {
        return type.startsWith("boolean_select_");
    }

    @Override
    public void validate(Node node, OperationMetadata metadata, NodeTypes types) {
        InputValue cond = single(node, "condition");
        InputValue whenTrue = single(node, "true");
        InputValue whenFalse = single(node, "false");
        DataType c = types.typeOf(cond);
        if (!c.isCompatibleWith(DataType.BOOLEAN))
            throw CompileException.forNode(CompileErrorKind.INVALID_TYPE_CAST, "Cannot use type " + c
                    + " as the condition of '" + node.getId() + "'", node.getId(), node.getType(), "condition");
        DataType t = types.typeOf(whenTrue);
        DataType f = types.typeOf(whenFalse);
        if (!t.isCompatibleWith(f))
            throw CompileException.forNode(CompileErrorKind.INVALID_TYPE_CAST, "Branches of '" + node.getId()
                    + "' have incompatible types " + t + " and " + f, node.getId(), node.getType(), "false");
    }

    private static InputValue single(Node node, String handle) {
        List<InputValue> values = node.getInputs().get(handle);
        if (values == null || values.size() != 1)
            throw CompileException.forNode(CompileErrorKind.MISSING_REQUIRED_INPUT, "Node '" + node.getId()
                    + "' needs exactly one '" + handle + "' input", node.getId(), node.getType(), handle);
        return values.get(0);
    }
}
