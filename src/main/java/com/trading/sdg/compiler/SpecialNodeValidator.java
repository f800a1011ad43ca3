package com.trading.sdg.compiler;

import com.trading.sdg.api.DataType;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;

/**
 * Extra compile-time check for operation families whose constraints cannot be
 * expressed in metadata alone.
 */
public interface SpecialNodeValidator {

    boolean supports(String type);

    /**
     * @throws CompileException if the node is invalid.
     */
    void validate(Node node, OperationMetadata metadata, NodeTypes types);

    /** Output type lookup over the graph being validated. */
    @FunctionalInterface
    interface NodeTypes {
        DataType typeOf(InputValue value);
    }
}
