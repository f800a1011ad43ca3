package com.trading.sdg.compiler;

import java.util.List;

import com.trading.sdg.api.DataType;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;

/** Retypes generic {@code alias} nodes to the typed variant matching their input. */
final class AliasSpecializer {

    private final MetadataRegistry registry;
    private final TypeChecker types;

    AliasSpecializer(MetadataRegistry registry, TypeChecker types) {
        this.registry = registry;
        this.types = types;
    }

    void specialize(List<Node> nodes) {
        for (Node n : nodes) {
            if (!"alias".equals(n.getType()))
                continue;
            List<InputValue> in = n.getInputs().get("SLOT");
            if (in == null || in.size() != 1)
                continue;
            String typed = typedAlias(types.typeOf(in.get(0)));
            if (typed != null && registry.contains(typed))
                n.setType(typed);
        }
    }

    static String typedAlias(DataType t) {
        return switch (t) {
            case INTEGER -> "alias_integer";
            case DECIMAL, NUMBER -> "alias_decimal";
            case BOOLEAN -> "alias_boolean";
            case STRING -> "alias_string";
            case TIMESTAMP -> "alias_timestamp";
            case ANY -> null;
        };
    }
}
