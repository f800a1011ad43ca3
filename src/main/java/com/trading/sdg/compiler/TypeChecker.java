package com.trading.sdg.compiler;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

import com.trading.sdg.api.Constant;
import com.trading.sdg.api.DataType;
import com.trading.sdg.api.IOSlot;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;

/**
 * Infers value types of inputs and inserts the casts the language allows:
 * numeric to Boolean (non-zero is true), Boolean to numeric and Boolean or
 * numeric to String. Any other mismatch is a compile error.
 */
final class TypeChecker {

    static final String CAST_TO_BOOLEAN = "static_cast_to_boolean";
    static final String CAST_TO_DECIMAL = "static_cast_to_decimal";
    static final String CAST_TO_INTEGER = "static_cast_to_integer";
    static final String STRINGIFY = "stringify";

    private final MetadataRegistry registry;
    private final Function<String, Node> nodes;

    TypeChecker(MetadataRegistry registry, Function<String, Node> nodes) {
        this.registry = registry;
        this.nodes = nodes;
    }

    /** Type of a wired value; {@link DataType#ANY} when it cannot be narrowed. */
    DataType typeOf(InputValue value) {
        if (value instanceof InputValue.Literal l)
            return l.value().type();
        InputValue.NodeReference ref = (InputValue.NodeReference) value;
        return outputType(ref.nodeId(), ref.handle(), 0);
    }

    private DataType outputType(String nodeId, String handle, int depth) {
        Node node = nodes.apply(nodeId);
        if (node == null || depth > 64)
            return DataType.ANY;
        OperationMetadata meta = registry.find(node.getType()).orElse(null);
        if (meta == null)
            return DataType.ANY;
        DataType declared = meta.output(handle).map(IOSlot::type).orElse(DataType.ANY);
        if (declared != DataType.ANY)
            return declared;
        // Pass-through operations take the type of their single input
        List<InputValue> in = node.getInputs().get("SLOT");
        if (in == null || in.size() != 1)
            return DataType.ANY;
        InputValue v = in.get(0);
        if (v instanceof InputValue.Literal l)
            return l.value().type();
        InputValue.NodeReference r = (InputValue.NodeReference) v;
        return outputType(r.nodeId(), r.handle(), depth + 1);
    }

    /**
     * Returns {@code value} adapted to {@code target}, converting literals in
     * place and inserting a cast node for references.
     *
     * @param factory creates cast nodes in the current compilation.
     * @param error   message used when no cast applies.
     * @throws CompileException INVALID_TYPE_CAST if the types cannot be reconciled.
     */
    InputValue coerce(InputValue value, DataType target, CastNodeFactory factory, Supplier<String> error, int line) {
        DataType source = typeOf(value);
        if (source.isCompatibleWith(target))
            return value;

        if (value instanceof InputValue.Literal l && !l.value().isNull()) {
            Constant c = convertLiteral(l.value(), target);
            if (c != null)
                return InputValue.literal(c);
            throw new CompileException(CompileErrorKind.INVALID_TYPE_CAST, error.get(), line);
        }
        String castType = castFor(source, target);
        if (castType == null)
            throw new CompileException(CompileErrorKind.INVALID_TYPE_CAST, error.get(), line);
        String base = STRINGIFY.equals(castType) ? "stringify" : "static_cast";
        Node cast = factory.create(base, castType);
        cast.input("SLOT", value);
        return InputValue.ref(cast.getId(), "result");
    }

    static String castFor(DataType source, DataType target) {
        if (target == DataType.BOOLEAN && source.isNumeric())
            return CAST_TO_BOOLEAN;
        if (target.isNumeric() && source == DataType.BOOLEAN)
            return target == DataType.INTEGER ? CAST_TO_INTEGER : CAST_TO_DECIMAL;
        if (target == DataType.STRING && (source == DataType.BOOLEAN || source.isNumeric()))
            return STRINGIFY;
        return null;
    }

    static Constant convertLiteral(Constant c, DataType target) {
        DataType source = c.type();
        if (target == DataType.BOOLEAN && source.isNumeric())
            return Constant.bool(c.asBoolean());
        if (target.isNumeric() && source == DataType.BOOLEAN) {
            boolean b = (Boolean) c.value();
            return target == DataType.INTEGER ? Constant.integer(b ? 1 : 0) : Constant.decimal(b ? 1.0 : 0.0);
        }
        if (target == DataType.STRING && source == DataType.BOOLEAN)
            return Constant.string((Boolean) c.value() ? "True" : "False");
        if (target == DataType.STRING && source.isNumeric())
            return Constant.string(String.valueOf(c.value()));
        return null;
    }

    /** Creates and registers a cast node with a fresh id derived from {@code base}. */
    @FunctionalInterface
    interface CastNodeFactory {
        Node create(String base, String type);
    }
}
