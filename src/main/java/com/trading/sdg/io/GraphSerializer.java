package com.trading.sdg.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trading.sdg.api.Constant;
import com.trading.sdg.api.DataType;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OptionValue;
import com.trading.sdg.api.Session;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.compiler.CompilationResult;

/**
 * Reads and writes compiled graphs as JSON.
 *
 * <pre>
 * {"nodes": [{"id": "fast", "type": "ema", "timeframe": "1D",
 *             "options": {"period": {"kind": "INTEGER", "value": 10}},
 *             "inputs": {"SLOT": [{"kind": "ref", "value": "src#c"}]}}]}
 * </pre>
 *
 * Reading back a written graph yields an equal {@link CompilationResult}.
 */
public final class GraphSerializer {

    static final String REF = "ref";
    static final String LITERAL = "literal";

    private final ObjectMapper mapper;

    public GraphSerializer() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    // ── Writing ─────────────────────────────────────────────────────

    public String write(CompilationResult result) throws JsonProcessingException {
        return mapper.writeValueAsString(toDefinition(result.nodes()));
    }

    public void write(CompilationResult result, Path path) throws IOException {
        Files.writeString(path, write(result));
    }

    public static GraphDefinition toDefinition(List<Node> nodes) {
        GraphDefinition def = new GraphDefinition();
        for (Node n : nodes) {
            GraphDefinition.NodeDef nd = new GraphDefinition.NodeDef();
            nd.setId(n.getId());
            nd.setType(n.getType());
            for (var e : n.getOptions().entrySet())
                nd.getOptions().put(e.getKey(),
                        new GraphDefinition.OptionDef(e.getValue().kind().name(), e.getValue().value()));
            for (var e : n.getInputs().entrySet()) {
                List<GraphDefinition.InputDef> values = new ArrayList<>();
                for (InputValue v : e.getValue())
                    values.add(toInputDef(v));
                nd.getInputs().put(e.getKey(), values);
            }
            nd.setTimeframe(n.getTimeframe() == null ? null : n.getTimeframe().toString());
            nd.setSession(n.getSession() == null ? null : n.getSession().toString());
            def.getNodes().add(nd);
        }
        return def;
    }

    private static GraphDefinition.InputDef toInputDef(InputValue v) {
        if (v instanceof InputValue.NodeReference r)
            return new GraphDefinition.InputDef(REF, null, r.canonical());
        Constant c = ((InputValue.Literal) v).value();
        return new GraphDefinition.InputDef(LITERAL, c.type().name(), c.value());
    }

    // ── Reading ─────────────────────────────────────────────────────

    public CompilationResult read(String json) throws IOException {
        return fromDefinition(mapper.readValue(json, GraphDefinition.class));
    }

    public CompilationResult read(Path path) throws IOException {
        return read(Files.readString(path));
    }

    /**
     * @throws IllegalArgumentException on malformed entries such as an unknown
     *                                  input kind or a bad timeframe.
     */
    public static CompilationResult fromDefinition(GraphDefinition def) {
        List<Node> nodes = new ArrayList<>();
        for (GraphDefinition.NodeDef nd : def.getNodes()) {
            if (nd.getId() == null || nd.getType() == null)
                throw new IllegalArgumentException("Every node needs an id and a type");
            Node n = new Node(nd.getId(), nd.getType());
            if (nd.getOptions() != null) {
                for (Map.Entry<String, GraphDefinition.OptionDef> e : nd.getOptions().entrySet()) {
                    OptionValue.Kind kind = OptionValue.Kind.valueOf(e.getValue().getKind());
                    n.option(e.getKey(), MetadataLoader.toOptionValue(kind, e.getValue().getValue()));
                }
            }
            if (nd.getInputs() != null) {
                for (var e : nd.getInputs().entrySet()) {
                    for (GraphDefinition.InputDef in : e.getValue())
                        n.input(e.getKey(), toInputValue(nd.getId(), in));
                }
            }
            if (nd.getTimeframe() != null)
                n.setTimeframe(Timeframe.parse(nd.getTimeframe()));
            if (nd.getSession() != null)
                n.setSession(Session.parse(nd.getSession()));
            nodes.add(n);
        }
        return new CompilationResult(nodes);
    }

    private static InputValue toInputValue(String nodeId, GraphDefinition.InputDef in) {
        if (REF.equals(in.getKind()))
            return InputValue.NodeReference.parse(String.valueOf(in.getValue()));
        if (!LITERAL.equals(in.getKind()))
            throw new IllegalArgumentException("Unknown input kind '" + in.getKind() + "' on node '" + nodeId + "'");
        DataType type = DataType.fromString(in.getDataType());
        Object raw = in.getValue();
        if (raw == null)
            return InputValue.literal(Constant.nullOf(type));
        Object value = switch (type) {
            case INTEGER, TIMESTAMP -> ((Number) raw).longValue();
            case DECIMAL, NUMBER -> ((Number) raw).doubleValue();
            case BOOLEAN -> (Boolean) raw;
            default -> raw.toString();
        };
        return InputValue.literal(new Constant(type, value));
    }
}
