package com.trading.sdg.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.sdg.api.DataType;
import com.trading.sdg.api.IOSlot;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.OperationMetadata;
import com.trading.sdg.api.OptionDefinition;
import com.trading.sdg.api.OptionValue;

import lombok.extern.log4j.Log4j2;

/**
 * Reads operation metadata from JSON into an immutable {@link MetadataRegistry}.
 */
@Log4j2
public final class MetadataLoader {

    /** Catalog of the built-in operations shipped on the classpath. */
    public static final String BUILTIN_RESOURCE = "/operations.json";

    private static final ObjectMapper SCHEMA_MAPPER = new ObjectMapper();

    private final ObjectMapper mapper = new ObjectMapper();

    public MetadataRegistry loadBuiltins() {
        try (InputStream in = MetadataLoader.class.getResourceAsStream(BUILTIN_RESOURCE)) {
            if (in == null)
                throw new IllegalStateException("Missing classpath resource " + BUILTIN_RESOURCE);
            return load(mapper.readValue(in, OperationDefinition.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + BUILTIN_RESOURCE, e);
        }
    }

    public MetadataRegistry load(Path path) throws IOException {
        return load(mapper.readValue(Files.readAllBytes(path), OperationDefinition.class));
    }

    public MetadataRegistry parse(String json) throws IOException {
        return load(mapper.readValue(json, OperationDefinition.class));
    }

    public MetadataRegistry load(OperationDefinition def) {
        MetadataRegistry.Builder builder = MetadataRegistry.builder();
        if (def.getOperations() != null) {
            for (OperationDefinition.OperationDef op : def.getOperations())
                builder.register(toMetadata(op));
        }
        MetadataRegistry registry = builder.build();
        log.debug("Loaded {} operation definitions", registry.size());
        return registry;
    }

    static OperationMetadata toMetadata(OperationDefinition.OperationDef op) {
        OperationMetadata.Builder b = OperationMetadata.builder(op.getType())
                .name(op.getName())
                .crossSectional(op.isCrossSectional())
                .atLeastOneInputRequired(op.isAtLeastOneInputRequired())
                .requiresTimeFrame(op.isRequiresTimeFrame())
                .intradayOnly(op.isIntradayOnly())
                .allowNullInputs(op.isAllowNullInputs());
        if (op.getCategory() != null)
            b.category(OperationMetadata.Category.valueOf(op.getCategory().toUpperCase()));
        for (OperationDefinition.SlotDef s : nullSafe(op.getInputs())) {
            boolean required = s.getRequired() == null || s.getRequired();
            b.input(new IOSlot(IOSlot.normalizeHandle(s.getId()), DataType.fromString(s.getType()), required,
                    s.isAllowMultiple()));
        }
        for (OperationDefinition.SlotDef s : nullSafe(op.getOutputs()))
            b.output(IOSlot.output(s.getId(), DataType.fromString(s.getType())));
        for (OperationDefinition.OptionDef o : nullSafe(op.getOptions())) {
            OptionValue.Kind kind = OptionValue.Kind.valueOf(o.getKind().toUpperCase());
            OptionValue def = o.getDefaultValue() == null ? null : toOptionValue(kind, o.getDefaultValue());
            b.option(new OptionDefinition(o.getId(), kind, o.isRequired(), def, o.getSelectOptions(), o.getMin(),
                    o.getMax()));
        }
        for (String ds : nullSafe(op.getRequiredDataSources()))
            b.requiredDataSource(ds);
        return b.build();
    }

    /** Converts a JSON scalar to an option value of the declared kind. */
    public static OptionValue toOptionValue(OptionValue.Kind kind, Object raw) {
        return switch (kind) {
            case INTEGER -> OptionValue.integer(raw instanceof Number n ? n.longValue() : Long.parseLong(raw.toString()));
            case DECIMAL -> OptionValue.decimal(raw instanceof Number n ? n.doubleValue()
                    : Double.parseDouble(raw.toString()));
            case BOOLEAN -> OptionValue.bool(raw instanceof Boolean v ? v : Boolean.parseBoolean(raw.toString()));
            case STRING -> OptionValue.string(raw.toString());
            case SELECT -> OptionValue.select(raw.toString());
            case SCHEMA -> OptionValue.schema(raw instanceof String str ? str : writeJson(raw));
        };
    }

    private static String writeJson(Object raw) {
        try {
            return SCHEMA_MAPPER.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Schema value is not serializable: " + raw, e);
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
