package com.trading.sdg.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

/**
 * Read-only description of an operation type: its input and output slots,
 * its options and the flags that steer compilation and scheduling.
 */
@Getter
public final class OperationMetadata {

    /** Broad family of an operation. Drives sink detection and runtime capture. */
    public enum Category {
        DATA_SOURCE, SCALAR, MATH, COMPARATIVE, LOGICAL, UTILITY, INDICATOR, EXECUTOR, REPORTER, EVENT_MARKER
    }

    private final String type;
    private final String name;
    private final Category category;
    private final List<IOSlot> inputs;
    private final List<IOSlot> outputs;
    private final List<OptionDefinition> options;
    private final boolean crossSectional;
    private final boolean atLeastOneInputRequired;
    private final boolean requiresTimeFrame;
    private final boolean intradayOnly;
    private final boolean allowNullInputs;
    private final List<String> requiredDataSources;

    private OperationMetadata(Builder b) {
        this.type = b.type;
        this.name = b.name != null ? b.name : b.type;
        this.category = b.category;
        this.inputs = List.copyOf(b.inputs);
        this.outputs = List.copyOf(b.outputs);
        this.options = List.copyOf(b.options);
        this.crossSectional = b.crossSectional;
        this.atLeastOneInputRequired = b.atLeastOneInputRequired;
        this.requiresTimeFrame = b.requiresTimeFrame;
        this.intradayOnly = b.intradayOnly;
        this.allowNullInputs = b.allowNullInputs;
        this.requiredDataSources = List.copyOf(b.requiredDataSources);
    }

    public boolean isScalarCategory() {
        return category == Category.SCALAR;
    }

    /** Operations without outputs (executors, reports, markers) terminate the graph. */
    public boolean isSink() {
        return outputs.isEmpty();
    }

    public Optional<IOSlot> input(String id) {
        return inputs.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    public Optional<IOSlot> output(String id) {
        return outputs.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    public Optional<OptionDefinition> option(String id) {
        return options.stream().filter(o -> o.id().equals(id)).findFirst();
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public static final class Builder {
        private final String type;
        private String name;
        private Category category = Category.UTILITY;
        private final List<IOSlot> inputs = new ArrayList<>();
        private final List<IOSlot> outputs = new ArrayList<>();
        private final List<OptionDefinition> options = new ArrayList<>();
        private final List<String> requiredDataSources = new ArrayList<>();
        private boolean crossSectional;
        private boolean atLeastOneInputRequired;
        private boolean requiresTimeFrame;
        private boolean intradayOnly;
        private boolean allowNullInputs;

        private Builder(String type) {
            if (type == null || type.isEmpty())
                throw new IllegalArgumentException("Operation type is required");
            this.type = type;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder category(Category category) {
            this.category = category;
            return this;
        }

        public Builder input(IOSlot slot) {
            inputs.add(slot);
            return this;
        }

        public Builder output(IOSlot slot) {
            outputs.add(slot);
            return this;
        }

        public Builder option(OptionDefinition option) {
            options.add(option);
            return this;
        }

        public Builder requiredDataSource(String column) {
            requiredDataSources.add(column);
            return this;
        }

        public Builder crossSectional(boolean v) {
            this.crossSectional = v;
            return this;
        }

        public Builder atLeastOneInputRequired(boolean v) {
            this.atLeastOneInputRequired = v;
            return this;
        }

        public Builder requiresTimeFrame(boolean v) {
            this.requiresTimeFrame = v;
            return this;
        }

        public Builder intradayOnly(boolean v) {
            this.intradayOnly = v;
            return this;
        }

        public Builder allowNullInputs(boolean v) {
            this.allowNullInputs = v;
            return this;
        }

        public OperationMetadata build() {
            return new OperationMetadata(this);
        }
    }
}
