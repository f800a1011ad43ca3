package com.trading.sdg.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO form of the operation catalog read by {@link MetadataLoader}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class OperationDefinition {
    private List<OperationDef> operations;

    /** One operation type. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class OperationDef {
        private String type, name, category;
        private List<SlotDef> inputs;
        private List<SlotDef> outputs;
        private List<OptionDef> options;
        private List<String> requiredDataSources;
        private boolean crossSectional, atLeastOneInputRequired, requiresTimeFrame, intradayOnly, allowNullInputs;
    }

    /** Input or output slot. Inputs are required unless stated otherwise. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SlotDef {
        private String id, type;
        private Boolean required;
        private boolean allowMultiple;
    }

    /** Option declaration with its validation rules. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class OptionDef {
        private String id, kind;
        private boolean required;
        private Object defaultValue;
        private List<String> selectOptions;
        private Double min, max;
    }
}
