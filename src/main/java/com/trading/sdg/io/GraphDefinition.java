package com.trading.sdg.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO form of a compiled graph, read and written by {@link GraphSerializer}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private List<NodeDef> nodes = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeDef {
        private String id;
        private String type;
        private Map<String, OptionDef> options = new LinkedHashMap<>();
        private Map<String, List<InputDef>> inputs = new LinkedHashMap<>();
        private String timeframe;
        private String session;
    }

    /** Option value with its declared kind, so numbers keep their type. */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class OptionDef {
        private String kind;
        private Object value;

        public OptionDef(String kind, Object value) {
            this.kind = kind;
            this.value = value;
        }
    }

    /**
     * One wired value. {@code kind} is {@code ref} ({@code value} is
     * {@code "<node_id>#<handle>"}) or {@code literal} ({@code dataType} gives
     * the literal's type).
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class InputDef {
        private String kind;
        private String dataType;
        private Object value;

        public InputDef(String kind, String dataType, Object value) {
            this.kind = kind;
            this.dataType = dataType;
            this.value = value;
        }
    }
}
