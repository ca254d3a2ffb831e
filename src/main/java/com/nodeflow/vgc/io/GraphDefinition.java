package com.nodeflow.vgc.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a visual program as stored on disk.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** Graph-level information; everything except the node list is optional. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name, version, description, author;
        private Map<String, Object> metadata;
        private List<NodeDef> nodes;
        private List<ConnectionDef> connections;
    }

    /** One node; {@code name} is the key connections refer to. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, kind, docstring;
        private List<Double> position;
        private Map<String, Object> parameters;
        private List<PortDef> inputs;
        private List<PortDef> outputs;
        private List<String> comments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class PortDef {
        private String name, type, description;
        private Boolean required;
        @JsonProperty("default")
        private Object defaultValue;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConnectionDef {
        private String source, sourcePort, target, targetPort;

        @Override
        public String toString() {
            return source + "." + sourcePort + " -> " + target + "." + targetPort;
        }
    }
}
