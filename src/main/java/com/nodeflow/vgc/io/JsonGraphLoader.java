package com.nodeflow.vgc.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodeflow.vgc.api.Connection;
import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.Port;
import com.nodeflow.vgc.api.Types;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.engine.VisualGraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds a {@link VisualGraph} from a JSON {@link GraphDefinition}.
 *
 * <p>
 * Nodes are added in file order. Connections go through
 * {@link VisualGraph#connect}, so the same compatibility, single-binding and
 * acyclicity rules apply as in the editor; a connection that is refused is
 * logged and reported rather than failing the load.
 */
public final class JsonGraphLoader {
    private static final Logger log = LogManager.getLogger(JsonGraphLoader.class);

    private final ObjectMapper mapper = new ObjectMapper();

    /** Result of a load. {@code nodeIds} maps definition names to node ids. */
    public record LoadedGraph(String name, VisualGraph graph, Map<String, UUID> nodeIds,
            List<GraphDefinition.ConnectionDef> rejectedConnections) {

        public UUID idOf(String nodeName) {
            UUID id = nodeIds.get(nodeName);
            if (id == null)
                throw new IllegalArgumentException("No node named " + nodeName);
            return id;
        }
    }

    public LoadedGraph load(Path path) {
        try {
            return load(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read graph definition " + path, e);
        }
    }

    /** Loads a definition bundled on the classpath. */
    public LoadedGraph loadResource(String resource) {
        try (InputStream in = JsonGraphLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("No such resource: " + resource);
            return load(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read graph definition " + resource, e);
        }
    }

    /**
     * @throws IllegalArgumentException on malformed JSON, a missing
     *                                  {@code graph} section, duplicate node
     *                                  names or an unknown node kind
     */
    public LoadedGraph load(String json) {
        GraphDefinition def;
        try {
            def = mapper.readValue(json, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed graph definition: " + e.getOriginalMessage(), e);
        }
        return build(def);
    }

    public LoadedGraph build(GraphDefinition def) {
        GraphDefinition.GraphInfo info = def.getGraph();
        if (info == null)
            throw new IllegalArgumentException("Missing 'graph' key");

        VisualGraph graph = new VisualGraph(metadata(info));
        Map<String, UUID> ids = new LinkedHashMap<>();
        for (GraphDefinition.NodeDef nd : orEmpty(info.getNodes())) {
            if (nd.getName() == null)
                throw new IllegalArgumentException("Node without a name");
            if (ids.containsKey(nd.getName()))
                throw new IllegalArgumentException("Duplicate node name " + nd.getName());
            ids.put(nd.getName(), graph.addNode(toNode(nd)));
        }

        List<GraphDefinition.ConnectionDef> rejected = new ArrayList<>();
        for (GraphDefinition.ConnectionDef cd : orEmpty(info.getConnections())) {
            UUID source = ids.get(cd.getSource());
            UUID target = ids.get(cd.getTarget());
            Optional<Connection> c = source == null || target == null
                    ? Optional.empty()
                    : graph.connect(source, cd.getSourcePort(), target, cd.getTargetPort());
            if (c.isEmpty()) {
                log.warn("Rejected connection {} in graph {}", cd, info.getName());
                rejected.add(cd);
            }
        }
        log.info("Loaded graph {} with {} nodes and {} connections ({} rejected)", info.getName(),
                graph.nodeCount(), graph.connections().size(), rejected.size());
        return new LoadedGraph(info.getName(), graph, Collections.unmodifiableMap(ids),
                Collections.unmodifiableList(rejected));
    }

    private static Map<String, Object> metadata(GraphDefinition.GraphInfo info) {
        Map<String, Object> m = new LinkedHashMap<>();
        if (info.getMetadata() != null)
            m.putAll(info.getMetadata());
        putIfPresent(m, "name", info.getName());
        putIfPresent(m, "version", info.getVersion());
        putIfPresent(m, "description", info.getDescription());
        putIfPresent(m, "author", info.getAuthor());
        return m;
    }

    private static void putIfPresent(Map<String, Object> m, String key, Object value) {
        if (value != null)
            m.put(key, value);
    }

    static VisualNode toNode(GraphDefinition.NodeDef nd) {
        if (nd.getKind() == null)
            throw new IllegalArgumentException("Node " + nd.getName() + " has no kind");
        VisualNode.VisualNodeBuilder b = VisualNode.builder()
                .kind(NodeKind.fromString(nd.getKind()))
                .name(nd.getName())
                .docstring(nd.getDocstring());
        List<Double> pos = nd.getPosition();
        if (pos != null && pos.size() >= 2)
            b.position(new VisualNode.Position(pos.get(0), pos.get(1)));
        if (nd.getParameters() != null)
            b.parameters(nd.getParameters());
        for (GraphDefinition.PortDef p : orEmpty(nd.getInputs()))
            b.input(new Port(p.getName(), Types.byName(p.getType()), p.getRequired() == null || p.getRequired(),
                    p.getDefaultValue(), p.getDescription()));
        for (GraphDefinition.PortDef p : orEmpty(nd.getOutputs()))
            b.output(new Port(p.getName(), Types.byName(p.getType()), false, null, p.getDescription()));
        if (nd.getComments() != null)
            b.comments(nd.getComments());
        return b.build();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
