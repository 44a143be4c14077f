package ai.eigloo.contactflow.graph.render;

import ai.eigloo.contactflow.graph.model.FlowGraph;
import ai.eigloo.contactflow.graph.model.GraphEdge;
import ai.eigloo.contactflow.graph.model.GraphNode;
import ai.eigloo.contactflow.graph.wire.FlowJson;
import ai.eigloo.contactflow.graph.wire.WireFields;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders a flow graph as the {@code FlowBuilder} calls that rebuild it.
 *
 * <p>Used on the reverse path: a decompiled third-party document becomes
 * Java source an author can keep editing. Output is deterministic.</p>
 */
public class BuilderSourceRenderer {

    private static final String INDENT = "        ";
    private static final Pattern READABLE_ID = Pattern.compile("[A-Za-z][A-Za-z0-9_-]{0,31}");
    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "record", "yield", "flow");

    /**
     * Renders the statements that define the flow into a local named {@code flow}.
     */
    public String render(FlowGraph graph) {
        StringBuilder out = new StringBuilder();
        Map<String, String> variables = assignVariables(graph);

        out.append("FlowBuilder flow = new FlowBuilder(").append(literal(graph.name())).append(")");
        if (graph.description() != null) {
            out.append('\n').append(INDENT).append(".description(").append(literal(graph.description())).append(")");
        }
        if (!WireFields.DEFAULT_VERSION.equals(graph.version())) {
            out.append('\n').append(INDENT).append(".version(").append(literal(graph.version())).append(")");
        }
        graph.extensions().forEach((field, value) -> out.append('\n').append(INDENT)
                .append(".extension(").append(literal(field)).append(", ").append(value(value)).append(")"));
        out.append(";\n\n");

        for (GraphNode node : graph.nodes()) {
            out.append("NodeHandle ").append(variables.get(node.id())).append(" = flow.add(Block.of(")
                    .append(literal(node.id())).append(", ").append(literal(node.type())).append(")");
            node.parameters().forEach((key, value) -> out.append('\n').append(INDENT)
                    .append(".parameter(").append(literal(key)).append(", ").append(value(value)).append(")"));
            node.extraFields().forEach((key, value) -> out.append('\n').append(INDENT)
                    .append(".extraField(").append(literal(key)).append(", ").append(value(value)).append(")"));
            out.append(");\n");
        }

        Map<String, List<GraphEdge>> outgoing = graph.outgoingBySource();
        if (!outgoing.isEmpty()) {
            out.append('\n');
        }
        for (GraphNode node : graph.nodes()) {
            List<GraphEdge> edges = outgoing.get(node.id());
            if (edges == null || edges.isEmpty()) {
                continue;
            }
            out.append(variables.get(node.id()));
            for (int i = 0; i < edges.size(); i++) {
                if (i > 0) {
                    out.append('\n').append(INDENT);
                }
                out.append(verb(edges.get(i), variables));
            }
            out.append(";\n");
        }

        if (graph.entryNodeId() != null) {
            String entry = variables.get(graph.entryNodeId());
            out.append("\nflow.entry(").append(entry != null ? entry : literal(graph.entryNodeId())).append(");\n");
        }
        return out.toString();
    }

    /**
     * Renders a complete class whose {@code define()} method returns the builder.
     */
    public String renderClass(String packageName, String className, FlowGraph graph) {
        StringBuilder out = new StringBuilder();
        if (packageName != null && !packageName.isEmpty()) {
            out.append("package ").append(packageName).append(";\n\n");
        }
        out.append("import ai.eigloo.contactflow.graph.builder.FlowBuilder;\n");
        out.append("import ai.eigloo.contactflow.graph.builder.NodeHandle;\n");
        out.append("import ai.eigloo.contactflow.graph.model.Block;\n");
        out.append("import ai.eigloo.contactflow.graph.wire.FlowJson;\n\n");
        out.append("public final class ").append(className).append(" {\n\n");
        out.append("    private ").append(className).append("() {\n    }\n\n");
        out.append("    public static FlowBuilder define() {\n");
        for (String line : render(graph).split("\n", -1)) {
            out.append(line.isEmpty() ? "" : "        " + line).append('\n');
        }
        out.append("        return flow;\n    }\n}\n");
        return out.toString();
    }

    private static String verb(GraphEdge edge, Map<String, String> variables) {
        String target = variables.containsKey(edge.to()) ? variables.get(edge.to()) : literal(edge.to());
        return switch (edge.kind()) {
            case SEQUENTIAL -> ".then(" + target + ")";
            case CONDITION -> ".when(" + literal(edge.label()) + ", " + target + ")";
            case DEFAULT -> ".otherwise(" + target + ")";
            case ERROR -> ".onError(" + literal(edge.label()) + ", " + target + ")";
        };
    }

    private static Map<String, String> assignVariables(FlowGraph graph) {
        Map<String, String> variables = new HashMap<>();
        Set<String> taken = new HashSet<>();
        int counter = 0;
        for (GraphNode node : graph.nodes()) {
            counter++;
            String candidate = READABLE_ID.matcher(node.id()).matches()
                    ? camelCase(node.id())
                    : "node" + counter;
            if (JAVA_KEYWORDS.contains(candidate)) {
                candidate = candidate + "Node";
            }
            String unique = candidate;
            int suffix = 2;
            while (!taken.add(unique)) {
                unique = candidate + suffix++;
            }
            variables.put(node.id(), unique);
        }
        return variables;
    }

    private static String camelCase(String id) {
        StringBuilder name = new StringBuilder();
        boolean upperNext = false;
        for (char c : id.toCharArray()) {
            if (c == '_' || c == '-') {
                upperNext = name.length() > 0;
                continue;
            }
            name.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        name.setCharAt(0, Character.toLowerCase(name.charAt(0)));
        return name.toString();
    }

    private static String value(JsonNode value) {
        if (value == null || value.isNull()) {
            return "null";
        }
        if (value.isTextual()) {
            return literal(value.asText());
        }
        if (value.isBoolean()) {
            return String.valueOf(value.booleanValue());
        }
        if (value.isInt()) {
            return String.valueOf(value.intValue());
        }
        if (value.isLong()) {
            return value.longValue() + "L";
        }
        if (value.isDouble() && Double.isFinite(value.doubleValue())) {
            return String.valueOf(value.doubleValue());
        }
        return "FlowJson.parse(" + literal(FlowJson.write(value, false)) + ")";
    }

    static String literal(String text) {
        if (text == null) {
            return "null";
        }
        StringBuilder out = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }
}
