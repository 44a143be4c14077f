package ai.eigloo.contactflow.composer.service;

import ai.eigloo.contactflow.composer.config.FlowComposerProperties;
import ai.eigloo.contactflow.composer.dto.CompileResponse;
import ai.eigloo.contactflow.composer.dto.DecompileResponse;
import ai.eigloo.contactflow.composer.dto.DiagnosticDto;
import ai.eigloo.contactflow.composer.dto.FlowDefinitionDto;
import ai.eigloo.contactflow.composer.dto.FlowEdgeDto;
import ai.eigloo.contactflow.composer.dto.FlowNodeDto;
import ai.eigloo.contactflow.composer.dto.ValidationResult;
import ai.eigloo.contactflow.graph.builder.FlowBuilder;
import ai.eigloo.contactflow.graph.compiler.CompilationResult;
import ai.eigloo.contactflow.graph.compiler.FlowCompiler;
import ai.eigloo.contactflow.graph.decompiler.FlowDecompiler;
import ai.eigloo.contactflow.graph.diagnostic.Diagnostic;
import ai.eigloo.contactflow.graph.exception.FlowGraphException;
import ai.eigloo.contactflow.graph.model.Block;
import ai.eigloo.contactflow.graph.model.FlowGraph;
import ai.eigloo.contactflow.graph.model.GraphEdge;
import ai.eigloo.contactflow.graph.model.GraphNode;
import ai.eigloo.contactflow.graph.render.BuilderSourceRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Implementation of FlowCompilationService backed by the core compiler,
 * decompiler and builder-source renderer.
 */
@Service
public class FlowCompilationServiceImpl implements FlowCompilationService {

    private static final Logger logger = LoggerFactory.getLogger(FlowCompilationServiceImpl.class);

    private final FlowCompiler flowCompiler;
    private final FlowDecompiler flowDecompiler;
    private final BuilderSourceRenderer builderSourceRenderer;
    private final FlowComposerProperties properties;

    public FlowCompilationServiceImpl(FlowCompiler flowCompiler,
                                      FlowDecompiler flowDecompiler,
                                      BuilderSourceRenderer builderSourceRenderer,
                                      FlowComposerProperties properties) {
        this.flowCompiler = flowCompiler;
        this.flowDecompiler = flowDecompiler;
        this.builderSourceRenderer = builderSourceRenderer;
        this.properties = properties;
    }

    @Override
    public CompileResponse compile(FlowDefinitionDto definition) {
        logger.info("Compiling flow '{}'", definition.getName());
        CompilationResult result = flowCompiler.compile(toGraph(definition));
        List<DiagnosticDto> diagnostics = result.diagnostics().stream()
                .map(DiagnosticDto::from)
                .toList();
        logger.info("Compiled flow '{}' with {} warnings", definition.getName(), diagnostics.size());
        return new CompileResponse(result.document(), diagnostics);
    }

    @Override
    public String compileDocument(FlowDefinitionDto definition) {
        logger.info("Rendering wire document for flow '{}'", definition.getName());
        return flowCompiler.compile(toGraph(definition)).toJson(properties.getCompiler().isPrettyPrint());
    }

    @Override
    public DecompileResponse decompile(JsonNode document) {
        FlowGraph graph = flowDecompiler.decompile(document);
        logger.info("Decompiled flow '{}' with {} nodes", graph.name(), graph.nodeCount());
        return new DecompileResponse(toDefinition(graph), builderSourceRenderer.render(graph));
    }

    @Override
    public ValidationResult validate(FlowDefinitionDto definition) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (definition == null) {
            errors.add("Flow definition cannot be null");
            return new ValidationResult(false, errors, warnings);
        }
        logger.info("Validating flow '{}'", definition.getName());

        if (definition.getName() == null || definition.getName().isBlank()) {
            warnings.add("Flow name is empty");
        }
        try {
            CompilationResult result = flowCompiler.compile(toGraph(definition));
            for (Diagnostic diagnostic : result.diagnostics()) {
                warnings.add(diagnostic.code() + ": " + diagnostic.message());
            }
        } catch (FlowGraphException e) {
            errors.add(e.getCode() + ": " + e.getMessage());
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        boolean valid = errors.isEmpty();
        logger.debug("Flow validation completed. Valid: {}, Errors: {}, Warnings: {}",
                valid, errors.size(), warnings.size());
        return new ValidationResult(valid, errors, warnings);
    }

    /**
     * Replays a definition through the builder so every construction rule
     * applies to API input exactly as it does to code-built flows.
     */
    FlowGraph toGraph(FlowDefinitionDto definition) {
        FlowBuilder builder = new FlowBuilder(definition.getName())
                .description(definition.getDescription())
                .version(definition.getVersion());
        if (definition.getExtensions() != null) {
            definition.getExtensions().forEach(builder::extension);
        }

        for (FlowNodeDto node : nullSafe(definition.getNodes())) {
            Block block = Block.of(node.getId(), node.getType());
            if (node.getParameters() != null) {
                node.getParameters().forEach(block::parameter);
            }
            if (node.getExtraFields() != null) {
                node.getExtraFields().forEach(block::extraField);
            }
            builder.add(block);
        }
        for (FlowEdgeDto edge : nullSafe(definition.getEdges())) {
            builder.addEdge(edge.getFrom(), edge.getKind(), edge.getLabel(), edge.getTo());
        }
        if (definition.getStartNodeId() != null) {
            builder.entry(definition.getStartNodeId());
        }
        return builder.build();
    }

    FlowDefinitionDto toDefinition(FlowGraph graph) {
        List<FlowNodeDto> nodes = new ArrayList<>();
        for (GraphNode node : graph.nodes()) {
            FlowNodeDto dto = new FlowNodeDto(node.id(), node.type(), new LinkedHashMap<>(node.parameters()));
            dto.setExtraFields(new LinkedHashMap<>(node.extraFields()));
            nodes.add(dto);
        }
        List<FlowEdgeDto> edges = new ArrayList<>();
        for (GraphEdge edge : graph.edges()) {
            edges.add(new FlowEdgeDto(edge.from(), edge.kind(), edge.label(), edge.to()));
        }

        FlowDefinitionDto definition = new FlowDefinitionDto(graph.name(), graph.entryNodeId(), nodes, edges);
        definition.setDescription(graph.description());
        definition.setVersion(graph.version());
        definition.setExtensions(new LinkedHashMap<>(graph.extensions()));
        return definition;
    }

    private static <T> List<T> nullSafe(List<T> values) {
        return values != null ? values : List.of();
    }
}
