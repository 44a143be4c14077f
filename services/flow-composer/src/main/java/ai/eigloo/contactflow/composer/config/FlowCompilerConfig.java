package ai.eigloo.contactflow.composer.config;

import ai.eigloo.contactflow.composer.validation.RequiredParametersBlockValidator;
import ai.eigloo.contactflow.graph.compiler.FlowCompiler;
import ai.eigloo.contactflow.graph.decompiler.FlowDecompiler;
import ai.eigloo.contactflow.graph.layout.LayoutEngine;
import ai.eigloo.contactflow.graph.render.BuilderSourceRenderer;
import ai.eigloo.contactflow.graph.validation.BlockValidator;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the core compiler pipeline from {@link FlowComposerProperties}.
 */
@Configuration
public class FlowCompilerConfig {

    private static final Logger logger = LoggerFactory.getLogger(FlowCompilerConfig.class);

    /**
     * Request bodies are read as trees before decompiling; keep decimals
     * exactly as the document wrote them.
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer exactDecimalTrees() {
        return builder -> builder.postConfigurer(mapper -> {
            mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
            mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
        });
    }

    @Bean
    public LayoutEngine layoutEngine(FlowComposerProperties properties) {
        return new LayoutEngine(properties.getLayout().toSettings());
    }

    @Bean
    public BlockValidator blockValidator(FlowComposerProperties properties) {
        if (properties.getValidation().getRequiredParameters().isEmpty()) {
            logger.info("No required block parameters configured; block validation disabled");
            return BlockValidator.NONE;
        }
        logger.info("Block validation enabled for types {}",
                properties.getValidation().getRequiredParameters().keySet());
        return new RequiredParametersBlockValidator(properties.getValidation().getRequiredParameters());
    }

    @Bean
    public FlowCompiler flowCompiler(LayoutEngine layoutEngine, BlockValidator blockValidator) {
        return new FlowCompiler(layoutEngine, blockValidator);
    }

    @Bean
    public FlowDecompiler flowDecompiler() {
        return new FlowDecompiler();
    }

    @Bean
    public BuilderSourceRenderer builderSourceRenderer() {
        return new BuilderSourceRenderer();
    }
}
