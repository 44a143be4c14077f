package ai.eigloo.contactflow.composer;

import ai.eigloo.contactflow.composer.config.FlowComposerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot application class for the Flow Composer service.
 * Exposes compile, decompile and validate operations for contact flows
 * over HTTP.
 */
@SpringBootApplication
@EnableConfigurationProperties(FlowComposerProperties.class)
public class FlowComposerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowComposerApplication.class, args);
    }
}
