package com.example.transformationhub.config;

import com.example.transformationhub.error.CoreException;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.service.TransformationRevisionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Imports example transformation revisions from classpath resources at startup.
 * <p>
 * Files are imported in list order, so components come before the workflows using them. Each
 * import goes through {@link TransformationRevisionService#validateAndStore} with overwrite of
 * released revisions allowed, so restarts keep the examples in sync.
 * </p>
 */
@Component
@ConditionalOnProperty(name = "transformations.examples.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ExampleTransformationsLoader implements ApplicationRunner {

    private static final String EXAMPLES_DIR = "examples/";
    static final List<String> EXAMPLE_FILES = List.of(
            "add-component.json",
            "pass-through-component.json",
            "add-twice-workflow.json"
    );

    private final TransformationRevisionService service;
    private final JsonMapper jsonMapper;

    @Override
    public void run(ApplicationArguments args) {
        for (String filename : EXAMPLE_FILES) {
            loadExample(EXAMPLES_DIR + filename);
        }
    }

    private void loadExample(String path) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Example transformation resource not found: {}", path);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            TransformationRevision revision = jsonMapper.readValue(in, TransformationRevision.class);
            service.validateAndStore(revision, true);
            log.info("Loaded example transformation: {} ({})", revision.name(), revision.versionTag());
        } catch (CoreException e) {
            log.error("Rejected example transformation {}: {}", path, e.getMessage());
        } catch (JacksonException e) {
            log.error("Failed to parse example transformation {}: {}", path, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read example transformation {}: {}", path, e.getMessage());
        }
    }
}
