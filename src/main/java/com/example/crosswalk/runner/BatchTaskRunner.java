package com.example.crosswalk.runner;

import com.example.crosswalk.config.CrosswalkProperties;
import com.example.crosswalk.orchestrator.CatalogPipeline;
import com.example.crosswalk.orchestrator.FrameworkMappingPipeline;
import com.example.crosswalk.orchestrator.RevisionComparisonPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the tasks listed in {@code crosswalk.batch.tasks} at startup, in order.
 * A failing task aborts the remaining ones and the application start.
 */
@Component
public class BatchTaskRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchTaskRunner.class);

    public static final String CATALOG = "catalog";
    public static final String FRAMEWORK_MAPPING = "framework-mapping";
    public static final String REVISION_COMPARISON = "revision-comparison";

    private final CrosswalkProperties properties;
    private final CatalogPipeline catalogPipeline;
    private final FrameworkMappingPipeline frameworkMappingPipeline;
    private final RevisionComparisonPipeline revisionComparisonPipeline;

    public BatchTaskRunner(CrosswalkProperties properties,
                           CatalogPipeline catalogPipeline,
                           FrameworkMappingPipeline frameworkMappingPipeline,
                           RevisionComparisonPipeline revisionComparisonPipeline) {
        this.properties = properties;
        this.catalogPipeline = catalogPipeline;
        this.frameworkMappingPipeline = frameworkMappingPipeline;
        this.revisionComparisonPipeline = revisionComparisonPipeline;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> tasks = properties.batch() != null && properties.batch().tasks() != null
                ? properties.batch().tasks()
                : List.of();
        if (tasks.isEmpty()) {
            log.debug("No batch tasks configured");
            return;
        }

        log.info("Running {} batch task(s): {}", tasks.size(), tasks);
        for (String task : tasks) {
            runTask(task.trim().toLowerCase());
        }
    }

    void runTask(String task) {
        switch (task) {
            case CATALOG -> catalogPipeline.run();
            case FRAMEWORK_MAPPING -> frameworkMappingPipeline.run();
            case REVISION_COMPARISON -> revisionComparisonPipeline.run();
            default -> throw new IllegalArgumentException("Unknown batch task: '" + task
                    + "'. Expected one of: " + List.of(CATALOG, FRAMEWORK_MAPPING, REVISION_COMPARISON));
        }
    }
}
