package com.example.crosswalk.runner;

import com.example.crosswalk.config.CrosswalkProperties;
import com.example.crosswalk.orchestrator.CatalogPipeline;
import com.example.crosswalk.orchestrator.FrameworkMappingPipeline;
import com.example.crosswalk.orchestrator.RevisionComparisonPipeline;
import com.example.crosswalk.service.MissingInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchTaskRunnerTest {

    @Mock
    private CatalogPipeline catalogPipeline;

    @Mock
    private FrameworkMappingPipeline frameworkMappingPipeline;

    @Mock
    private RevisionComparisonPipeline revisionComparisonPipeline;

    private BatchTaskRunner runner(List<String> tasks) {
        CrosswalkProperties properties = new CrosswalkProperties(null, null, null, null,
                new CrosswalkProperties.Batch(tasks), null);
        return new BatchTaskRunner(properties, catalogPipeline, frameworkMappingPipeline, revisionComparisonPipeline);
    }

    @Test
    void run_shouldExecuteTasksInConfiguredOrder() {
        // Act
        runner(List.of("revision-comparison", "catalog", " Framework-Mapping "))
                .run(new DefaultApplicationArguments());

        // Assert
        InOrder inOrder = inOrder(revisionComparisonPipeline, catalogPipeline, frameworkMappingPipeline);
        inOrder.verify(revisionComparisonPipeline).run();
        inOrder.verify(catalogPipeline).run();
        inOrder.verify(frameworkMappingPipeline).run();
    }

    @Test
    void run_shouldDoNothing_whenNoTasksConfigured() {
        runner(List.of()).run(new DefaultApplicationArguments());

        verifyNoInteractions(catalogPipeline, frameworkMappingPipeline, revisionComparisonPipeline);
    }

    @Test
    void run_shouldStopAtFirstFailure() {
        // Arrange
        when(catalogPipeline.run()).thenThrow(new MissingInputException("The CSF workbook was not found: data/csf2.xlsx"));

        // Act / Assert
        assertThatThrownBy(() -> runner(List.of("catalog", "framework-mapping")).run(new DefaultApplicationArguments()))
                .isInstanceOf(MissingInputException.class);
        verifyNoInteractions(frameworkMappingPipeline);
    }

    @Test
    void run_shouldRejectUnknownTask() {
        assertThatThrownBy(() -> runner(List.of("publish")).run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("publish");
    }
}
