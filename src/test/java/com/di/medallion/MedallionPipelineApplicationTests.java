package com.di.medallion;

import com.di.medallion.aggregate.AnalyticsAggregator;
import com.di.medallion.config.PipelineProperties;
import com.di.medallion.config.SourceSettings;
import com.di.medallion.pipeline.PipelineOrchestrator;
import com.di.medallion.storage.LayerStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Context wiring smoke test. The source pool is lazy, so no SQL Server is needed
 * for the context to start; the pipeline itself is not run.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("MedallionPipelineApplication Tests")
class MedallionPipelineApplicationTests {

	@Autowired
	private PipelineOrchestrator orchestrator;

	@Autowired
	private AnalyticsAggregator aggregator;

	@Autowired
	private SourceSettings sourceSettings;

	@Autowired
	private PipelineProperties pipelineProperties;

	@Autowired
	@Qualifier("silverStore")
	private LayerStore silverStore;

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = MedallionPipelineApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}

	@Test
	@DisplayName("Should wire the orchestrator and its collaborators")
	void testContextLoads() {
		assertNotNull(orchestrator);
		assertEquals(4, aggregator.getTables().size());
	}

	@Test
	@DisplayName("Should bind source and pipeline settings from the test profile")
	void testPropertiesBound() {
		assertEquals("localhost", sourceSettings.server());
		assertEquals("TestDW", sourceSettings.database());
		assertEquals("dbo", sourceSettings.schema());
		assertEquals("target/test-data", pipelineProperties.getDataDir());
		assertEquals(Paths.get("target/test-data", "silver"), silverStore.getDirectory());
	}
}
