package com.di.medallion;

import com.di.medallion.pipeline.PipelineOrchestrator;
import com.di.medallion.pipeline.RunSummary;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Runs one full batch (Extract → Transform → Load) and exits with 0 when the run
 * completed successfully, 1 otherwise.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class MedallionPipelineApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(MedallionPipelineApplication.class, args);
		RunSummary summary = ctx.getBean(PipelineOrchestrator.class).run();
		int exitCode = summary.exitCode();
		System.exit(SpringApplication.exit(ctx, () -> exitCode));
	}
}
