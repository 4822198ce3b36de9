package io.marcfilter.marc.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.marcfilter.config.PipelineConfig;
import io.marcfilter.error.ErrorSink;
import io.marcfilter.error.JsonLinesErrorSink;
import io.marcfilter.error.LoggingErrorSink;
import io.marcfilter.marc.job.JobSpec;
import io.marcfilter.marc.job.MarcFilterJob;

import java.io.IOException;
import java.nio.file.Path;

public class MarcFilterModule extends AbstractModule {
    private final PipelineConfig config;
    private final JobSpec job;
    private final Path errorsFile;

    /**
     * @param errorsFile where to write record failures as JSON lines; null logs them instead
     */
    public MarcFilterModule(PipelineConfig config, JobSpec job, Path errorsFile) {
        this.config = config;
        this.job = job;
        this.errorsFile = errorsFile;
    }

    @Override
    protected void configure() {
        bind(PipelineConfig.class).toInstance(config);
        bind(JobSpec.class).toInstance(job);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton ErrorSink errorSink() throws IOException {
        return errorsFile == null ? new LoggingErrorSink() : new JsonLinesErrorSink(errorsFile);
    }

    @Provides @Singleton MarcFilterJob job(JobSpec spec, MetricRegistry registry, ErrorSink errorSink) {
        return new MarcFilterJob(spec, registry, errorSink, config);
    }
}
