package com.gentoro.maki;

import com.gentoro.maki.aggregate.OutputAggregator;
import com.gentoro.maki.batch.BatchJobManager;
import com.gentoro.maki.batch.BatchJobStore;
import com.gentoro.maki.batch.FileBatchJobStore;
import com.gentoro.maki.batch.LocalBatchJobRunner;
import com.gentoro.maki.classify.ClassificationParser;
import com.gentoro.maki.classify.ClassificationPrompt;
import com.gentoro.maki.classify.EventClassifier;
import com.gentoro.maki.event.EventSourceRegistry;
import com.gentoro.maki.gate.PreconditionGate;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.mode.FileModeStore;
import com.gentoro.maki.mode.ModeSelector;
import com.gentoro.maki.mode.ModeStore;
import com.gentoro.maki.model.LlmClient;
import com.gentoro.maki.model.LlmClientFactory;
import com.gentoro.maki.ondemand.OnDemandExecutor;
import com.gentoro.maki.orchestrator.EngineSettings;
import com.gentoro.maki.orchestrator.OrchestrationEngine;
import com.gentoro.maki.orchestrator.RetryPolicy;
import com.gentoro.maki.orchestrator.RunOutcome;
import com.gentoro.maki.orchestrator.progress.LoggingProgressSink;
import com.gentoro.maki.prompt.PromptRepository;
import com.gentoro.maki.prompt.PromptRepositoryFactory;
import com.gentoro.maki.result.ResultWriter;
import com.gentoro.maki.routing.VolumeRouter;
import com.gentoro.maki.storage.FileSystemObjectStore;
import com.gentoro.maki.storage.ObjectStore;
import com.gentoro.maki.taxonomy.Taxonomy;
import com.gentoro.maki.taxonomy.TaxonomyLoader;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Application context: loads configuration and wires every engine component with the local,
 * file-system backed collaborators.
 */
public class Maki implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(Maki.class);

  private final Configuration configuration;
  private final EngineSettings settings;
  private final PromptRepository promptRepository;
  private final LlmClient lightModel;
  private final LlmClient heavyModel;
  private final ObjectStore objectStore;
  private final ModeStore modeStore;
  private final BatchJobStore batchJobStore;
  private final Taxonomy taxonomy;
  private final LocalBatchJobRunner batchRunner;
  private final BatchJobManager batchJobManager;
  private final OrchestrationEngine engine;

  /** Load configuration from {@code location} and create the models from the llm profiles. */
  public Maki(String configLocation) {
    this(new ConfigurationProvider(configLocation).config());
  }

  public Maki(Configuration configuration) {
    this(
        configuration,
        LlmClientFactory.createProvider(configuration, LlmClientFactory.LIGHT),
        LlmClientFactory.createProvider(configuration, LlmClientFactory.HEAVY),
        Clock.systemUTC());
  }

  public Maki(Configuration configuration, LlmClient lightModel, LlmClient heavyModel, Clock clock) {
    this.configuration = configuration;
    LoggingService.applyConfiguration(configuration);
    this.settings = EngineSettings.from(configuration);
    this.promptRepository = PromptRepositoryFactory.create(configuration.subset("prompt"));
    this.lightModel = lightModel;
    this.heavyModel = heavyModel;

    Path storageDir = Path.of(configuration.getString("storage.dir", "maki-data"));
    this.objectStore = new FileSystemObjectStore(storageDir.resolve("objects"));
    this.modeStore =
        new FileModeStore(
            Path.of(configuration.getString("mode.store-dir", storageDir.resolve("params").toString())),
            configuration.getString("mode.parameter-name", "maki-mode"));
    this.batchJobStore = new FileBatchJobStore(storageDir.resolve("jobs"));
    this.taxonomy = new TaxonomyLoader(configuration).load();

    RetryPolicy retryPolicy = settings.retryPolicy();
    ResultWriter writer = new ResultWriter(objectStore);
    ClassificationPrompt prompt = new ClassificationPrompt(promptRepository, taxonomy);
    ClassificationParser parser = new ClassificationParser(taxonomy);

    this.batchRunner =
        new LocalBatchJobRunner(objectStore, lightModel, (int) settings.batchMinRecords());
    this.batchJobManager =
        new BatchJobManager(
            batchJobStore,
            batchRunner,
            objectStore,
            prompt,
            parser,
            writer,
            settings.batchPollIntervalMs(),
            settings.batchMaxWaitMs(),
            settings.batchCleanupIntermediate(),
            clock);

    this.engine =
        new OrchestrationEngine(
            new ModeSelector(modeStore, settings.modeFallback()),
            new PreconditionGate(List.of(lightModel, heavyModel), batchJobManager),
            EventSourceRegistry.fromConfiguration(configuration),
            new VolumeRouter(settings.routingThreshold()),
            new OnDemandExecutor(
                new EventClassifier(lightModel, prompt, parser, retryPolicy),
                writer,
                settings.onDemandWorkers()),
            batchJobManager,
            new OutputAggregator(
                heavyModel, promptRepository, retryPolicy, writer, settings.aggregateMaxInputChars()),
            writer,
            settings.runTimeoutMs(),
            new LoggingProgressSink(
                LoggingService.getLogger(OrchestrationEngine.class),
                configuration.getLong("progress.min-interval-ms", 1_000L),
                configuration.getLong("progress.min-delta", 10L)),
            clock);
    log.info(
        "MAKI engine ready (light model {}, heavy model {}, storage {})",
        lightModel.modelId(),
        heavyModel.modelId(),
        storageDir.toAbsolutePath());
  }

  /** Run the pipeline once with the configured deadline. */
  public RunOutcome run() {
    return engine.run();
  }

  public Configuration configuration() {
    return configuration;
  }

  public EngineSettings settings() {
    return settings;
  }

  public OrchestrationEngine engine() {
    return engine;
  }

  public ModeStore modeStore() {
    return modeStore;
  }

  public ObjectStore objectStore() {
    return objectStore;
  }

  public BatchJobStore batchJobStore() {
    return batchJobStore;
  }

  public BatchJobManager batchJobManager() {
    return batchJobManager;
  }

  public Taxonomy taxonomy() {
    return taxonomy;
  }

  @Override
  public void close() {
    batchRunner.close();
  }
}
