package io.gigdraft.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.gigdraft.DraftStore;
import io.gigdraft.EmployerIdProvider;
import io.gigdraft.JobDraftWorkflow;
import io.gigdraft.JobStore;
import io.gigdraft.core.DraftLifecycleCoordinator;
import io.gigdraft.core.FormSessionFactory;
import io.gigdraft.cost.CostCalculator;
import io.gigdraft.internal.mongo.MongoDraftStore;
import io.gigdraft.internal.mongo.MongoJobPostingStore;
import io.gigdraft.validation.JobFieldValidators;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot auto-configuration entrypoint for the draft workflow.
 */
@AutoConfiguration
@ConditionalOnClass({JobDraftWorkflow.class, MongoTemplate.class})
@EnableConfigurationProperties(GigDraftProperties.class)
@ConditionalOnProperty(prefix = "gigdraft", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GigDraftConfig {

    public static final String STORE_EXECUTOR = "gigDraftStoreExecutor";

    @Bean(name = STORE_EXECUTOR)
    @ConditionalOnMissingBean(name = STORE_EXECUTOR)
    public ExecutorService gigDraftStoreExecutor(GigDraftProperties props) {
        if (props.getWorkerThreads() <= 0) {
            throw new IllegalArgumentException("gigdraft.worker-threads must be a positive number");
        }
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "gigdraft-store-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(props.getWorkerThreads(), threads);
    }

    @Bean
    @ConditionalOnMissingBean
    public DraftStore draftStore(MongoTemplate mongoTemplate,
                                 ObjectMapper objectMapper,
                                 @Qualifier(STORE_EXECUTOR) ExecutorService executor,
                                 GigDraftProperties props) {
        return new MongoDraftStore(mongoTemplate, objectMapper, executor, props.getStoreTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(MongoTemplate mongoTemplate,
                             ObjectMapper objectMapper,
                             @Qualifier(STORE_EXECUTOR) ExecutorService executor,
                             GigDraftProperties props) {
        return new MongoJobPostingStore(mongoTemplate, objectMapper, executor, props.getStoreTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    protected GigDraftMongoIndexConfig gigDraftMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new GigDraftMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobFieldValidators jobFieldValidators() {
        return new JobFieldValidators();
    }

    @Bean
    @ConditionalOnMissingBean
    public CostCalculator costCalculator() {
        return new CostCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobDraftWorkflow jobDraftWorkflow(JobStore jobStore,
                                             DraftStore draftStore,
                                             ObjectProvider<EmployerIdProvider> employerIdProvider,
                                             JobFieldValidators validators,
                                             CostCalculator costCalculator) {
        return new DraftLifecycleCoordinator(
                jobStore,
                draftStore,
                employerIdProvider.getIfAvailable(() -> EmployerIdProvider.NONE),
                validators,
                costCalculator
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public FormSessionFactory formSessionFactory(JobDraftWorkflow workflow, GigDraftProperties props) {
        return new FormSessionFactory(workflow, props.isAutosaveEnabled());
    }

    @Bean
    @ConditionalOnMissingBean
    public GigDraftLifecycle gigDraftLifecycle(@Qualifier(STORE_EXECUTOR) ExecutorService executor, GigDraftProperties props) {
        return new GigDraftLifecycle(executor, props.getStoreTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "gigdraft", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton gigDraftIndexesInitializer(GigDraftMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
