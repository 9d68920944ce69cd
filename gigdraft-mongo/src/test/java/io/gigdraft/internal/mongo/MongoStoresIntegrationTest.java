package io.gigdraft.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.gigdraft.core.DurationUnit;
import io.gigdraft.core.JobPosting;
import io.gigdraft.core.JobPostingDraft;
import io.gigdraft.core.JobStatus;
import io.gigdraft.core.Location;
import io.gigdraft.core.SalaryUnit;
import io.gigdraft.core.StoreResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoresIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoClient client;
    private MongoTemplate mongoTemplate;
    private ExecutorService executor;
    private MongoDraftStore draftStore;
    private MongoJobPostingStore jobStore;

    @BeforeEach
    void setUp() {
        client = MongoClients.create(MONGO.getReplicaSetUrl());
        mongoTemplate = new MongoTemplate(client, "gigdraft_test");
        mongoTemplate.dropCollection(DraftDocument.class);
        mongoTemplate.dropCollection(JobPostingDocument.class);
        executor = Executors.newFixedThreadPool(2);
        draftStore = new MongoDraftStore(mongoTemplate, new ObjectMapper(), executor, Duration.ofSeconds(10));
        jobStore = new MongoJobPostingStore(mongoTemplate, new ObjectMapper(), executor, Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(DraftDocument.class);
        mongoTemplate.dropCollection(JobPostingDocument.class);
        executor.shutdownNow();
        client.close();
    }

    @Test
    void draftSaveShouldOverwriteAndGetShouldReadBack() throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        JobPostingDraft first = draft("d-1", "Warehouse Associate", now);
        JobPostingDraft second = draft("d-1", "Warehouse Lead", now.plusSeconds(1));

        assertTrue(draftStore.save(first).get(5, TimeUnit.SECONDS).isSuccess());
        assertTrue(draftStore.save(second).get(5, TimeUnit.SECONDS).isSuccess());

        StoreResult<Optional<JobPostingDraft>> loaded = draftStore.get("d-1").get(5, TimeUnit.SECONDS);
        assertTrue(loaded.isSuccess());
        assertTrue(loaded.value().isPresent());
        assertEquals(second, loaded.value().get());
        assertEquals(1, mongoTemplate.count(new Query(), DraftDocument.class));
    }

    @Test
    void draftGetShouldReturnEmptyForUnknownId() throws Exception {
        StoreResult<Optional<JobPostingDraft>> loaded = draftStore.get("missing").get(5, TimeUnit.SECONDS);

        assertTrue(loaded.isSuccess());
        assertFalse(loaded.value().isPresent());
    }

    @Test
    void draftDeleteShouldSucceedEvenWhenMissing() throws Exception {
        draftStore.save(draft("d-2", "Line Cook", Instant.now())).get(5, TimeUnit.SECONDS);

        assertTrue(draftStore.delete("d-2").get(5, TimeUnit.SECONDS).isSuccess());
        assertTrue(draftStore.delete("d-2").get(5, TimeUnit.SECONDS).isSuccess());
        assertNull(mongoTemplate.findById("d-2", DraftDocument.class));
    }

    @Test
    void createShouldAssignIdWhenMissing() throws Exception {
        StoreResult<JobPosting> created = jobStore.create(posting(null, "Warehouse Associate")).get(5, TimeUnit.SECONDS);

        assertTrue(created.isSuccess());
        assertNotNull(created.value().id());
        assertFalse(created.value().id().isBlank());

        StoreResult<JobPosting> fetched = jobStore.getById(created.value().id()).get(5, TimeUnit.SECONDS);
        assertTrue(fetched.isSuccess());
        assertEquals("Warehouse Associate", fetched.value().title());
        assertEquals(SalaryUnit.DAILY, fetched.value().salaryUnit());
        assertEquals("Karnataka", fetched.value().location().state());
    }

    @Test
    void updateShouldKeepIdAndCreatedAt() throws Exception {
        JobPosting original = jobStore.create(posting("job-42", "Warehouse Associate")).get(5, TimeUnit.SECONDS).value();

        JobPosting changed = posting(null, "Senior Warehouse Associate");
        changed = new JobPosting(null, changed.employerId(), changed.title(), changed.description(),
                750, SalaryUnit.DAILY, 10, DurationUnit.DAYS, changed.location(), JobStatus.ACTIVE,
                original.createdAt().plusSeconds(3600), original.updatedAt().plusSeconds(3600));

        StoreResult<JobPosting> updated = jobStore.update("job-42", changed).get(5, TimeUnit.SECONDS);

        assertTrue(updated.isSuccess());
        assertEquals("job-42", updated.value().id());
        assertEquals(original.createdAt(), updated.value().createdAt());
        assertEquals(changed.updatedAt(), updated.value().updatedAt());
        assertEquals("Senior Warehouse Associate", updated.value().title());
        assertEquals(750.0, updated.value().salaryAmount());
    }

    @Test
    void updateAndGetShouldReportNotFoundForUnknownId() throws Exception {
        StoreResult<JobPosting> updated = jobStore.update("nope", posting(null, "Warehouse Associate")).get(5, TimeUnit.SECONDS);
        StoreResult<JobPosting> fetched = jobStore.getById("nope").get(5, TimeUnit.SECONDS);

        assertTrue(updated.isFailure());
        assertTrue(updated.error().isNotFound());
        assertTrue(fetched.isFailure());
        assertTrue(fetched.error().isNotFound());
        assertNull(mongoTemplate.findById("nope", JobPostingDocument.class));
    }

    private static JobPostingDraft draft(String id, String title, Instant at) {
        return new JobPostingDraft(id, title, "Load and unload delivery trucks", 500, SalaryUnit.DAILY,
                5, DurationUnit.DAYS, new Location("Karnataka", "Bengaluru", 12.97, 77.59), at);
    }

    private static JobPosting posting(String id, String title) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        return new JobPosting(id, "employer-1", title, "Load and unload delivery trucks", 500, SalaryUnit.DAILY,
                5, DurationUnit.DAYS, Location.of("Karnataka", "Bengaluru"), JobStatus.ACTIVE, now, now);
    }
}
