package io.gigdraft.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.gigdraft.JobStore;
import io.gigdraft.core.JobPosting;
import io.gigdraft.core.StoreError;
import io.gigdraft.core.StoreResult;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * MongoDB persistence layer for published postings ({@code job_postings}).
 *
 * <p>{@link #update} rewrites every content field but never touches {@code _id} or
 * {@code createdAt}; a missing id is reported as NOT_FOUND instead of being upserted.
 */
public class MongoJobPostingStore extends MongoStoreSupport implements JobStore {

    public static final String COLLECTION = "job_postings";

    public MongoJobPostingStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Executor executor, Duration timeout) {
        super(mongoTemplate, objectMapper, executor, timeout);
    }

    @Override
    protected String entity() {
        return COLLECTION;
    }

    @Override
    public CompletableFuture<StoreResult<JobPosting>> create(JobPosting job) {
        Objects.requireNonNull(job, "job must not be null");
        return execute("create", job.id(), () -> {
            JobPostingDocument doc = toDocument(job);
            if (isBlank(doc.getId())) {
                // Mongo assigns an ObjectId
                doc.setId(null);
            }
            JobPostingDocument inserted = mongoTemplate.insert(doc);
            return StoreResult.success(toPosting(inserted));
        });
    }

    @Override
    public CompletableFuture<StoreResult<JobPosting>> update(String id, JobPosting job) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(job, "job must not be null");
        return execute("update", id, () -> {
            Query q = new Query(Criteria.where("_id").is(id));
            Update u = new Update()
                    .set("employerId", job.employerId())
                    .set("title", job.title())
                    .set("description", job.description())
                    .set("salaryAmount", job.salaryAmount())
                    .set("salaryUnit", job.salaryUnit())
                    .set("durationAmount", job.durationAmount())
                    .set("durationUnit", job.durationUnit())
                    .set("location", toLocationMap(job.location()))
                    .set("status", job.status())
                    .set("updatedAt", job.updatedAt());

            FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);
            JobPostingDocument updated = mongoTemplate.findAndModify(q, u, options, JobPostingDocument.class);
            if (updated == null) {
                return StoreResult.failure(StoreError.notFound(COLLECTION, "update", id));
            }
            return StoreResult.success(toPosting(updated));
        });
    }

    @Override
    public CompletableFuture<StoreResult<JobPosting>> getById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return execute("getById", id, () -> {
            JobPostingDocument doc = mongoTemplate.findById(id, JobPostingDocument.class);
            if (doc == null) {
                return StoreResult.failure(StoreError.notFound(COLLECTION, "getById", id));
            }
            return StoreResult.success(toPosting(doc));
        });
    }

    JobPostingDocument toDocument(JobPosting job) {
        JobPostingDocument doc = new JobPostingDocument();
        doc.setId(job.id());
        doc.setEmployerId(job.employerId());
        doc.setTitle(job.title());
        doc.setDescription(job.description());
        doc.setSalaryAmount(job.salaryAmount());
        doc.setSalaryUnit(job.salaryUnit());
        doc.setDurationAmount(job.durationAmount());
        doc.setDurationUnit(job.durationUnit());
        doc.setLocation(toLocationMap(job.location()));
        doc.setStatus(job.status());
        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobPosting)}.
     */
    JobPosting toPosting(JobPostingDocument doc) {
        return new JobPosting(
                doc.getId(),
                doc.getEmployerId(),
                doc.getTitle(),
                doc.getDescription(),
                doc.getSalaryAmount(),
                doc.getSalaryUnit(),
                doc.getDurationAmount(),
                doc.getDurationUnit(),
                toLocation(doc.getLocation()),
                doc.getStatus(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }
}
