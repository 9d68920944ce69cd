package io.gigdraft.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.gigdraft.DraftStore;
import io.gigdraft.core.JobPostingDraft;
import io.gigdraft.core.StoreResult;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * MongoDB persistence layer for drafts ({@code job_drafts}). Saves are whole-document
 * replacements, so concurrent saves of one id are last-write-wins.
 */
public class MongoDraftStore extends MongoStoreSupport implements DraftStore {

    public static final String COLLECTION = "job_drafts";

    public MongoDraftStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Executor executor, Duration timeout) {
        super(mongoTemplate, objectMapper, executor, timeout);
    }

    @Override
    protected String entity() {
        return COLLECTION;
    }

    @Override
    public CompletableFuture<StoreResult<Optional<JobPostingDraft>>> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return execute("get", id, () -> {
            DraftDocument doc = mongoTemplate.findById(id, DraftDocument.class);
            return StoreResult.success(Optional.ofNullable(doc).map(this::toDraft));
        });
    }

    @Override
    public CompletableFuture<StoreResult<Void>> save(JobPostingDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        return execute("save", draft.id(), () -> {
            mongoTemplate.save(toDocument(draft));
            return StoreResult.done();
        });
    }

    @Override
    public CompletableFuture<StoreResult<Void>> delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return execute("delete", id, () -> {
            mongoTemplate.remove(new Query(Criteria.where("_id").is(id)), DraftDocument.class);
            return StoreResult.done();
        });
    }

    DraftDocument toDocument(JobPostingDraft draft) {
        DraftDocument doc = new DraftDocument();
        doc.setId(draft.id());
        doc.setTitle(draft.title());
        doc.setDescription(draft.description());
        doc.setSalaryAmount(draft.salaryAmount());
        doc.setSalaryUnit(draft.salaryUnit());
        doc.setDurationAmount(draft.durationAmount());
        doc.setDurationUnit(draft.durationUnit());
        doc.setLocation(toLocationMap(draft.location()));
        doc.setLastModified(draft.lastModified());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobPostingDraft)}.
     */
    JobPostingDraft toDraft(DraftDocument doc) {
        return new JobPostingDraft(
                doc.getId(),
                doc.getTitle(),
                doc.getDescription(),
                doc.getSalaryAmount(),
                doc.getSalaryUnit(),
                doc.getDurationAmount(),
                doc.getDurationUnit(),
                toLocation(doc.getLocation()),
                doc.getLastModified()
        );
    }
}
