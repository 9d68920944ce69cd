package io.gigdraft.config;

import io.gigdraft.internal.mongo.DraftDocument;
import io.gigdraft.internal.mongo.JobPostingDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the draft workflow.
 *
 * <p>Indexes are not created at startup unless {@code gigdraft.ensure-indexes-on-startup=true};
 * in production they usually come from migrations.
 *
 * <h3>Collection {@code job_postings}</h3>
 * <ul>
 *   <li><b>idx_employer_status</b>: { employerId: 1, status: 1 }
 *       <br/>Listing an employer's postings by status.</li>
 *   <li><b>idx_created_at</b>: { createdAt: -1 }
 *       <br/>Newest-first feeds.</li>
 * </ul>
 *
 * <h3>Collection {@code job_drafts}</h3>
 * <ul>
 *   <li><b>idx_last_modified</b>: { lastModified: 1 }
 *       <br/>Finding stale drafts to purge.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.job_postings.createIndex({ employerId: 1, status: 1 }, { name: "idx_employer_status" });
 * db.job_postings.createIndex({ createdAt: -1 }, { name: "idx_created_at" });
 * db.job_drafts.createIndex({ lastModified: 1 }, { name: "idx_last_modified" });
 * </pre>
 */
public class GigDraftMongoIndexConfig {

    public static final String IDX_EMPLOYER_STATUS = "idx_employer_status";
    public static final String IDX_CREATED_AT = "idx_created_at";
    public static final String IDX_LAST_MODIFIED = "idx_last_modified";

    private final MongoTemplate mongoTemplate;

    public GigDraftMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create the indexes listed above. Safe to call repeatedly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobPostingDocument.class).ensureIndex(employerStatusIndex());
        mongoTemplate.indexOps(JobPostingDocument.class).ensureIndex(createdAtIndex());
        mongoTemplate.indexOps(DraftDocument.class).ensureIndex(lastModifiedIndex());
    }

    public static Index employerStatusIndex() {
        return new Index()
                .on("employerId", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .named(IDX_EMPLOYER_STATUS);
    }

    public static Index createdAtIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_CREATED_AT);
    }

    public static Index lastModifiedIndex() {
        return new Index()
                .on("lastModified", Sort.Direction.ASC)
                .named(IDX_LAST_MODIFIED);
    }
}
