package io.github.drompincen.aegis.persistence.store;

import io.github.drompincen.aegis.persistence.document.CounterDocument;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * Monotonic numeric ids backed by the {@code counters} collection. Values are
 * unique per sequence but may leave gaps.
 */
@Component
public class SequenceGenerator {

    public static final String APPROVALS = "approvals";
    public static final String AUDIT_LOG = "audit_log";

    private final MongoTemplate mongoTemplate;

    public SequenceGenerator(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public long next(String sequenceName) {
        CounterDocument counter = mongoTemplate.findAndModify(
                query(where("name").is(sequenceName)),
                new Update().inc("seq", 1),
                FindAndModifyOptions.options().upsert(true).returnNew(true),
                CounterDocument.class);
        if (counter == null) {
            throw new IllegalStateException("Counter " + sequenceName + " was not returned by the store");
        }
        return counter.getSeq();
    }
}
