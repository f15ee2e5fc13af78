package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.CustomerDocument;
import com.example.csvimport.ingestion.model.InsertOutcome;
import com.example.csvimport.ingestion.support.StoreUnavailableException;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

/**
 * Record store for customers. Every insert is a single atomic {@code insertOne}; the unique index on
 * {@code emailKey} turns a second insert of the same email into {@link InsertOutcome#DUPLICATE_EMAIL}.
 */
@Slf4j
@Repository
public class CustomerRepository {

    static final String COLLECTION_NAME = "customers";
    static final String EMAIL_KEY_INDEX = "uk_customers_email_key";

    private final MongoTemplate mongoTemplate;
    private final MongoCollection<Document> collection;
    private final Clock clock;

    public CustomerRepository(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.collection = mongoTemplate.getCollection(COLLECTION_NAME);
        this.clock = clock;
    }

    /**
     * Duplicate detection relies on this index, so a failure here stops startup instead of letting
     * inserts run unguarded.
     */
    @PostConstruct
    void ensureIndexes() {
        try {
            collection.createIndex(Indexes.ascending("emailKey"), new IndexOptions().unique(true).name(EMAIL_KEY_INDEX));
            log.info("Ensured unique index {} on {}", EMAIL_KEY_INDEX, COLLECTION_NAME);
        } catch (MongoException ex) {
            log.error("Could not ensure unique index {} on {}", EMAIL_KEY_INDEX, COLLECTION_NAME, ex);
            throw new StoreUnavailableException("Could not ensure unique index %s on %s: %s"
                    .formatted(EMAIL_KEY_INDEX, COLLECTION_NAME, ex.getMessage()), ex);
        }
    }

    public InsertOutcome insert(ValidationResult.Accepted row) {
        try {
            collection.insertOne(toBsonDocument(row));
            return InsertOutcome.INSERTED;
        } catch (MongoWriteException ex) {
            if (ex.getError() != null && ex.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                return InsertOutcome.DUPLICATE_EMAIL;
            }
            throw new StoreUnavailableException("Record store rejected insert: " + ex.getMessage(), ex);
        } catch (MongoException ex) {
            throw new StoreUnavailableException("Record store unavailable: " + ex.getMessage(), ex);
        }
    }

    public void forEachInInsertionOrder(int batchSize, Consumer<Document> action) {
        try (MongoCursor<Document> cursor = collection.find()
                .sort(Sorts.ascending("_id"))
                .batchSize(batchSize)
                .iterator()) {
            while (cursor.hasNext()) {
                action.accept(cursor.next());
            }
        } catch (MongoException ex) {
            throw new StoreUnavailableException("Record store unavailable: " + ex.getMessage(), ex);
        }
    }

    public List<CustomerDocument> findLatest(int limit) {
        Query query = new Query().with(Sort.by(Sort.Direction.DESC, "_id")).limit(limit);
        try {
            return mongoTemplate.find(query, CustomerDocument.class);
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Record store unavailable: " + ex.getMessage(), ex);
        }
    }

    private Document toBsonDocument(ValidationResult.Accepted row) {
        Document doc = new Document();
        doc.put("name", row.name());
        doc.put("email", row.email());
        doc.put("emailKey", CustomerDocument.toEmailKey(row.email()));
        doc.put("age", row.age());
        doc.put("createdAt", Date.from(clock.instant()));
        return doc;
    }
}
