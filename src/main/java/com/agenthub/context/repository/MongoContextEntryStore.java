package com.agenthub.context.repository;

import com.agenthub.context.config.AgentContextProperties;
import com.agenthub.context.model.AccessRecord;
import com.agenthub.context.model.ContextEntry;
import com.agenthub.context.model.ContextQuery;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoDB 持久层实现
 * 同 Key 写入的并发保护依赖 _id + version 条件匹配
 */
@Slf4j
@Repository
public class MongoContextEntryStore implements ContextEntryStore {

    static final String FIELD_ID = "_id";
    static final String FIELD_VERSION = "version";
    static final String FIELD_ACCESS_LOG = "accessLog";
    static final String FIELD_EXPIRES_AT = "expiresAt";
    static final String FIELD_CREATED_AT = "createdAt";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoContextEntryStore(MongoTemplate mongoTemplate, AgentContextProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.collection = properties.getStore().getCollection();
    }

    @Override
    public Optional<ContextEntry> findOne(String fullKey) {
        return Optional.ofNullable(mongoTemplate.findById(fullKey, ContextEntry.class, collection));
    }

    @Override
    public boolean upsert(ContextEntry entry, long expectedVersion) {
        if (expectedVersion == 0) {
            try {
                mongoTemplate.insert(entry, collection);
                return true;
            } catch (DuplicateKeyException e) {
                log.debug("Insert lost race, entry already exists: fullKey={}", entry.getId());
                return false;
            }
        }
        ContextEntry previous = mongoTemplate.findAndReplace(
            versionMatch(entry.getId(), expectedVersion), entry, FindAndReplaceOptions.options(), collection);
        return previous != null;
    }

    @Override
    public boolean update(ContextEntry entry, long expectedVersion, AccessRecord writeRecord) {
        Update update = new Update()
            .set("value", entry.getValue())
            .set("dataType", entry.getDataType())
            .set("accessLevel", entry.getAccessLevel())
            .set("lastWriter", entry.getLastWriter())
            .set("updatedAt", entry.getUpdatedAt())
            .set(FIELD_EXPIRES_AT, entry.getExpiresAt())
            .set(FIELD_VERSION, entry.getVersion())
            .set("metadata", entry.getMetadata())
            .push(FIELD_ACCESS_LOG, writeRecord);
        UpdateResult result = mongoTemplate.updateFirst(
            versionMatch(entry.getId(), expectedVersion), update, ContextEntry.class, collection);
        return result.getMatchedCount() == 1;
    }

    @Override
    public boolean deleteOne(String fullKey) {
        DeleteResult result = mongoTemplate.remove(
            Query.query(where(FIELD_ID).is(fullKey)), ContextEntry.class, collection);
        return result.getDeletedCount() > 0;
    }

    @Override
    public Optional<ContextEntry> appendAccessLog(String fullKey, AccessRecord record) {
        ContextEntry updated = mongoTemplate.findAndModify(
            Query.query(where(FIELD_ID).is(fullKey)),
            new Update().push(FIELD_ACCESS_LOG, record),
            FindAndModifyOptions.options().returnNew(true),
            ContextEntry.class,
            collection);
        return Optional.ofNullable(updated);
    }

    @Override
    public List<ContextEntry> query(ContextQuery query, Instant now) {
        Query mongoQuery = toMongoQuery(query, now);
        List<ContextEntry> entries = mongoTemplate.find(mongoQuery, ContextEntry.class, collection);
        log.debug("Context query executed: filter={}, results={}", mongoQuery.getQueryObject(), entries.size());
        return entries;
    }

    Query toMongoQuery(ContextQuery query, Instant now) {
        List<Criteria> conditions = new ArrayList<>();
        if (query.getScope() != null) {
            conditions.add(where("scope").is(query.getScope()));
        }
        if (query.getDataType() != null) {
            conditions.add(where("dataType").is(query.getDataType()));
        }
        if (query.getOwnerAgent() != null) {
            conditions.add(where("ownerAgent").is(query.getOwnerAgent()));
        }
        if (query.getKeyPattern() != null) {
            conditions.add(where("key").regex(query.getKeyPattern()));
        }
        if (query.getCreatedAfter() != null || query.getCreatedBefore() != null) {
            Criteria created = where(FIELD_CREATED_AT);
            if (query.getCreatedAfter() != null) {
                created = created.gte(query.getCreatedAfter());
            }
            if (query.getCreatedBefore() != null) {
                created = created.lte(query.getCreatedBefore());
            }
            conditions.add(created);
        }
        if (!query.isIncludeExpired()) {
            // null 同时匹配字段缺失
            conditions.add(new Criteria().orOperator(
                where(FIELD_EXPIRES_AT).is(null),
                where(FIELD_EXPIRES_AT).gt(now)));
        }
        Query mongoQuery = conditions.isEmpty()
            ? new Query()
            : new Query(new Criteria().andOperator(conditions));
        return mongoQuery.with(Sort.by(Sort.Direction.DESC, FIELD_CREATED_AT));
    }

    @Override
    public void ensureIndexes() {
        IndexOperations indexOps = mongoTemplate.indexOps(collection);
        indexOps.ensureIndex(new Index()
            .on("scope", Sort.Direction.ASC)
            .on("dataType", Sort.Direction.ASC)
            .on("key", Sort.Direction.ASC)
            .named("scope_dataType_key"));
        indexOps.ensureIndex(new Index()
            .on("ownerAgent", Sort.Direction.ASC)
            .on(FIELD_CREATED_AT, Sort.Direction.DESC)
            .named("ownerAgent_createdAt"));
        // 物理删除由 MongoDB TTL 线程完成，逻辑过期在读路径判断
        indexOps.ensureIndex(new Index()
            .on(FIELD_EXPIRES_AT, Sort.Direction.ASC)
            .expire(0, TimeUnit.SECONDS)
            .named("expiresAt_ttl"));
        log.info("Context entry indexes ensured: collection={}", collection);
    }

    @Override
    public void ping() {
        mongoTemplate.executeCommand(new Document("ping", 1));
    }

    private static Query versionMatch(String fullKey, long expectedVersion) {
        return Query.query(where(FIELD_ID).is(fullKey).and(FIELD_VERSION).is(expectedVersion));
    }
}
