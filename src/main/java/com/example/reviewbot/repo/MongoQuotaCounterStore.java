package com.example.reviewbot.repo;

import com.example.reviewbot.model.QuotaCounter;
import com.mongodb.client.result.UpdateResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

@Component
public class MongoQuotaCounterStore implements QuotaCounterStore {

    private final MongoTemplate mongo;

    @Autowired
    public MongoQuotaCounterStore(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public Optional<QuotaCounter> find(long subjectId) {
        return Optional.ofNullable(mongo.findById(subjectId, QuotaCounter.class));
    }

    @Override
    public QuotaCounter create(long subjectId, String windowDate) {
        QuotaCounter counter = QuotaCounter.builder()
                .subjectId(subjectId)
                .dailyCount(0)
                .lifetimeCount(0)
                .windowDate(windowDate)
                .build();
        try {
            return mongo.insert(counter);
        } catch (DuplicateKeyException e) {
            return find(subjectId).orElseThrow(() -> e);
        }
    }

    @Override
    public void increment(long subjectId, String today, Instant at) {
        UpdateResult same = mongo.updateFirst(
                query(where("_id").is(subjectId).and("windowDate").is(today)),
                new Update().inc("dailyCount", 1).inc("lifetimeCount", 1).set("lastMessageAt", at),
                QuotaCounter.class);
        if (same.getMatchedCount() > 0) return;

        UpdateResult rolled = mongo.updateFirst(
                query(where("_id").is(subjectId).and("windowDate").ne(today)),
                new Update().set("dailyCount", 1).set("windowDate", today)
                        .inc("lifetimeCount", 1).set("lastMessageAt", at),
                QuotaCounter.class);
        if (rolled.getMatchedCount() > 0) return;

        // no counter yet, or another instance rolled the window in between
        Query byId = query(where("_id").is(subjectId));
        mongo.upsert(byId,
                new Update().inc("dailyCount", 1).inc("lifetimeCount", 1)
                        .setOnInsert("windowDate", today).set("lastMessageAt", at),
                QuotaCounter.class);
    }
}
