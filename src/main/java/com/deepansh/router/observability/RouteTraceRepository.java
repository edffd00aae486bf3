package com.deepansh.router.observability;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RouteTraceRepository extends MongoRepository<RouteTrace, String> {

    List<RouteTrace> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    List<RouteTrace> findByUserIdOrderByCreatedAtDesc(String userId);

    @Aggregation(pipeline = {
        "{ $match: { 'userId': ?0 } }",
        "{ $group: { _id: '$responderId', count: { $sum: 1 } } }"
    })
    List<ResponderCount> responderBreakdownForUser(String userId);

    record ResponderCount(String id, long count) {}
}
