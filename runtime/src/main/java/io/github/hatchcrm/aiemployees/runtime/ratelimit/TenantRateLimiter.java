package io.github.hatchcrm.aiemployees.runtime.ratelimit;

import io.github.hatchcrm.aiemployees.persistence.document.ExecutionLogDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Sliding 24-hour ceiling on tool executions per tenant. The count is read from the execution
 * log on every check, so all service instances see the same number; two executions racing past
 * the ceiling can both be let through.
 */
@Service
public class TenantRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TenantRateLimiter.class);

    static final Duration WINDOW = Duration.ofHours(24);
    // conversation turns and review decisions are not executions
    static final String NON_EXECUTION_KEYS = "^(conversation|review):";

    private final MongoTemplate mongoTemplate;
    private final long maxExecutionsPerDay;

    public TenantRateLimiter(MongoTemplate mongoTemplate,
                             @Value("${hatch.ai.max-executions-per-day:500}") long maxExecutionsPerDay) {
        this.mongoTemplate = mongoTemplate;
        this.maxExecutionsPerDay = maxExecutionsPerDay;
    }

    public boolean isOverLimit(String tenantId) {
        if (maxExecutionsPerDay <= 0) {
            return false;
        }
        long count = countRecentExecutions(tenantId);
        if (count >= maxExecutionsPerDay) {
            log.warn("Tenant {} reached {} executions in the last 24h (limit {})", tenantId, count, maxExecutionsPerDay);
            return true;
        }
        return false;
    }

    public long countRecentExecutions(String tenantId) {
        Instant since = Instant.now().minus(WINDOW);
        Query query = new Query(Criteria.where(ExecutionLogDocument.TENANT_ID).is(tenantId)
                .and(ExecutionLogDocument.CREATED_AT).gte(since)
                .and(ExecutionLogDocument.TOOL_KEY).not().regex(NON_EXECUTION_KEYS));
        return mongoTemplate.count(query, ExecutionLogDocument.class);
    }

    public long getMaxExecutionsPerDay() {
        return maxExecutionsPerDay;
    }
}
