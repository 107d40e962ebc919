package io.github.hatchcrm.aiemployees.runtime.ratelimit;

import io.github.hatchcrm.aiemployees.persistence.document.ExecutionLogDocument;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TenantRateLimiterTest {

    @Mock private MongoTemplate mongoTemplate;

    @Test
    void underCeilingIsAllowed() {
        when(mongoTemplate.count(any(Query.class), eq(ExecutionLogDocument.class))).thenReturn(499L);

        assertThat(new TenantRateLimiter(mongoTemplate, 500).isOverLimit("tenant-1")).isFalse();
    }

    @Test
    void reachingCeilingBlocks() {
        when(mongoTemplate.count(any(Query.class), eq(ExecutionLogDocument.class))).thenReturn(500L);

        assertThat(new TenantRateLimiter(mongoTemplate, 500).isOverLimit("tenant-1")).isTrue();
    }

    @Test
    void nonPositiveCeilingDisablesTheCheck() {
        TenantRateLimiter limiter = new TenantRateLimiter(mongoTemplate, 0);

        assertThat(limiter.isOverLimit("tenant-1")).isFalse();
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void countsOnlyToolExecutionsOfTheTenantInTheLastDay() {
        when(mongoTemplate.count(any(Query.class), eq(ExecutionLogDocument.class))).thenReturn(3L);
        TenantRateLimiter limiter = new TenantRateLimiter(mongoTemplate, 500);

        assertThat(limiter.countRecentExecutions("tenant-1")).isEqualTo(3L);

        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).count(captor.capture(), eq(ExecutionLogDocument.class));
        Document criteria = captor.getValue().getQueryObject();
        assertThat(criteria.get(ExecutionLogDocument.TENANT_ID)).isEqualTo("tenant-1");
        assertThat(criteria).containsKey(ExecutionLogDocument.CREATED_AT);
        assertThat(criteria.get(ExecutionLogDocument.TOOL_KEY).toString()).contains("$not");
    }
}
