package org.queryguard.resources;

import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.queryguard.dto.AdmissionResponse;
import org.queryguard.dto.ApiError;
import org.queryguard.dto.QueryResponse;
import org.queryguard.dto.QueryStatus;
import org.queryguard.dto.SubmitQueryRequest;
import org.queryguard.errors.GlobalExceptionMapper;
import org.queryguard.model.QueryResult;
import org.queryguard.model.RejectionReason;
import org.queryguard.service.AdmissionFilter;
import org.queryguard.service.QueryExecutor;
import org.queryguard.service.QueryService;

import javax.ws.rs.client.Entity;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(DropwizardExtensionsSupport.class)
class QueryResourceTest {
    private static final QueryExecutor EXECUTOR = mock(QueryExecutor.class);

    private static final ResourceExtension RESOURCES = ResourceExtension.builder()
            .setRegisterDefaultExceptionMappers(false)
            .addProvider(new GlobalExceptionMapper())
            .addResource(new QueryResource(new QueryService(new AdmissionFilter(), EXECUTOR)))
            .build();

    @AfterEach
    void tearDown() {
        reset(EXECUTOR);
    }

    private static Response post(String path, Object body) {
        return RESOURCES.target(path).request(MediaType.APPLICATION_JSON).post(Entity.json(body));
    }

    @Test
    void acceptedQueryReturnsRows() {
        when(EXECUTOR.execute("SELECT id FROM customers LIMIT 200")).thenReturn(QueryResult.rows(
                Collections.singletonList("id"),
                Arrays.asList(Collections.singletonList(1), Collections.singletonList(2))));

        Response r = post("/queries", new SubmitQueryRequest("SELECT id FROM customers"));

        assertThat(r.getStatus()).isEqualTo(200);
        QueryResponse body = r.readEntity(QueryResponse.class);
        assertThat(body.status).isEqualTo(QueryStatus.SUCCEEDED);
        assertThat(body.sql).isEqualTo("SELECT id FROM customers LIMIT 200");
        assertThat(body.columns).containsExactly("id");
        assertThat(body.rows).hasSize(2);
    }

    @Test
    void rejectionIsARegularResponse() {
        Response r = post("/queries", new SubmitQueryRequest("DELETE FROM orders WHERE id=1"));

        assertThat(r.getStatus()).isEqualTo(200);
        QueryResponse body = r.readEntity(QueryResponse.class);
        assertThat(body.status).isEqualTo(QueryStatus.REJECTED);
        assertThat(body.reason).isEqualTo(RejectionReason.WRITE_OPERATION_FORBIDDEN);
        assertThat(body.error).isEqualTo("ERROR: write operations are not allowed.");
        verify(EXECUTOR, never()).execute(anyString());
    }

    @Test
    void rejectedResponseOmitsResultFields() {
        String json = post("/queries", new SubmitQueryRequest("SHOW TABLES")).readEntity(String.class);

        assertThat(json).contains("\"status\":\"REJECTED\"", "\"reason\":\"ONLY_SELECT_ALLOWED\"");
        assertThat(json).doesNotContain("\"columns\"", "\"rows\"", "\"sql\"");
    }

    @Test
    void executionErrorIsARegularResponse() {
        when(EXECUTOR.execute(anyString())).thenReturn(QueryResult.error("Column \"NOPE\" not found"));

        QueryResponse body = post("/queries", new SubmitQueryRequest("SELECT nope FROM customers"))
                .readEntity(QueryResponse.class);

        assertThat(body.status).isEqualTo(QueryStatus.FAILED);
        assertThat(body.error).isEqualTo("ERROR: Column \"NOPE\" not found");
    }

    @Test
    void missingSqlIsABadRequest() {
        Response r = post("/queries", Collections.emptyMap());

        assertThat(r.getStatus()).isEqualTo(400);
        ApiError err = r.readEntity(ApiError.class);
        assertThat(err.code).isEqualTo(400);
        assertThat(err.detail).isEqualTo("sql required");
    }

    @Test
    void blankSqlIsABadRequest() {
        assertThat(post("/queries/admissions", new SubmitQueryRequest("   ")).getStatus()).isEqualTo(400);
    }

    @Test
    void admissionsEndpointOnlyAdmits() {
        AdmissionResponse body = post("/queries/admissions", new SubmitQueryRequest("select name from customers;"))
                .readEntity(AdmissionResponse.class);

        assertThat(body.accepted).isTrue();
        assertThat(body.sql).isEqualTo("select name from customers LIMIT 200");
        verify(EXECUTOR, never()).execute(anyString());
    }
}
