package org.queryguard;

import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.queryguard.dto.QueryResponse;
import org.queryguard.dto.QueryStatus;
import org.queryguard.dto.SubmitQueryRequest;
import org.queryguard.model.RejectionReason;

import javax.ws.rs.client.Entity;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

// Full application against an in-memory H2 shop database
@ExtendWith(DropwizardExtensionsSupport.class)
class QueryGuardApplicationTest {
    private static final DropwizardAppExtension<QueryGuardConfiguration> APP = new DropwizardAppExtension<>(
            QueryGuardApplication.class,
            ResourceHelpers.resourceFilePath("test-config.yml"));

    private static QueryResponse submit(String sql) {
        return APP.client()
                .target(String.format("http://localhost:%d/queries", APP.getLocalPort()))
                .request(MediaType.APPLICATION_JSON)
                .post(Entity.json(new SubmitQueryRequest(sql)), QueryResponse.class);
    }

    @Test
    void unboundedSelectIsCappedAndExecuted() {
        QueryResponse resp = submit("SELECT id FROM orders");

        assertThat(resp.status).isEqualTo(QueryStatus.SUCCEEDED);
        assertThat(resp.sql).isEqualTo("SELECT id FROM orders LIMIT 200");
        assertThat(resp.columns).containsExactly("ID");
        assertThat(resp.rows).hasSize(200);
    }

    @Test
    void aggregateRunsUnchanged() {
        QueryResponse resp = submit("SELECT count(*) FROM orders");

        assertThat(resp.status).isEqualTo(QueryStatus.SUCCEEDED);
        assertThat(resp.sql).isEqualTo("SELECT count(*) FROM orders");
        assertThat(resp.rows).hasSize(1);
        assertThat(((Number) resp.rows.get(0).get(0)).longValue()).isEqualTo(250L);
    }

    @Test
    void groupedQueryReturnsEveryGroup() {
        QueryResponse resp = submit("SELECT region, count(*) AS n FROM customers GROUP BY region ORDER BY region");

        assertThat(resp.columns).containsExactly("REGION", "N");
        List<Object> regions = resp.rows.stream().map(row -> row.get(0)).collect(Collectors.toList());
        assertThat(regions).containsExactly("APAC", "EU", "NA");
    }

    @Test
    void emptyResultKeepsColumns() {
        QueryResponse resp = submit("SELECT id, name FROM customers WHERE region = 'MARS'");

        assertThat(resp.status).isEqualTo(QueryStatus.SUCCEEDED);
        assertThat(resp.columns).containsExactly("ID", "NAME");
        assertThat(resp.rows).isEmpty();
    }

    @Test
    void writeIsRejectedAndDataIsUntouched() {
        QueryResponse resp = submit("UPDATE orders SET status='x'");

        assertThat(resp.status).isEqualTo(QueryStatus.REJECTED);
        assertThat(resp.reason).isEqualTo(RejectionReason.WRITE_OPERATION_FORBIDDEN);

        QueryResponse check = submit("SELECT count(*) FROM orders WHERE status = 'x'");
        assertThat(((Number) check.rows.get(0).get(0)).longValue()).isZero();
    }

    @Test
    void chainedStatementsAreRejected() {
        QueryResponse resp = submit("SELECT * FROM customers; SELECT * FROM orders");

        assertThat(resp.status).isEqualTo(QueryStatus.REJECTED);
        assertThat(resp.error).isEqualTo("ERROR: multiple statements are not allowed.");
    }

    @Test
    void missingColumnComesBackAsExecutionError() {
        QueryResponse resp = submit("SELECT nope FROM customers");

        assertThat(resp.status).isEqualTo(QueryStatus.FAILED);
        assertThat(resp.error).startsWith("ERROR: ").containsIgnoringCase("nope");
    }

    @Test
    void schemaDescribesConfiguredTables() {
        String text = APP.client()
                .target(String.format("http://localhost:%d/schema", APP.getLocalPort()))
                .request()
                .get(String.class);

        assertThat(text).startsWith("You are a careful analytics engineer. Use only these tables.\n\nCREATE TABLE customers (");
        assertThat(text).contains("CREATE TABLE orders (", "2 rows from orders table:");
        assertThat(text).doesNotContain("refunds");
    }

    @Test
    void databaseHealthCheckIsRegistered() {
        Response r = APP.client()
                .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
                .request()
                .get();

        assertThat(r.getStatus()).isEqualTo(200);
        assertThat(r.readEntity(String.class)).contains("\"database\"");
    }

    @Test
    void configurationIsBound() {
        QueryGuardConfiguration cfg = APP.getConfiguration();

        assertThat(cfg.defaultRowLimit).isEqualTo(200);
        assertThat(cfg.statementTimeoutMs).isEqualTo(5000);
        assertThat(cfg.includeTables).isEqualTo(Arrays.asList("customers", "orders"));
        assertThat(cfg.sampleRows).isEqualTo(2);
    }
}
