package org.queryguard;

import io.dropwizard.Application;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.db.ManagedDataSource;
import io.dropwizard.setup.Bootstrap;
import io.dropwizard.setup.Environment;
import org.queryguard.errors.GlobalExceptionMapper;
import org.queryguard.health.DatabaseHealthCheck;
import org.queryguard.repo.SchemaRepo;
import org.queryguard.resources.QueryResource;
import org.queryguard.resources.SchemaResource;
import org.queryguard.resources.ToolResource;
import org.queryguard.service.AdmissionFilter;
import org.queryguard.service.QueryExecutor;
import org.queryguard.service.QueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

public class QueryGuardApplication extends Application<QueryGuardConfiguration> {
    private static final Logger LOG = LoggerFactory.getLogger(QueryGuardApplication.class);

    @Override
    public String getName() {
        return "query-guard";
    }

    @Override
    public void initialize(Bootstrap<QueryGuardConfiguration> bootstrap) {
        // ${DB_URL} style placeholders in the YAML
        bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
                bootstrap.getConfigurationSourceProvider(),
                new EnvironmentVariableSubstitutor(false)));
    }

    @Override
    public void run(QueryGuardConfiguration cfg, Environment env) {
        ManagedDataSource dataSource = cfg.database.build(env.metrics(), "guarded-db");
        env.lifecycle().manage(dataSource);

        SchemaRepo schemaRepo = new SchemaRepo(dataSource, cfg.includeTables, cfg.sampleRows);
        try {
            LOG.info("Connected to {}", schemaRepo.verifyConnection());
        } catch (SQLException e) {
            throw new IllegalStateException("database unreachable at startup: " + e.getMessage(), e);
        }

        AdmissionFilter admissionFilter = new AdmissionFilter(cfg.defaultRowLimit);
        QueryExecutor executor = new QueryExecutor(dataSource, cfg.statementTimeoutMs, cfg.fetchSize);
        QueryService service = new QueryService(admissionFilter, executor);

        env.healthChecks().register("database", new DatabaseHealthCheck(schemaRepo));

        env.jersey().register(new GlobalExceptionMapper());
        env.jersey().register(new QueryResource(service));
        env.jersey().register(new SchemaResource(schemaRepo));
        env.jersey().register(new ToolResource());
    }

    public static void main(String[] args) throws Exception {
        new QueryGuardApplication().run(args);
    }
}
