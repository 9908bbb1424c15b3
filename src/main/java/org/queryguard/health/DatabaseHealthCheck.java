package org.queryguard.health;

import com.codahale.metrics.health.HealthCheck;
import org.queryguard.repo.SchemaRepo;

// Reports unhealthy when no valid connection can be borrowed from the pool
public class DatabaseHealthCheck extends HealthCheck {
    private final SchemaRepo repo;

    public DatabaseHealthCheck(SchemaRepo repo) {
        this.repo = repo;
    }

    @Override
    protected Result check() {
        try {
            return Result.healthy(repo.verifyConnection());
        } catch (Exception e) {
            return Result.unhealthy(e);
        }
    }
}
