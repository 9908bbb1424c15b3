package org.queryguard;

import io.dropwizard.Configuration;
import io.dropwizard.db.DataSourceFactory;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

public class QueryGuardConfiguration extends Configuration {
    @Valid
    @NotNull
    public DataSourceFactory database = new DataSourceFactory();

    // Appended as LIMIT n to unbounded, non-aggregate SELECTs
    @Min(1)
    public int defaultRowLimit = 200;

    @Min(0)
    public int statementTimeoutMs = 10_000;
    @Min(0)
    public int fetchSize = 500;

    // Tables described to the agent
    @NotNull
    public List<String> includeTables = new ArrayList<>();
    @Min(0)
    public int sampleRows = 3;
}
