package org.queryguard.service;

import org.queryguard.dto.AdmissionResponse;
import org.queryguard.dto.QueryResponse;
import org.queryguard.dto.QueryStatus;
import org.queryguard.model.AdmissionVerdict;
import org.queryguard.model.CandidateQuery;
import org.queryguard.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class QueryService {
    private static final Logger LOG = LoggerFactory.getLogger(QueryService.class);

    private final AdmissionFilter admissionFilter;
    private final QueryExecutor executor;

    public QueryService(AdmissionFilter admissionFilter, QueryExecutor executor) {
        this.admissionFilter = admissionFilter;
        this.executor = executor;
    }

    // Admits the query and runs it only when accepted. Rejections and failures come back as
    // responses, never as exceptions.
    public QueryResponse run(CandidateQuery query) {
        AdmissionVerdict verdict = admissionFilter.admit(query.sql());
        if (!verdict.isAccepted()) {
            AdmissionVerdict.Rejected rejected = (AdmissionVerdict.Rejected) verdict;
            LOG.info("Query rejected reason={}", rejected.reason());
            QueryResponse resp = new QueryResponse();
            resp.status = QueryStatus.REJECTED;
            resp.reason = rejected.reason();
            resp.error = rejected.reason().message();
            return resp;
        }

        String finalText = ((AdmissionVerdict.Accepted) verdict).finalText();
        return toResponse(finalText, executor.execute(finalText));
    }

    // Admission only
    public AdmissionResponse admit(CandidateQuery query) {
        AdmissionVerdict verdict = admissionFilter.admit(query.sql());
        AdmissionResponse resp = new AdmissionResponse();
        resp.accepted = verdict.isAccepted();
        if (verdict.isAccepted()) {
            resp.sql = ((AdmissionVerdict.Accepted) verdict).finalText();
        } else {
            AdmissionVerdict.Rejected rejected = (AdmissionVerdict.Rejected) verdict;
            resp.reason = rejected.reason();
            resp.error = rejected.reason().message();
        }
        return resp;
    }

    private static QueryResponse toResponse(String finalText, QueryResult result) {
        QueryResponse resp = new QueryResponse();
        resp.sql = finalText;
        if (result.isSuccess()) {
            QueryResult.Rows rows = (QueryResult.Rows) result;
            resp.status = QueryStatus.SUCCEEDED;
            resp.columns = rows.columns();
            resp.rows = rows.rows();
        } else {
            resp.status = QueryStatus.FAILED;
            resp.error = ((QueryResult.ExecutionError) result).render();
        }
        return resp;
    }
}
