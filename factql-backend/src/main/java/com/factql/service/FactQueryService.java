package com.factql.service;

import com.factql.api.FactRow;
import com.factql.api.HealthResponse;
import com.factql.api.QueryRequest;
import com.factql.api.RawFactsRequest;
import com.factql.api.TimeseriesPoint;
import com.factql.api.TimeseriesRequest;
import com.factql.decode.CellValue;
import com.factql.decode.MaterializedRecord;
import com.factql.decode.ResultMaterializer;
import com.factql.query.BuiltQuery;
import com.factql.query.QueryBuilder;
import com.factql.query.RequestValidator;
import com.factql.query.TimeseriesQuery;
import com.factql.query.ValidatedRequest;
import com.factql.store.FactStore;
import com.factql.store.QueryContext;
import com.factql.store.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Validate, build, execute, decode: the path every endpoint takes.
 */
@Slf4j
@Service
public class FactQueryService {

    private final RequestValidator validator;
    private final QueryBuilder queryBuilder;
    private final FactStore factStore;
    private final ResultMaterializer materializer;

    public FactQueryService(
            RequestValidator validator,
            QueryBuilder queryBuilder,
            FactStore factStore,
            ResultMaterializer materializer
    ) {
        this.validator = validator;
        this.queryBuilder = queryBuilder;
        this.factStore = factStore;
        this.materializer = materializer;
    }

    public List<FactRow> fetchFacts(RawFactsRequest request, QueryContext context) {
        BuiltQuery query = queryBuilder.buildRawQuery(validator.validateRaw(request));
        return factStore.query(query, context, FactRowReader::readAll);
    }

    public List<MaterializedRecord> aggregate(QueryRequest request, QueryContext context) {
        ValidatedRequest validated = validator.validate(request);
        BuiltQuery query = queryBuilder.buildAggregateQuery(validated);
        log.debug("Aggregate query: group_by={}, metrics={}", validated.getGroupBy(), validated.getMetrics());
        return factStore.query(query, context, materializer::materialize);
    }

    public List<TimeseriesPoint> timeseries(TimeseriesRequest request, QueryContext context) {
        TimeseriesQuery validated = validator.validateTimeseries(request);
        BuiltQuery query = queryBuilder.buildTimeseriesQuery(validated);
        List<MaterializedRecord> records = factStore.query(query, context, materializer::materialize);

        List<TimeseriesPoint> points = new ArrayList<>(records.size());
        for (MaterializedRecord record : records) {
            points.add(toPoint(record));
        }
        return points;
    }

    /**
     * Probes the store. A failure is reported, never thrown.
     */
    public HealthResponse health() {
        try {
            factStore.ping();
            return HealthResponse.ok();
        } catch (StorageException e) {
            return HealthResponse.unhealthy(e.getMessage());
        }
    }

    private static TimeseriesPoint toPoint(MaterializedRecord record) {
        CellValue period = record.get("period").orElse(CellValue.nullValue());
        CellValue value = record.get("value").orElse(CellValue.nullValue());
        String periodText;
        if (period.isNull()) {
            periodText = null;
        } else if (period.getKind() == CellValue.Kind.TEXT) {
            periodText = period.asText();
        } else {
            periodText = String.valueOf(period.getValue());
        }
        return new TimeseriesPoint(periodText, value.isNull() ? 0.0 : value.asDouble());
    }
}
