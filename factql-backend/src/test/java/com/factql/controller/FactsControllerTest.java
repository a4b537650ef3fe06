package com.factql.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.factql.decode.CellValue;
import com.factql.decode.MaterializedRecord;
import com.factql.decode.ResultMaterializer;
import com.factql.query.BuiltQuery;
import com.factql.query.QueryBuilder;
import com.factql.query.RequestValidator;
import com.factql.service.FactQueryService;
import com.factql.store.FactStore;
import com.factql.store.QueryCancelledException;
import com.factql.store.QueryContext;
import com.factql.store.StorageException;
import com.factql.web.TraceIdFilter;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({FactsController.class, HealthController.class})
@Import({
        RequestValidator.class,
        QueryBuilder.class,
        ResultMaterializer.class,
        FactQueryService.class
})
class FactsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FactStore factStore;

    @Test
    void factsRejectsPost() throws Exception {
        mockMvc.perform(post("/api/facts"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("method not allowed"));
    }

    @Test
    void aggregateRejectsGet() throws Exception {
        mockMvc.perform(get("/api/facts/aggregate"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("method not allowed"));
    }

    @Test
    void timeseriesRejectsPost() throws Exception {
        mockMvc.perform(post("/api/facts/timeseries"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("method not allowed"));
    }

    @Test
    void aggregateRejectsMalformedJson() throws Exception {
        mockMvc.perform(post("/api/facts/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("invalid json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid request body"));

        verify(factStore, never()).query(any(), any(), any());
    }

    @Test
    void aggregateRejectsNonJsonContentType() throws Exception {
        mockMvc.perform(post("/api/facts/aggregate")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content("{\"group_by\":[\"event_type\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid request body"));

        verify(factStore, never()).query(any(), any(), any());
    }

    @Test
    void unacceptableResponseTypeIsAClientError() throws Exception {
        mockMvc.perform(get("/health").accept(MediaType.IMAGE_PNG))
                .andExpect(status().isBadRequest());
    }

    @Test
    void aggregateRejectsUnknownGroupByColumn() throws Exception {
        mockMvc.perform(post("/api/facts/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"group_by\":[\"invalid_column\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid group_by column: invalid_column"));

        verify(factStore, never()).query(any(), any(), any());
    }

    @Test
    void aggregateRejectsUnknownMetric() throws Exception {
        mockMvc.perform(post("/api/facts/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metrics\":[\"median\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid metric: median"));
    }

    @Test
    void aggregateReturnsRecordsInColumnOrder() throws Exception {
        MaterializedRecord record = MaterializedRecord.builder()
                .add("event_type", CellValue.text("click"))
                .add("sum", CellValue.floating(42.5))
                .add("count", CellValue.integer(3))
                .build();
        when(factStore.query(any(BuiltQuery.class), any(QueryContext.class), any())).thenReturn(List.of(record));

        mockMvc.perform(post("/api/facts/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"group_by\":[\"event_type\"],\"metrics\":[\"sum\",\"count\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].event_type").value("click"))
                .andExpect(jsonPath("$.data[0].sum").value(42.5))
                .andExpect(jsonPath("$.data[0].count").value(3));
    }

    @Test
    void emptyResultIsAnEmptyArray() throws Exception {
        when(factStore.query(any(BuiltQuery.class), any(QueryContext.class), any())).thenReturn(List.of());

        mockMvc.perform(get("/api/facts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(0)))
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void storeErrorIsReturnedVerbatim() throws Exception {
        when(factStore.query(any(BuiltQuery.class), any(QueryContext.class), any()))
                .thenThrow(new StorageException("Code: 60. DB::Exception: Table default.facts does not exist"));

        mockMvc.perform(post("/api/facts/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Code: 60. DB::Exception: Table default.facts does not exist"));
    }

    @Test
    void cancelledQueryIsAServerError() throws Exception {
        when(factStore.query(any(BuiltQuery.class), any(QueryContext.class), any()))
                .thenThrow(new QueryCancelledException(QueryContext.REASON_DEADLINE));

        mockMvc.perform(get("/api/facts").header(FactsController.TIMEOUT_HEADER, "10"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("query cancelled: deadline exceeded"));
    }

    @Test
    void timeseriesRequiresDates() throws Exception {
        mockMvc.perform(get("/api/facts/timeseries"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("date_from required"));

        mockMvc.perform(get("/api/facts/timeseries").param("date_from", "2024-01-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("date_to required"));

        verify(factStore, never()).query(any(), any(), any());
    }

    @Test
    void timeseriesReturnsPoints() throws Exception {
        MaterializedRecord record = MaterializedRecord.builder()
                .add("period", CellValue.text("2024-01-01T00:00:00"))
                .add("value", CellValue.floating(12.0))
                .build();
        when(factStore.query(any(BuiltQuery.class), any(QueryContext.class), any())).thenReturn(List.of(record));

        mockMvc.perform(get("/api/facts/timeseries")
                        .param("date_from", "2024-01-01")
                        .param("date_to", "2024-01-31")
                        .param("granularity", "day"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.data[0].period").value("2024-01-01T00:00:00"))
                .andExpect(jsonPath("$.data[0].value").value(12.0));
    }

    @Test
    void healthIsOkWhenStoreAnswers() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(header().exists(TraceIdFilter.TRACE_ID_HEADER));
    }

    @Test
    void healthIsUnavailableWhenStoreFails() throws Exception {
        doThrow(new StorageException("Connection refused")).when(factStore).ping();

        mockMvc.perform(get("/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("unhealthy"))
                .andExpect(jsonPath("$.error").value("Connection refused"));
    }
}
