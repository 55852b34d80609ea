package com.tsl.search.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tsl.search.ingest.DocumentState;
import com.tsl.search.ingest.DocumentStatus;
import com.tsl.search.ingest.IndexBootstrap;
import com.tsl.search.ingest.IndexingPipeline;
import com.tsl.search.ingest.IndexingReport;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(IndexAdminController.class)
class IndexAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IndexingPipeline indexingPipeline;

    @MockBean
    private IndexBootstrap indexBootstrap;

    @Test
    void rebuildReturnsReport() throws Exception {
        when(indexingPipeline.rebuild()).thenReturn(new IndexingReport(List.of(
            new DocumentStatus("a", DocumentState.INDEXED, null, 1L),
            new DocumentStatus("b", DocumentState.INDEXED, null, 1L)
        ), 7L));

        mockMvc.perform(post("/internal/index/rebuild"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.indexed").value(2))
            .andExpect(jsonPath("$.failed").value(0));
    }

    @Test
    void snapshotReportsSavedCount() throws Exception {
        when(indexBootstrap.saveSnapshot()).thenReturn(4);

        mockMvc.perform(post("/internal/index/snapshot"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.documents").value(4));
    }

    @Test
    void snapshotFailureIsInternalError() throws Exception {
        when(indexBootstrap.saveSnapshot()).thenThrow(new IllegalStateException("disk full"));

        mockMvc.perform(post("/internal/index/snapshot"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error.code").value("internal_error"));
    }
}
