package com.ccflow.analyzer.controller;

import com.ccflow.analyzer.config.FlowAnalyzerProperties;
import com.ccflow.analyzer.correlate.DefaultServiceKeyStrategy;
import com.ccflow.analyzer.correlate.FlowGraphBuilder;
import com.ccflow.analyzer.parser.ContactLogParser;
import com.ccflow.analyzer.parser.FlowGraphCodec;
import com.ccflow.analyzer.parser.JsonSupport;
import com.ccflow.analyzer.parser.TraceDocumentParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.ByteArrayHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.io.InputStream;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AnalyzeControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = JsonSupport.newMapper();
        AnalyzeController controller = new AnalyzeController(
                new ContactLogParser(mapper),
                new TraceDocumentParser(mapper),
                new FlowGraphBuilder(new FlowAnalyzerProperties(), new DefaultServiceKeyStrategy()),
                new FlowGraphCodec(mapper));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setMessageConverters(new ByteArrayHttpMessageConverter(), new MappingJackson2HttpMessageConverter(mapper))
                .build();
    }

    @Test
    void analyzesUploadedLogs() throws Exception {
        mockMvc.perform(multipart("/api/analyze/logs").file(upload("contact-logs.json")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.graph.nodes.length()").value(5))
                .andExpect(jsonPath("$.graph.edges.length()").value(4))
                .andExpect(jsonPath("$.graph.nodes[0].payload.kind").value("log"))
                .andExpect(jsonPath("$.graph.nodes[0].targetPort").value("left"))
                .andExpect(jsonPath("$.graph.nodes[1].payload.isError").value(true))
                .andExpect(jsonPath("$.summary.inputCount").value(10))
                .andExpect(jsonPath("$.summary.startTime").value("2024-03-01T10:00:00Z"));
    }

    @Test
    void flowViewReturnsChunks() throws Exception {
        mockMvc.perform(multipart("/api/analyze/logs").file(upload("contact-logs.json")).param("view", "flow"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.graph.nodes[0].id").value("Main_1"))
                .andExpect(jsonPath("$.graph.nodes[1].id").value("Billing_1"));
    }

    @Test
    void brokenLinesComeBackAsDiagnoses() throws Exception {
        mockMvc.perform(multipart("/api/analyze/logs").file(upload("contact-logs.ndjson")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.graph.nodes.length()").value(2))
                .andExpect(jsonPath("$.diagnoses[0].type").value("LOG_LINE"));
    }

    @Test
    void analyzesUploadedTrace() throws Exception {
        mockMvc.perform(multipart("/api/analyze/trace").file(upload("xray-trace.json")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.graph.nodes[0].id").value("seg1"))
                .andExpect(jsonPath("$.graph.nodes[0].payload.kind").value("trace"))
                .andExpect(jsonPath("$.graph.edges[2].isErrorPath").value(true))
                .andExpect(jsonPath("$.summary.operations[0]").value("Operation 1: GetItem customers"));
    }

    @Test
    void exportsAndReimportsGraphFile() throws Exception {
        byte[] exported = mockMvc.perform(multipart("/api/analyze/logs/export").file(upload("contact-logs.json")))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("attachment")))
                .andReturn().getResponse().getContentAsByteArray();

        mockMvc.perform(multipart("/api/analyze/import")
                        .file(new MockMultipartFile("file", "graph.json", "application/json", exported)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes.length()").value(5))
                .andExpect(jsonPath("$.edges[0].id").value("edge_0_1"));
    }

    private static MockMultipartFile upload(String fixture) throws IOException {
        try (InputStream in = AnalyzeControllerTest.class.getResourceAsStream("/fixtures/" + fixture)) {
            return new MockMultipartFile("file", fixture, "application/json", in);
        }
    }
}
