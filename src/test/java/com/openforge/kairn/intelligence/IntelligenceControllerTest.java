package com.openforge.kairn.intelligence;

import com.openforge.kairn.domain.Confidence;
import com.openforge.kairn.domain.ExperienceType;
import com.openforge.kairn.domain.KnowledgeNode;
import com.openforge.kairn.experience.ExperienceService;
import com.openforge.kairn.graph.GraphService;
import com.openforge.kairn.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class IntelligenceControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private GraphService graphService;

    @Autowired
    private ExperienceService experienceService;

    @Test
    void learn_reportsRoutingDecision() throws Exception {
        mockMvc.perform(post("/api/intel/learn")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content": "Use read replicas for reporting queries",
                                 "type": "pattern", "confidence": "high", "tags": ["postgres"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.stored_as").value("node"))
                .andExpect(jsonPath("$.node_id").isNumber())
                .andExpect(jsonPath("$.experience_id").isNumber())
                .andExpect(jsonPath("$.type").value("pattern"))
                .andExpect(jsonPath("$.confidence").value("high"))
                .andExpect(jsonPath("$.link").value("derived-from"));

        mockMvc.perform(post("/api/intel/learn")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"Maybe the cache is stale\", \"type\": \"gotcha\", \"confidence\": \"low\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.stored_as").value("experience"))
                .andExpect(jsonPath("$.node_id").doesNotExist());
    }

    @Test
    void learn_unknownTypeIsInvalidArgument() throws Exception {
        mockMvc.perform(post("/api/intel/learn")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"something\", \"type\": \"rumor\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("InvalidArgument"))
                .andExpect(jsonPath("$.message").value(containsString("rumor")));
    }

    @Test
    void recall_returnsMergedItems() throws Exception {
        graphService.addNode("Blue green deployment", "pattern", null, null, null);

        mockMvc.perform(get("/api/intel/recall").param("topic", "deployment"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.items[0].source").value("node"))
                .andExpect(jsonPath("$.items[0].workspace").doesNotExist());
    }

    @Test
    void crossref_requiresProblem() throws Exception {
        mockMvc.perform(get("/api/intel/crossref"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("InvalidArgument"));
    }

    @Test
    void context_summaryThenFull() throws Exception {
        graphService.addNode("Database caching", "pattern", null, "cache aside", null);
        experienceService.save("Database caching hid a stale read", ExperienceType.GOTCHA, "reporting",
                Confidence.LOW, List.of("staleness"));

        mockMvc.perform(get("/api/intel/context").param("keywords", "database caching"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.detail").value("summary"))
                .andExpect(jsonPath("$.source").value("router"))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.nodes[0].name").value("Database caching"))
                .andExpect(jsonPath("$.nodes[0].description").doesNotExist())
                .andExpect(jsonPath("$.experiences[0].type").value("gotcha"))
                .andExpect(jsonPath("$.experiences[0].content").value("Database caching hid a stale read"))
                .andExpect(jsonPath("$.experiences[0].confidence").doesNotExist());

        mockMvc.perform(get("/api/intel/context").param("keywords", "database caching").param("detail", "full"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.detail").value("full"))
                .andExpect(jsonPath("$.nodes[0].description").value("cache aside"))
                .andExpect(jsonPath("$.nodes[0].edges", hasSize(0)))
                .andExpect(jsonPath("$.experiences[0].confidence").value("low"))
                .andExpect(jsonPath("$.experiences[0].context").value("reporting"))
                .andExpect(jsonPath("$.experiences[0].tags[0]").value("staleness"));
    }

    @Test
    void related_returnsHitsWithDepth() throws Exception {
        KnowledgeNode a = graphService.addNode("Gateway", "service", null, null, null);
        KnowledgeNode b = graphService.addNode("Billing", "service", null, null, null);
        graphService.connect(a.getId(), b.getId(), "calls", 0.9);

        mockMvc.perform(get("/api/intel/related").param("node_id", a.getId().toString()).param("depth", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.nodes[1].depth").value(1))
                .andExpect(jsonPath("$.nodes[1].via_edge_type").value("calls"));
    }

    @Test
    void related_depthOutOfRangeIsInvalidArgument() throws Exception {
        KnowledgeNode a = graphService.addNode("Gateway", "service", null, null, null);

        mockMvc.perform(get("/api/intel/related").param("node_id", a.getId().toString()).param("depth", "9"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("InvalidArgument"));
    }
}
