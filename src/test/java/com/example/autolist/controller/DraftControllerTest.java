package com.example.autolist.controller;

import com.example.autolist.client.ItemClassifier;
import com.example.autolist.client.MarketplaceClient;
import com.example.autolist.domain.Draft;
import com.example.autolist.repository.DraftRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DraftControllerTest {

    private static final String OWNER_HEADER = "X-Owner-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DraftRepository draftRepository;

    @MockBean
    private ItemClassifier itemClassifier;

    @MockBean
    private MarketplaceClient marketplaceClient;

    @BeforeEach
    void setup() {
        draftRepository.deleteAll();
    }

    @Test
    void listIsScopedToOwnerAndFilterable() throws Exception {
        draftRepository.save(draft("owner-1", "Wool Coat", Draft.DraftStatus.READY));
        draftRepository.save(draft("owner-1", "Silk Scarf", Draft.DraftStatus.PENDING));
        draftRepository.save(draft("owner-2", "Leather Bag", Draft.DraftStatus.READY));

        mockMvc.perform(get("/api/drafts").header(OWNER_HEADER, "owner-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total", is(2)))
                .andExpect(jsonPath("$.drafts", hasSize(2)));

        mockMvc.perform(get("/api/drafts").header(OWNER_HEADER, "owner-1").param("status", "pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.drafts[*].title", contains("Silk Scarf")));

        mockMvc.perform(get("/api/drafts").header(OWNER_HEADER, "owner-1").param("status", "archived"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("VALIDATION_ERROR")));
    }

    @Test
    void otherOwnersDraftIsNotFound() throws Exception {
        Draft saved = draftRepository.save(draft("owner-2", "Leather Bag", Draft.DraftStatus.READY));

        mockMvc.perform(get("/api/drafts/{id}", saved.getId()).header(OWNER_HEADER, "owner-1"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/drafts/{id}", saved.getId()).header(OWNER_HEADER, "owner-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title", is("Leather Bag")));
    }

    @Test
    void patchFixesFallbackDraftAndRecomputesReadiness() throws Exception {
        Draft fallback = draft("owner-1", "확인 필요 상품", Draft.DraftStatus.PENDING);
        fallback.setFallback(true);
        fallback.getHashtags().clear();
        Draft saved = draftRepository.save(fallback);

        mockMvc.perform(patch("/api/drafts/{id}", saved.getId())
                        .header(OWNER_HEADER, "owner-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Barbour Wax Jacket\",\"price\":120,"
                                + "\"hashtags\":[\"#barbour\",\"#wax\",\"#jacket\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title", is("Barbour Wax Jacket")))
                .andExpect(jsonPath("$.fallback", is(false)))
                .andExpect(jsonPath("$.publishReady", is(true)))
                .andExpect(jsonPath("$.status", is("ready")))
                .andExpect(jsonPath("$.priceSuggestion.target", is(120.0)));
    }

    @Test
    void publishedDraftCannotBeEdited() throws Exception {
        Draft saved = draftRepository.save(draft("owner-1", "Wool Coat", Draft.DraftStatus.PUBLISHED));

        mockMvc.perform(patch("/api/drafts/{id}", saved.getId())
                        .header(OWNER_HEADER, "owner-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Changed\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code", is("INVALID_STATE")));
    }

    @Test
    void deleteRemovesDraft() throws Exception {
        Draft saved = draftRepository.save(draft("local", "Wool Coat", Draft.DraftStatus.READY));

        mockMvc.perform(delete("/api/drafts/{id}", saved.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok", is(true)));
        mockMvc.perform(get("/api/drafts/{id}", saved.getId()))
                .andExpect(status().isNotFound());
    }

    private static Draft draft(String owner, String title, Draft.DraftStatus status) {
        return Draft.builder()
                .ownerId(owner)
                .title(title)
                .price(new BigDecimal("40.00"))
                .brand("Brand")
                .category("Outer")
                .photos(new ArrayList<>(List.of("/p/" + title.hashCode() + ".jpg")))
                .hashtags(new ArrayList<>(List.of("#a", "#b", "#c")))
                .status(status)
                .build();
    }
}
