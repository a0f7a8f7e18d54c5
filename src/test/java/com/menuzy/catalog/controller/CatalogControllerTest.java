package com.menuzy.catalog.controller;

import com.menuzy.catalog.dto.AssignedIds;
import com.menuzy.catalog.dto.CatalogBatch;
import com.menuzy.catalog.dto.EntityType;
import com.menuzy.catalog.dto.LoadError;
import com.menuzy.catalog.dto.LoadResult;
import com.menuzy.catalog.service.CatalogLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CatalogController.class)
class CatalogControllerTest {

    private static final String BATCH = """
            {
              "users": [{"ref": "john", "email": "john@pizzapalace.com", "full_name": "John Smith",
                         "role": "restaurant_admin"}],
              "restaurants": [{"ref": "palace", "name": "Pizza Palace", "address": "123 Main St",
                               "category_id": 4, "owner_ref": "john",
                               "opening_hours": {"monday": "11:00-22:00"}}],
              "menu_categories": [{"ref": "pizzas", "restaurant_ref": "palace", "name": "Pizzas",
                                   "display_order": 1}],
              "menu_items": [{"restaurant_ref": "palace", "menu_category_ref": "pizzas", "name": "Margherita",
                              "price": {"small": 12.99}, "is_vegetarian": true, "display_order": 1}]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CatalogLoader catalogLoader;

    @Test
    @DisplayName("커밋된 로드는 201과 생성된 id")
    void load_Committed_Returns201() throws Exception {
        AssignedIds ids = new AssignedIds(List.of(1L), List.of(2L), List.of(3L), List.of(4L),
                Map.of("john", 1L, "palace", 2L, "pizzas", 3L));
        given(catalogLoader.load(any(CatalogBatch.class))).willReturn(LoadResult.committed(ids));

        mockMvc.perform(post("/api/catalog/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BATCH))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.ok").value(true))
                .andExpect(jsonPath("$.data.status").value("COMMITTED"))
                .andExpect(jsonPath("$.data.ids.menu_categories[0]").value(3))
                .andExpect(jsonPath("$.data.ids.refs.palace").value(2));

        ArgumentCaptor<CatalogBatch> batch = ArgumentCaptor.forClass(CatalogBatch.class);
        verify(catalogLoader).load(batch.capture());
        assertThat(batch.getValue().users().get(0).fullName()).isEqualTo("John Smith");
        assertThat(batch.getValue().restaurants().get(0).ownerRef()).isEqualTo("john");
        assertThat(batch.getValue().restaurants().get(0).categoryId()).isEqualTo(4L);
        assertThat(batch.getValue().menuItems().get(0).vegetarian()).isTrue();
        assertThat(batch.getValue().menuItems().get(0).menuCategoryRef()).isEqualTo("pizzas");
    }

    @Test
    @DisplayName("timeout_seconds를 주면 그 시간으로 로드")
    void load_WithTimeout_PassesDuration() throws Exception {
        given(catalogLoader.load(any(CatalogBatch.class), eq(Duration.ofSeconds(5))))
                .willReturn(LoadResult.committed(new AssignedIds(List.of(), List.of(), List.of(), List.of(), Map.of())));

        mockMvc.perform(post("/api/catalog/batches")
                        .param("timeout_seconds", "5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isCreated());

        verify(catalogLoader).load(any(CatalogBatch.class), eq(Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("검증 오류는 422와 오류 목록")
    void load_ValidationErrors_Returns422() throws Exception {
        given(catalogLoader.load(any(CatalogBatch.class))).willReturn(LoadResult.rejected(List.of(
                LoadError.validation(EntityType.RESTAURANT, 0, "owner_id", "not found"))));

        mockMvc.perform(post("/api/catalog/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BATCH))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data.status").value("REJECTED"))
                .andExpect(jsonPath("$.data.errors[0].kind").value("VALIDATION"))
                .andExpect(jsonPath("$.data.errors[0].entity").value("RESTAURANT"))
                .andExpect(jsonPath("$.data.errors[0].field").value("owner_id"))
                .andExpect(jsonPath("$.data.errors[0].reason").value("not found"));
    }

    @Test
    @DisplayName("저장소 충돌은 409")
    void load_StoreError_Returns409() throws Exception {
        given(catalogLoader.load(any(CatalogBatch.class)))
                .willReturn(LoadResult.rolledBack(LoadError.store("constraint violated: uk_users_email")));

        mockMvc.perform(post("/api/catalog/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BATCH))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.data.status").value("ROLLED_BACK"))
                .andExpect(jsonPath("$.data.errors[0].kind").value("STORE"))
                .andExpect(jsonPath("$.data.errors[0].index").doesNotExist());
    }

    @Test
    @DisplayName("타임아웃은 504")
    void load_Timeout_Returns504() throws Exception {
        given(catalogLoader.load(any(CatalogBatch.class)))
                .willReturn(LoadResult.rolledBack(LoadError.timeout("load exceeded its timeout of PT30S")));

        mockMvc.perform(post("/api/catalog/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BATCH))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.data.errors[0].kind").value("TIMEOUT"));
    }

    @Test
    @DisplayName("0 이하 timeout_seconds는 400")
    void load_NonPositiveTimeout_Returns400() throws Exception {
        mockMvc.perform(post("/api/catalog/batches")
                        .param("timeout_seconds", "0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BATCH))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://menuzy.com/errors/invalid_input"));

        verifyNoInteractions(catalogLoader);
    }

    @Test
    @DisplayName("깨진 JSON 본문은 400")
    void load_MalformedBody_Returns400() throws Exception {
        mockMvc.perform(post("/api/catalog/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"users\": [{\"email\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://menuzy.com/errors/invalid_input"))
                .andExpect(jsonPath("$.detail").value("Malformed request body"));

        verifyNoInteractions(catalogLoader);
    }
}
