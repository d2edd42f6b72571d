package com.example.redislens.presentation.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Redis 서버 없이 확인할 수 있는 에러 응답 테스트
 */
@SpringBootTest(properties = {
        "redis-lens.connection.host=127.0.0.1",
        "redis-lens.connection.port=1",
        "redis-lens.connection.connect-timeout=1s"
})
@AutoConfigureMockMvc
class RedisExplorerControllerErrorTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("서버에 연결할 수 없으면 503 CONNECTIVITY")
    void unreachableServerTest() throws Exception {
        mockMvc.perform(post("/api/keys"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503))
                .andExpect(jsonPath("$.error_code").value("CONNECTIVITY"))
                .andExpect(jsonPath("$.message").value("Could not connect to Redis server"));
    }

    @Test
    @DisplayName("페이지 인자는 연결 전에 검증")
    void pageValidatedBeforeConnectingTest() throws Exception {
        mockMvc.perform(post("/api/keys").param("per_page", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.message").value("Per page must be at least 1: 0"));
    }

    @Test
    @DisplayName("잘못된 포트 파라미터는 400")
    void invalidPortTest() throws Exception {
        mockMvc.perform(post("/api/ping").param("port", "70000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("빈 키 목록 삭제 요청은 400")
    void emptyBulkDeleteTest() throws Exception {
        mockMvc.perform(post("/api/keys/delete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keys\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No keys provided"));
    }

    @Test
    @DisplayName("잘못된 JSON 본문은 400")
    void malformedBodyTest() throws Exception {
        mockMvc.perform(post("/api/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    @DisplayName("지원하지 않는 메서드는 405")
    void methodNotAllowedTest() throws Exception {
        mockMvc.perform(get("/api/ping"))
                .andExpect(status().isMethodNotAllowed());
    }
}
