package com.example.programmers.security;

import com.example.programmers.repository.ProgrammerRepository;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Exercises the cookie-to-header token exchange the Angular client performs, without the
 * test post-processor that bypasses it.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_CLASS)
class XsrfCookieTest {
    private static final String COOKIE = "XSRF-TOKEN";
    private static final String HEADER = "X-XSRF-TOKEN";
    private static final String BODY = "{\"name\": \"Ada\", \"age\": 36, \"password\": \"analytical\"}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ProgrammerRepository programmerRepository;

    @BeforeEach
    void cleanDatabase() {
        programmerRepository.deleteAll();
    }

    private Cookie fetchTokenCookie() throws Exception {
        MvcResult result = mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andReturn();
        Cookie cookie = result.getResponse().getCookie(COOKIE);
        assertThat(cookie).isNotNull();
        return cookie;
    }

    @Test
    void pageResponse_setsScriptReadableTokenCookie() throws Exception {
        Cookie cookie = fetchTokenCookie();

        assertThat(cookie.getValue()).isNotBlank();
        assertThat(cookie.isHttpOnly()).isFalse();
        assertThat(cookie.getPath()).isEqualTo("/");
    }

    @Test
    void apiRead_alsoSetsTokenCookie() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/programmers"))
                .andExpect(status().isOk())
                .andReturn();

        assertThat(result.getResponse().getCookie(COOKIE)).isNotNull();
    }

    @Test
    void write_withCookieEchoedInHeader_isAccepted() throws Exception {
        Cookie cookie = fetchTokenCookie();

        mockMvc.perform(post("/api/programmers")
                        .cookie(cookie)
                        .header(HEADER, cookie.getValue())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isCreated());

        assertThat(programmerRepository.count()).isEqualTo(1);
    }

    @Test
    void formWrite_withTokenAsParameter_isAccepted() throws Exception {
        Cookie cookie = fetchTokenCookie();

        mockMvc.perform(post("/api/programmers")
                        .cookie(cookie)
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("_csrf", cookie.getValue())
                        .param("name", "Ada")
                        .param("age", "36")
                        .param("password", "analytical"))
                .andExpect(status().isCreated());
    }

    @Test
    void write_withMismatchedHeader_isRejected() throws Exception {
        Cookie cookie = fetchTokenCookie();

        mockMvc.perform(post("/api/programmers")
                        .cookie(cookie)
                        .header(HEADER, "forged-" + cookie.getValue())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value(JsonAccessDeniedHandler.CSRF_MESSAGE));

        assertThat(programmerRepository.count()).isZero();
    }

    @Test
    void write_withHeaderButNoCookie_isRejected() throws Exception {
        mockMvc.perform(post("/api/programmers")
                        .header(HEADER, "some-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isForbidden());
    }
}
