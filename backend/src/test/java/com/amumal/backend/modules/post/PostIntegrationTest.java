package com.amumal.backend.modules.post;

import static com.amumal.backend.support.TestAccounts.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import com.amumal.backend.support.AbstractPostgresIntegrationTest;
import com.amumal.backend.support.TestAccounts;
import com.amumal.backend.support.TestAccounts.LoggedInUser;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class PostIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void createPostAndCommentThenReadThemPublicly() throws Exception {
        LoggedInUser author = TestAccounts.registerAndLogin(mockMvc, objectMapper);

        MvcResult created = mockMvc.perform(post("/v1/posts")
                        .header(HttpHeaders.AUTHORIZATION, author.bearer())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("title", "첫 글", "content", "안녕하세요"))))
                .andExpect(status().isCreated())
                .andExpect(header().exists(HttpHeaders.LOCATION))
                .andExpect(jsonPath("$.authorNickname").value(author.nickname()))
                .andReturn();
        long postId = objectMapper.readTree(created.getResponse().getContentAsString()).path("id").asLong();

        MvcResult comment = mockMvc.perform(post("/v1/posts/" + postId + "/comments")
                        .header(HttpHeaders.AUTHORIZATION, author.bearer())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("content", "첫 댓글"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.postId").value(postId))
                .andReturn();
        long commentId = objectMapper.readTree(comment.getResponse().getContentAsString()).path("id").asLong();

        mockMvc.perform(get("/v1/posts/" + postId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("첫 글"));
        mockMvc.perform(get("/v1/posts/" + postId + "/comments/" + commentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("첫 댓글"));
    }

    @Test
    void writingRequiresAuthentication() throws Exception {
        mockMvc.perform(post("/v1/posts")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("title", "t", "content", "c"))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void commentOnMissingPostIsNotFound() throws Exception {
        LoggedInUser author = TestAccounts.registerAndLogin(mockMvc, objectMapper);

        mockMvc.perform(post("/v1/posts/987654321/comments")
                        .header(HttpHeaders.AUTHORIZATION, author.bearer())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("content", "허공에 댓글"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("post_not_found"));
    }

    @Test
    void blankTitleIsRejected() throws Exception {
        LoggedInUser author = TestAccounts.registerAndLogin(mockMvc, objectMapper);

        mockMvc.perform(post("/v1/posts")
                        .header(HttpHeaders.AUTHORIZATION, author.bearer())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("title", " ", "content", "c"))))
                .andExpect(status().isUnprocessableEntity());
    }
}
