package com.teamA.cra.api.auth;

import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.Role;
import com.teamA.cra.common.notification.recipient.DirectoryUser;
import com.teamA.cra.common.notification.recipient.RecipientDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuthControllerTest {

    private RecipientDirectory directory;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        directory = mock(RecipientDirectory.class);
        when(directory.findById(anyString())).thenReturn(Optional.empty());
        when(directory.findByEmail(anyString())).thenReturn(Optional.empty());
        JwtProvider provider = new JwtProvider("test-secret-test-secret-test-secret-0123456789", 3600, () -> 1_792_310_400_000L);
        mockMvc = MockMvcBuilders.standaloneSetup(new AuthController(provider, directory)).build();
    }

    @Test
    void shouldIssueTokenByUserId() throws Exception {
        when(directory.findById("u-sales")).thenReturn(Optional.of(
                new DirectoryUser("u-sales", "sales@cra.example", "Sam", Role.SALES, NotificationLanguage.EN, true)));

        mockMvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON).content("{\"login\":\" u-sales \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.userId").value("u-sales"))
                .andExpect(jsonPath("$.role").value("sales"))
                .andExpect(jsonPath("$.accessToken").isNotEmpty());
    }

    @Test
    void shouldIssueTokenByEmail() throws Exception {
        when(directory.findByEmail("ada@cra.example")).thenReturn(Optional.of(
                new DirectoryUser("u-admin", "ada@cra.example", "Ada", Role.ADMIN, NotificationLanguage.FR, true)));

        mockMvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON).content("{\"login\":\"ada@cra.example\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("admin"));
    }

    @Test
    void shouldRejectInactiveOrUnknownUser() throws Exception {
        when(directory.findById("u-gone")).thenReturn(Optional.of(
                new DirectoryUser("u-gone", "gone@cra.example", "Gone", Role.SALES, NotificationLanguage.EN, false)));

        mockMvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON).content("{\"login\":\"u-gone\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("unauthorized"));
        mockMvc.perform(post("/auth/login").contentType(MediaType.APPLICATION_JSON).content("{\"login\":\"nobody\"}"))
                .andExpect(status().isUnauthorized());
    }
}
