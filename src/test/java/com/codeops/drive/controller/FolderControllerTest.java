package com.codeops.drive.controller;

import com.codeops.drive.config.RequestCorrelationFilter;
import com.codeops.drive.dto.request.CreateFolderRequest;
import com.codeops.drive.dto.request.RenameFolderRequest;
import com.codeops.drive.dto.response.BreadcrumbItemResponse;
import com.codeops.drive.dto.response.FolderDetailResponse;
import com.codeops.drive.dto.response.FolderResponse;
import com.codeops.drive.exception.ConflictException;
import com.codeops.drive.exception.NotFoundException;
import com.codeops.drive.security.JwtAuthFilter;
import com.codeops.drive.security.JwtTokenValidator;
import com.codeops.drive.security.RateLimitFilter;
import com.codeops.drive.service.FolderService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FolderController.class)
@Import(WebMvcTestSecurityConfig.class)
class FolderControllerTest {

    @Autowired MockMvc mockMvc;
    @Autowired ObjectMapper objectMapper;

    @MockBean FolderService folderService;

    @MockBean JwtAuthFilter jwtAuthFilter;
    @MockBean JwtTokenValidator jwtTokenValidator;
    @MockBean RateLimitFilter rateLimitFilter;
    @MockBean RequestCorrelationFilter requestCorrelationFilter;

    private static final UUID USER_ID = UUID.randomUUID();
    private static final UUID FOLDER_ID = UUID.randomUUID();
    private static final UUID PARENT_ID = UUID.randomUUID();
    private static final String BASE_URL = "/api/v1/drive/folders";

    private UsernamePasswordAuthenticationToken userAuth() {
        return new UsernamePasswordAuthenticationToken(USER_ID, "owner@codeops.dev",
                List.of(new SimpleGrantedAuthority("ROLE_MEMBER")));
    }

    // ─── listFolders ───

    @Test
    void listFolders_root_200() throws Exception {
        when(folderService.listFolders(USER_ID, null)).thenReturn(List.of(buildFolderResponse()));

        mockMvc.perform(get(BASE_URL).with(authentication(userAuth())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Reports"))
                .andExpect(jsonPath("$[0].path").value("/Documents/Reports"));
    }

    @Test
    void listFolders_literalNullParent_treatedAsRoot() throws Exception {
        when(folderService.listFolders(USER_ID, null)).thenReturn(List.of());

        mockMvc.perform(get(BASE_URL).param("parentId", "null").with(authentication(userAuth())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(folderService).listFolders(USER_ID, null);
    }

    @Test
    void listFolders_malformedParent_400() throws Exception {
        mockMvc.perform(get(BASE_URL).param("parentId", "not-a-uuid").with(authentication(userAuth())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value for parameter: parentId"));

        verifyNoInteractions(folderService);
    }

    @Test
    void listFolders_unauthenticated_401() throws Exception {
        mockMvc.perform(get(BASE_URL))
                .andExpect(status().isUnauthorized());
    }

    // ─── getFolder ───

    @Test
    void getFolder_returnsBreadcrumb() throws Exception {
        FolderDetailResponse detail = new FolderDetailResponse(buildFolderResponse(), List.of(
                new BreadcrumbItemResponse(PARENT_ID, "Documents"),
                new BreadcrumbItemResponse(FOLDER_ID, "Reports")));
        when(folderService.getFolderWithBreadcrumb(FOLDER_ID, USER_ID)).thenReturn(detail);

        mockMvc.perform(get(BASE_URL + "/" + FOLDER_ID).with(authentication(userAuth())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.folder.id").value(FOLDER_ID.toString()))
                .andExpect(jsonPath("$.breadcrumb.length()").value(2))
                .andExpect(jsonPath("$.breadcrumb[0].name").value("Documents"));
    }

    @Test
    void getFolder_notFound_404() throws Exception {
        when(folderService.getFolderWithBreadcrumb(FOLDER_ID, USER_ID))
                .thenThrow(new NotFoundException("Folder not found: " + FOLDER_ID));

        mockMvc.perform(get(BASE_URL + "/" + FOLDER_ID).with(authentication(userAuth())))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    // ─── createFolder ───

    @Test
    void createFolder_201() throws Exception {
        CreateFolderRequest request = new CreateFolderRequest("Reports", PARENT_ID);
        when(folderService.createFolder(eq(USER_ID), any())).thenReturn(buildFolderResponse());

        mockMvc.perform(post(BASE_URL)
                        .with(authentication(userAuth()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.parentId").value(PARENT_ID.toString()));
    }

    @Test
    void createFolder_blankName_400() throws Exception {
        mockMvc.perform(post(BASE_URL)
                        .with(authentication(userAuth()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(folderService);
    }

    @Test
    void createFolder_duplicate_409() throws Exception {
        when(folderService.createFolder(eq(USER_ID), any()))
                .thenThrow(new ConflictException("A folder named 'Reports' already exists here"));

        mockMvc.perform(post(BASE_URL)
                        .with(authentication(userAuth()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Reports\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("A folder named 'Reports' already exists here"));
    }

    // ─── renameFolder ───

    @Test
    void renameFolder_200() throws Exception {
        when(folderService.renameFolder(FOLDER_ID, USER_ID, "Q3")).thenReturn(buildFolderResponse());

        mockMvc.perform(patch(BASE_URL + "/" + FOLDER_ID)
                        .with(authentication(userAuth()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RenameFolderRequest("Q3"))))
                .andExpect(status().isOk());

        verify(folderService).renameFolder(FOLDER_ID, USER_ID, "Q3");
    }

    // ─── deleteFolder ───

    @Test
    void deleteFolder_returnsMessage() throws Exception {
        mockMvc.perform(delete(BASE_URL + "/" + FOLDER_ID).with(authentication(userAuth())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Folder deleted successfully"));

        verify(folderService).deleteFolder(FOLDER_ID, USER_ID);
    }

    @Test
    void deleteFolder_notOwned_404() throws Exception {
        doThrow(new NotFoundException("Folder not found: " + FOLDER_ID))
                .when(folderService).deleteFolder(FOLDER_ID, USER_ID);

        mockMvc.perform(delete(BASE_URL + "/" + FOLDER_ID).with(authentication(userAuth())))
                .andExpect(status().isNotFound());
    }

    private FolderResponse buildFolderResponse() {
        return new FolderResponse(FOLDER_ID, "Reports", PARENT_ID, "/Documents/Reports",
                Instant.now(), Instant.now());
    }
}
