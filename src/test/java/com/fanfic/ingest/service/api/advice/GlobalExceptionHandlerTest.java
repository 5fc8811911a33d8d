package com.fanfic.ingest.service.api.advice;

import com.fanfic.ingest.service.api.controller.WatcherController;
import com.fanfic.ingest.service.config.FolderWatcherConfig;
import com.fanfic.ingest.service.ingest.FolderWatcher;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GlobalExceptionHandlerTest {

    @Test
    void unexpectedFailureIsWrappedInErrorEnvelope() throws Exception {
        FolderWatcher folderWatcher = mock(FolderWatcher.class);
        when(folderWatcher.isRunning()).thenThrow(new IllegalStateException("watcher state unavailable"));
        FolderWatcherConfig config = new FolderWatcherConfig();
        config.setFolderPath("/tmp/urls");
        MockMvc mockMvc = MockMvcBuilders
                .standaloneSetup(new WatcherController(folderWatcher, config))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        mockMvc.perform(get("/watcher"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.error.message").value("An unexpected error occurred"));
    }
}
