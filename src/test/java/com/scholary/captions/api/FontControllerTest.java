package com.scholary.captions.api;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.captions.fonts.FontCatalog;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(FontController.class)
class FontControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private FontCatalog fontCatalog;

  @Test
  void listFonts_shouldReturnCatalogNames() throws Exception {
    when(fontCatalog.availableFontNames()).thenReturn(List.of("Arial", "Roboto"));

    mockMvc
        .perform(get("/api/fonts"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0]").value("Arial"))
        .andExpect(jsonPath("$[1]").value("Roboto"));
  }

  @Test
  void refreshFonts_shouldInvalidateBeforeListing() throws Exception {
    when(fontCatalog.availableFontNames()).thenReturn(List.of("Arial"));

    mockMvc.perform(post("/api/fonts/refresh")).andExpect(status().isOk());

    InOrder order = inOrder(fontCatalog);
    order.verify(fontCatalog).invalidate();
    order.verify(fontCatalog).availableFontNames();
  }
}
