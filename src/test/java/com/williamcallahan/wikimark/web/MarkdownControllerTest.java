package com.williamcallahan.wikimark.web;

import com.williamcallahan.wikimark.config.AppProperties;
import com.williamcallahan.wikimark.service.markdown.MarkdownConversionService;
import com.williamcallahan.wikimark.service.math.MathImageFormat;
import com.williamcallahan.wikimark.service.math.MathRasterizer;
import com.williamcallahan.wikimark.service.math.MathRenderingException;
import com.williamcallahan.wikimark.service.math.MathRenderingUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Verifies the markdown and math endpoints and their error mapping.
 */
@WebMvcTest(controllers = MarkdownController.class)
@Import({ExceptionResponseBuilder.class, AppProperties.class})
class MarkdownControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    MarkdownConversionService conversionService;

    @MockBean
    MathRasterizer mathRasterizer;

    @Test
    void rendersMarkdown() throws Exception {
        when(conversionService.convert("# Hi")).thenReturn("<h1>Hi</h1>\n");

        mvc.perform(post("/api/markdown/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"# Hi\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.html").value("<h1>Hi</h1>\n"))
            .andExpect(jsonPath("$.source").value("server"));
    }

    @Test
    void blankContentSkipsConversion() throws Exception {
        mvc.perform(post("/api/markdown/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"   \"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.html").value(""));

        verify(conversionService, never()).convert(anyString());
    }

    @Test
    void conversionFailureReturnsServerError() throws Exception {
        when(conversionService.convert(anyString())).thenThrow(new IllegalStateException("boom"));

        mvc.perform(post("/api/markdown/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"text\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Failed to render markdown"))
            .andExpect(jsonPath("$.details").value("boom"));
    }

    @Test
    void rendersMathWithConfiguredDefaults() throws Exception {
        byte[] image = {(byte) 0x89, 'P', 'N', 'G'};
        when(mathRasterizer.renderMath("x^2", MathImageFormat.PNG, 100, 12)).thenReturn(image);

        mvc.perform(post("/api/markdown/math")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expression\":\"x^2\"}"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.IMAGE_PNG))
            .andExpect(content().bytes(image));
    }

    @Test
    void rendersSvgWithRequestedParameters() throws Exception {
        byte[] svg = "<svg/>".getBytes(java.nio.charset.StandardCharsets.UTF_8);
        when(mathRasterizer.renderMath("a", MathImageFormat.SVG, 200, 14)).thenReturn(svg);

        mvc.perform(post("/api/markdown/math")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expression\":\"a\",\"format\":\"svg\",\"dpi\":200,\"fontSize\":14}"))
            .andExpect(status().isOk())
            .andExpect(content().contentType("image/svg+xml"))
            .andExpect(content().bytes(svg));
    }

    @Test
    void missingBackendReturnsServiceUnavailable() throws Exception {
        when(mathRasterizer.renderMath(anyString(), any(), anyInt(), anyInt()))
            .thenThrow(new MathRenderingUnavailableException("install jlatexmath"));

        mvc.perform(post("/api/markdown/math")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expression\":\"x\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("Math rendering unavailable"))
            .andExpect(jsonPath("$.details").value("install jlatexmath"));
    }

    @Test
    void invalidExpressionReturnsBadRequest() throws Exception {
        when(mathRasterizer.renderMath(anyString(), any(), anyInt(), anyInt()))
            .thenThrow(new MathRenderingException("Invalid math expression"));

        mvc.perform(post("/api/markdown/math")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expression\":\"\\\\frac{\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unknownFormatReturnsBadRequestWithoutRendering() throws Exception {
        mvc.perform(post("/api/markdown/math")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expression\":\"x\",\"format\":\"gif\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid math rendering request"));

        verify(mathRasterizer, never()).renderMath(anyString(), any(), anyInt(), anyInt());
    }
}
