package com.williamcallahan.wikimark;

import com.williamcallahan.wikimark.service.markdown.MarkdownConversionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class WikimarkApplicationTests {

    @Autowired
    MarkdownConversionService conversionService;

    @Test
    void contextLoads() {
        assertTrue(conversionService.convert("```math\nx\n```\n").contains("<div class=\"arithmatex\">x</div>"));
    }
}
