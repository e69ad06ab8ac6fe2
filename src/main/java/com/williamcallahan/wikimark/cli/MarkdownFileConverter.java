package com.williamcallahan.wikimark.cli;

import com.williamcallahan.wikimark.WikimarkApplication;
import com.williamcallahan.wikimark.service.markdown.MarkdownConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts one markdown file into an HTML fragment file.
 *
 * <pre>{@code
 * java -cp wikimark.jar com.williamcallahan.wikimark.cli.MarkdownFileConverter \
 *     --input=page.md --output=page.html
 * }</pre>
 */
public final class MarkdownFileConverter {
    private static final Logger log = LoggerFactory.getLogger(MarkdownFileConverter.class);

    private static final String INPUT_OPTION = "input";
    private static final String OUTPUT_OPTION = "output";
    private static final int EXIT_USAGE = 2;
    private static final int EXIT_FAILURE = 1;

    private MarkdownFileConverter() {}

    public static void main(String[] args) {
        ApplicationArguments arguments = new DefaultApplicationArguments(args);
        Path input = requiredPath(arguments, INPUT_OPTION);
        Path output = requiredPath(arguments, OUTPUT_OPTION);
        if (input == null || output == null) {
            log.error("Usage: MarkdownFileConverter --input=<file.md> --output=<file.html>");
            System.exit(EXIT_USAGE);
            return;
        }

        System.setProperty("java.awt.headless", "true");
        try (ConfigurableApplicationContext context = new SpringApplicationBuilder(WikimarkApplication.class)
                .web(WebApplicationType.NONE)
                .logStartupInfo(false)
                .run()) {
            convertFile(context.getBean(MarkdownConversionService.class), input, output);
        } catch (IOException ioException) {
            log.error("Failed to convert {}: {}", input, ioException.getMessage());
            System.exit(EXIT_FAILURE);
        }
    }

    /**
     * Reads {@code input} as UTF-8, converts it and writes the fragment to {@code output} as UTF-8.
     *
     * @param conversionService converter to use
     * @param input markdown file
     * @param output HTML file, created or replaced
     * @throws IOException when either file cannot be accessed
     */
    public static void convertFile(MarkdownConversionService conversionService, Path input, Path output)
            throws IOException {
        String markdown = Files.readString(input, StandardCharsets.UTF_8);
        String html = conversionService.convert(markdown);
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, html, StandardCharsets.UTF_8);
        log.info("Converted {} ({} chars) to {} ({} chars)", input, markdown.length(), output, html.length());
    }

    private static Path requiredPath(ApplicationArguments arguments, String option) {
        List<String> values = arguments.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return Path.of(values.get(0));
    }
}
