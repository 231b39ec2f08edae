package com.memlayout.generator.codegen.export;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Writes generated header text to disk through the {@code header.ftl}
 * template, which prepends the optional banner comment.
 */
public class HeaderFileWriter {
    private static final Logger log = LoggerFactory.getLogger(HeaderFileWriter.class);

    static final String TEMPLATE_NAME = "header.ftl";

    private final Configuration freemarkerConfig;

    public HeaderFileWriter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Renders the final file content.
     *
     * @param body   generated header text
     * @param banner banner values, or null to omit the banner
     */
    public String render(String body, BannerInfo banner) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("body", body);
        if (banner != null) {
            model.put("banner", banner);
        }
        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE_NAME + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    /**
     * Renders and writes the header to {@code target} as UTF-8, creating
     * missing parent directories.
     */
    public void write(Path target, String body, BannerInfo banner) throws IOException {
        String content = render(body, banner);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        log.info("Wrote header to {}", target.toAbsolutePath());
    }
}
