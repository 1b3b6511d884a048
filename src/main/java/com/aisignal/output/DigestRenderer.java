package com.aisignal.output;

import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.util.Locale;
import java.util.Map;

/**
 * Thymeleaf front end for {@code templates/digest.html}. The template reads everything from a single
 * {@code view} variable built by {@link DigestBuilder}.
 */
public final class DigestRenderer {
    static final String DIGEST_TEMPLATE = "digest";
    static final String VIEW_VARIABLE = "view";

    private final TemplateEngine engine = new TemplateEngine();

    public DigestRenderer() {
        ClassLoaderTemplateResolver templates = new ClassLoaderTemplateResolver(DigestRenderer.class.getClassLoader());
        templates.setPrefix("templates/");
        templates.setSuffix(".html");
        templates.setTemplateMode(TemplateMode.HTML);
        templates.setCharacterEncoding("UTF-8");
        // one render per subscriber per day; parsed template is reused across the batch
        templates.setCacheable(true);
        engine.setTemplateResolver(templates);
    }

    /**
     * Renders {@code templates/digest.html} with {@code view} bound as the template variable of the
     * same name.
     */
    public String renderDigest(Map<String, Object> view) {
        Context context = new Context(Locale.US);
        context.setVariable(VIEW_VARIABLE, view == null ? Map.of() : view);
        return engine.process(DIGEST_TEMPLATE, context);
    }
}
