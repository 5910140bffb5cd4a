package com.layoutmapper.codegen;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the composed {@code GeneratedComponent} from {@code /templates/scaffold.ftl}.
 */
public class ScaffoldRenderer {

    static final String TEMPLATE_NAME = "scaffold.ftl";

    private final Configuration freemarkerConfig;

    public ScaffoldRenderer() {
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
     * @param imports import statements placed above the component, may be empty
     * @param usageLines JSX lines placed inside the wrapper {@code <div>}
     */
    public String render(List<String> imports, List<String> usageLines) {
        Map<String, Object> model = new HashMap<>();
        model.put("imports", imports);
        model.put("usages", usageLines);
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString().stripTrailing();
        } catch (IOException | TemplateException e) {
            throw new CodeGenerationException("Failed to render " + TEMPLATE_NAME + ": " + e.getMessage(), e);
        }
    }
}
