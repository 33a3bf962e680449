package com.substitution.solver.report;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.substitution.solver.model.Resolution;
import com.substitution.solver.solver.SolveResult;
import com.substitution.solver.text.TextNormalizer;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a human-readable summary of the resolved key and search statistics
 * from the {@code key-report.ftl} template.
 */
public class KeyReportWriter {

    static final String TEMPLATE = "key-report.ftl";

    private final Configuration freemarkerConfig;

    public KeyReportWriter() {
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

    public String render(SolveResult result, char placeholder) {
        Map<String, Object> model = new HashMap<>();
        model.put("result", result);
        model.put("letters", letterRows(result, placeholder));

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ReportRenderingException("Failed to render key report", e);
        }
    }

    private List<Map<String, String>> letterRows(SolveResult result, char placeholder) {
        List<Map<String, String>> rows = new ArrayList<>();
        String letters = TextNormalizer.normalize(result.getCiphertext());
        result.getResolutions().restrictTo(letters).forEach((cipher, resolution) -> {
            Map<String, String> row = new HashMap<>();
            row.put("cipher", String.valueOf(cipher));
            row.put("plain", display(resolution, placeholder));
            row.put("status", resolution.getKind().name().toLowerCase());
            rows.add(row);
        });
        return rows;
    }

    private static String display(Resolution resolution, char placeholder) {
        switch (resolution.getKind()) {
            case CERTAIN:
                return String.valueOf(resolution.getPlain());
            case AMBIGUOUS:
                return String.valueOf(placeholder);
            default:
                return "?";
        }
    }
}
