package com.querybuilder.generator.codegen.render;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querybuilder.generator.codegen.exception.GenerationException;
import com.querybuilder.generator.codegen.synth.MethodParameter;
import com.querybuilder.generator.codegen.synth.MethodSpec;
import com.querybuilder.generator.codegen.synth.RecordPlan;
import com.querybuilder.generator.codegen.util.ImportManager;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders planned records into a single Go source file.
 */
public class QueryBuilderRenderer {
    private static final Logger log = LoggerFactory.getLogger(QueryBuilderRenderer.class);

    public static final String DEFAULT_RUNTIME_IMPORT = "github.com/dchlong/querybuilder/repository";
    static final String RUNTIME_ALIAS = "repository";
    private static final String TEMPLATE = "querybuilder.go.ftl";

    private final Configuration freemarkerConfig;
    private final String runtimeImport;

    public QueryBuilderRenderer() {
        this(DEFAULT_RUNTIME_IMPORT);
    }

    public QueryBuilderRenderer(String runtimeImport) {
        this.runtimeImport = runtimeImport == null || runtimeImport.isBlank()
                ? DEFAULT_RUNTIME_IMPORT : runtimeImport.trim();
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
     * @param packageName  package clause of the generated file
     * @param knownImports import alias to path, used for qualifiers in parameter types
     * @param sourceName   shown in the header, may be null
     */
    public String render(String packageName, Map<String, String> knownImports, List<RecordPlan> plans,
                         String sourceName) {
        ImportManager imports = new ImportManager(knownImports);
        imports.addImport(RUNTIME_ALIAS, runtimeImport);
        for (RecordPlan plan : plans) {
            addParameterImports(imports, plan.getFilterMethods());
            addParameterImports(imports, plan.getUpdaterMethods());
        }

        Map<String, Object> model = new HashMap<>();
        model.put("packageName", packageName);
        model.put("imports", imports.generateImports());
        model.put("records", plans);
        if (sourceName != null) {
            model.put("sourceName", sourceName);
        }

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter writer = new StringWriter();
            template.process(model, writer);
            log.debug("Rendered {} record(s) for package {}", plans.size(), packageName);
            return writer.toString();
        } catch (IOException | TemplateException e) {
            throw new GenerationException("Failed to render query builders for package " + packageName, e);
        }
    }

    private void addParameterImports(ImportManager imports, List<MethodSpec> methods) {
        for (MethodSpec method : methods) {
            for (MethodParameter parameter : method.getParameters()) {
                imports.addImportsFor(parameter.getTypeName());
            }
        }
    }
}
