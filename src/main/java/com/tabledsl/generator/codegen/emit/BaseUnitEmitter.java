package com.tabledsl.generator.codegen.emit;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tabledsl.generator.codegen.model.EmittedUnit;
import com.tabledsl.generator.codegen.util.JavaLiterals;
import com.tabledsl.generator.codegen.util.NamingUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import lombok.Value;

/**
 * Generates the shared unit: version guard, category marker classes and table lookup.
 */
public class BaseUnitEmitter {
    private static final Logger log = LoggerFactory.getLogger(BaseUnitEmitter.class);

    static final String TEMPLATE_NAME = "base.java.ftl";

    private final Configuration freemarkerConfig;

    public BaseUnitEmitter() {
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
     * Renders the base unit for the given tables, in the given order.
     */
    public EmittedUnit emit(String databaseName, List<String> tableNames, Collection<String> forceCases)
            throws IOException {
        log.info("Generating {} for {} tables", GeneratedSources.BASE_CLASS_NAME, tableNames.size());

        List<TableEntry> tables = tableNames.stream()
                .map(name -> toEntry(name, forceCases))
                .toList();

        Map<String, Object> model = new HashMap<>();
        model.put("header", GeneratedSources.HEADER);
        model.put("packageName", GeneratedSources.packageName(databaseName));
        model.put("runtimePackage", GeneratedSources.RUNTIME_PACKAGE);
        model.put("runtimeFacade", GeneratedSources.RUNTIME_FACADE);
        model.put("baseClassName", GeneratedSources.BASE_CLASS_NAME);
        model.put("generatorVersion", GeneratedSources.GENERATOR_VERSION);
        model.put("tables", tables);

        StringWriter out = new StringWriter();
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE_NAME, e);
        }

        return EmittedUnit.builder()
                .fileName(GeneratedSources.javaFileName(GeneratedSources.BASE_CLASS_NAME))
                .contents(out.toString())
                .kind(EmittedUnit.UnitKind.BASE)
                .build();
    }

    private static TableEntry toEntry(String tableName, Collection<String> forceCases) {
        String identifier = NamingUtil.toExportedIdentifier(tableName, forceCases);
        return new TableEntry(
                JavaLiterals.quote(tableName),
                GeneratedSources.tableClassName(identifier),
                NamingUtil.toConstantName(identifier));
    }

    /**
     * Template view of one table.
     */
    @Value
    public static class TableEntry {
        String literal;
        String className;
        String constant;
    }
}
