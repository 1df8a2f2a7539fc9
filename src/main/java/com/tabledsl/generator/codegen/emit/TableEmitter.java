package com.tabledsl.generator.codegen.emit;

import static com.tabledsl.generator.codegen.emit.GeneratedSources.BASE_CLASS_NAME;
import static com.tabledsl.generator.codegen.emit.GeneratedSources.RUNTIME_FACADE;
import static com.tabledsl.generator.codegen.emit.GeneratedSources.runtimeType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tabledsl.generator.codegen.exception.ConnectionException;
import com.tabledsl.generator.codegen.exception.UnknownTypeException;
import com.tabledsl.generator.codegen.mapper.ColumnTypeMapper;
import com.tabledsl.generator.codegen.model.ColumnDescriptor;
import com.tabledsl.generator.codegen.model.EmittedUnit;
import com.tabledsl.generator.codegen.model.MappedType;
import com.tabledsl.generator.codegen.util.ImportManager;
import com.tabledsl.generator.codegen.util.JavaLiterals;
import com.tabledsl.generator.codegen.util.NamingUtil;
import com.tabledsl.generator.schema.SchemaFetcher;

/**
 * Generates the accessor unit for one table.
 * <p>
 * The unit holds the accessor class with one wrapper-typed field per column, its
 * singleton, field lookup, the precomputed column lists, and the nested model class.
 * Every per-column structure is built in one pass over the columns, so the model's
 * field order and its {@code getValues()} order both follow the catalog order.
 */
public class TableEmitter {
    private static final Logger log = LoggerFactory.getLogger(TableEmitter.class);

    private static final String INDENT = "    ";
    private static final String TABLE_OBJECT = "TABLE_";

    /**
     * @throws ConnectionException if the columns cannot be read
     * @throws UnknownTypeException if a column has a type outside the known families
     */
    public EmittedUnit emit(SchemaFetcher fetcher, String databaseName, String tableName,
                            Collection<String> forceCases) throws ConnectionException, UnknownTypeException {
        List<ColumnDescriptor> columns = fetcher.getFieldDescriptors(tableName);

        String tableIdentifier = NamingUtil.toExportedIdentifier(tableName, forceCases);
        String className = GeneratedSources.tableClassName(tableIdentifier);
        String packageName = GeneratedSources.packageName(databaseName);

        log.info("Generating {} -> {} ({} columns)", tableName, className, columns.size());

        ImportManager imports = new ImportManager(packageName);
        imports.addImport(runtimeType("Field"));
        imports.addImport(runtimeType("Model"));
        imports.addImport(runtimeType("Table"));
        imports.addImport(runtimeType(RUNTIME_FACADE));
        imports.addImport("java.util.Arrays");
        imports.addImport("java.util.List");

        TableParts parts = new TableParts();
        String quotedTable = fetcher.quoteIdentifier(tableName);
        for (ColumnDescriptor column : columns) {
            addColumn(parts, imports, fetcher, tableIdentifier, quotedTable, column, forceCases);
        }

        String contents = buildTableContent(packageName, imports, tableName, tableIdentifier, parts);
        return EmittedUnit.builder()
                .fileName(GeneratedSources.javaFileName(className))
                .contents(contents)
                .kind(EmittedUnit.UnitKind.TABLE)
                .tableName(tableName)
                .build();
    }

    private void addColumn(TableParts parts, ImportManager imports, SchemaFetcher fetcher,
                           String tableIdentifier, String quotedTable, ColumnDescriptor column,
                           Collection<String> forceCases) throws UnknownTypeException {
        String identifier = NamingUtil.toExportedIdentifier(column.getName(), forceCases);
        String baseMember = NamingUtil.toMemberName(identifier);
        String member = parts.uniqueMember(baseMember);
        MappedType type = ColumnTypeMapper.map(column);
        // a renamed member carries its suffix into the wrapper class name as well
        String wrapper = NamingUtil.ensureIdentifier(column.getRawType().toLowerCase(Locale.ROOT))
                + "_" + tableIdentifier + "_" + identifier + member.substring(baseMember.length());
        String runtimeFieldType = type.getCategory().getRuntimeType();

        imports.addImport(runtimeType(runtimeFieldType));
        imports.addImport(type.getScalarType().getRequiredImport());
        if (type.getScalarType().isRuntimeType()) {
            imports.addImport(runtimeType(type.getScalarType().getJavaType()));
        }

        String commentLine = column.getComment().isEmpty()
                ? ""
                : INDENT + "// " + JavaLiterals.lineComment(column.getComment()) + "\n";
        String columnLiteral = JavaLiterals.quote(column.getName());

        parts.fieldLines.append(commentLine)
                .append(INDENT).append("public final ").append(wrapper).append(' ').append(member)
                .append(" = new ").append(wrapper).append('(')
                .append(RUNTIME_FACADE).append('.').append(type.getCategory().getFactoryMethod())
                .append('(').append(TABLE_OBJECT).append(", ").append(columnLiteral).append("));\n");

        parts.modelLines.append(commentLine.isEmpty() ? "" : INDENT + commentLine)
                .append(INDENT).append(INDENT).append("public ").append(type.getJavaType())
                .append(' ').append(member).append(";\n");

        parts.caseLines.append(INDENT).append(INDENT).append(INDENT)
                .append("case ").append(columnLiteral).append(": return this.").append(member).append(";\n");

        parts.wrapperClasses
                .append(INDENT).append("public static final class ").append(wrapper)
                .append(" extends ").append(BASE_CLASS_NAME).append('.')
                .append(type.getCategory().getMarkerClass()).append(" {\n")
                .append(INDENT).append(INDENT).append(wrapper).append('(').append(runtimeFieldType)
                .append(" delegate) {\n")
                .append(INDENT).append(INDENT).append(INDENT).append("super(delegate);\n")
                .append(INDENT).append(INDENT).append("}\n")
                .append(INDENT).append("}\n\n");

        String quotedColumn = fetcher.quoteIdentifier(column.getName());
        parts.members.add(member);
        parts.fieldsSql.add(quotedColumn);
        parts.fullFieldsSql.add(quotedTable + "." + quotedColumn);
    }

    private String buildTableContent(String packageName, ImportManager imports, String tableName,
                                     String tableIdentifier, TableParts parts) {
        String className = GeneratedSources.tableClassName(tableIdentifier);
        String modelClassName = GeneratedSources.modelClassName(tableIdentifier);
        String singleton = NamingUtil.toConstantName(tableIdentifier);
        String memberList = String.join(", ", parts.members);

        StringBuilder sb = new StringBuilder();
        sb.append(GeneratedSources.HEADER).append('\n');
        sb.append("package ").append(packageName).append(";\n\n");
        sb.append(imports.generateImports());

        sb.append("public final class ").append(className)
                .append(" extends ").append(BASE_CLASS_NAME).append(".TableBase {\n\n");
        sb.append(INDENT).append("private static final Table ").append(TABLE_OBJECT).append(" = ")
                .append(RUNTIME_FACADE).append(".newTable(").append(JavaLiterals.quote(tableName)).append(");\n\n");
        sb.append(INDENT).append("public static final ").append(className).append(' ').append(singleton)
                .append(" = new ").append(className).append("();\n\n");

        sb.append(parts.fieldLines);
        if (parts.fieldLines.length() > 0) {
            sb.append('\n');
        }

        sb.append(INDENT).append("private ").append(className).append("() {\n");
        sb.append(INDENT).append(INDENT).append("super(").append(TABLE_OBJECT).append(");\n");
        sb.append(INDENT).append("}\n\n");

        appendMethod(sb, "List<Field> getFields()", "return List.of(" + memberList + ");");

        sb.append(INDENT).append("@Override\n");
        sb.append(INDENT).append("public Field getFieldByName(String name) {\n");
        sb.append(INDENT).append(INDENT).append("if (name == null) {\n");
        sb.append(INDENT).append(INDENT).append(INDENT).append("return null;\n");
        sb.append(INDENT).append(INDENT).append("}\n");
        sb.append(INDENT).append(INDENT).append("switch (name) {\n");
        sb.append(parts.caseLines);
        sb.append(INDENT).append(INDENT).append(INDENT).append("default: return null;\n");
        sb.append(INDENT).append(INDENT).append("}\n");
        sb.append(INDENT).append("}\n\n");

        appendMethod(sb, "String getFieldsSql()",
                "return " + JavaLiterals.quote(String.join(", ", parts.fieldsSql)) + ";");
        appendMethod(sb, "String getFullFieldsSql()",
                "return " + JavaLiterals.quote(String.join(", ", parts.fullFieldsSql)) + ";");

        sb.append(parts.wrapperClasses);

        sb.append(INDENT).append("public static final class ").append(modelClassName)
                .append(" implements Model {\n");
        sb.append(parts.modelLines);
        sb.append('\n');
        sb.append(INDENT).append(INDENT).append("@Override\n");
        sb.append(INDENT).append(INDENT).append("public Table getTable() {\n");
        sb.append(INDENT).append(INDENT).append(INDENT).append("return ").append(singleton).append(";\n");
        sb.append(INDENT).append(INDENT).append("}\n\n");
        sb.append(INDENT).append(INDENT).append("@Override\n");
        sb.append(INDENT).append(INDENT).append("public List<Object> getValues() {\n");
        sb.append(INDENT).append(INDENT).append(INDENT)
                .append("return Arrays.asList(").append(memberList).append(");\n");
        sb.append(INDENT).append(INDENT).append("}\n");
        sb.append(INDENT).append("}\n");
        sb.append("}\n");
        return sb.toString();
    }

    private void appendMethod(StringBuilder sb, String signature, String body) {
        sb.append(INDENT).append("@Override\n");
        sb.append(INDENT).append("public ").append(signature).append(" {\n");
        sb.append(INDENT).append(INDENT).append(body).append('\n');
        sb.append(INDENT).append("}\n\n");
    }

    /**
     * Per-column output, appended to in column order.
     */
    private static final class TableParts {
        final StringBuilder fieldLines = new StringBuilder();
        final StringBuilder modelLines = new StringBuilder();
        final StringBuilder caseLines = new StringBuilder();
        final StringBuilder wrapperClasses = new StringBuilder();
        final List<String> members = new ArrayList<>();
        final List<String> fieldsSql = new ArrayList<>();
        final List<String> fullFieldsSql = new ArrayList<>();
        private final Set<String> usedMembers = new HashSet<>();

        /**
         * Returns {@code member}, or {@code member_2}, {@code member_3}, ... when an earlier
         * column of the table already took that name.
         */
        String uniqueMember(String member) {
            String candidate = member;
            for (int i = 2; !usedMembers.add(candidate); i++) {
                candidate = member + "_" + i;
            }
            return candidate;
        }
    }
}
