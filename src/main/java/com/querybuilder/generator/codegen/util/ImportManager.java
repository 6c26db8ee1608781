package com.querybuilder.generator.codegen.util;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the import block of a generated Go file.
 */
public class ImportManager {

    private static final Pattern QUALIFIER = Pattern.compile("\\b([A-Za-z_][A-Za-z0-9_]*)\\.[A-Za-z_]");

    /**
     * Import path to alias (null when the alias equals the last path segment).
     */
    private final Map<String, String> imports = new TreeMap<>();
    private final Map<String, String> knownImports;

    /**
     * @param knownImports alias to import path, as declared by the schema
     */
    public ImportManager(Map<String, String> knownImports) {
        this.knownImports = knownImports;
    }

    /**
     * Adds an import. The alias is written out only when it differs from the
     * path's last segment.
     */
    public void addImport(String alias, String path) {
        if (path == null || path.isEmpty()) {
            return;
        }
        String defaultAlias = path.substring(path.lastIndexOf('/') + 1);
        imports.put(path, alias == null || alias.equals(defaultAlias) ? null : alias);
    }

    /**
     * Adds the imports for every package qualifier referenced by a type
     * expression, e.g. {@code *time.Time} or {@code datatypes.JSONType[pkg.T]}.
     * Qualifiers the schema does not declare are ignored.
     */
    public void addImportsFor(String typeExpression) {
        if (typeExpression == null) {
            return;
        }
        Matcher matcher = QUALIFIER.matcher(typeExpression);
        while (matcher.find()) {
            String alias = matcher.group(1);
            String path = knownImports.get(alias);
            if (path != null) {
                addImport(alias, path);
            }
        }
    }

    /**
     * Generates the import block.
     */
    public String generateImports() {
        if (imports.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("import (\n");
        imports.forEach((path, alias) -> {
            sb.append('\t');
            if (alias != null) {
                sb.append(alias).append(' ');
            }
            sb.append('"').append(path).append("\"\n");
        });
        return sb.append(")\n").toString();
    }
}
