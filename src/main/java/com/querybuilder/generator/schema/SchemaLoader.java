package com.querybuilder.generator.schema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.querybuilder.generator.codegen.classify.TimePattern;
import com.querybuilder.generator.codegen.exception.SchemaFormatException;
import com.querybuilder.generator.model.FieldDescriptor;
import com.querybuilder.generator.model.RecordDescriptor;
import com.querybuilder.generator.model.SchemaModel;
import com.querybuilder.generator.parser.TagSettingsParser;
import com.querybuilder.generator.parser.TypeDeclaration;
import com.querybuilder.generator.parser.TypeExpressionParser;
import com.querybuilder.generator.parser.TypeParseException;
import com.querybuilder.generator.schema.dto.SchemaDocument;

/**
 * Loads a JSON schema document into a {@link SchemaModel}.
 *
 * Every problem in the document is collected before failing, so a single
 * run reports all of them through {@link SchemaFormatException}. Malformed
 * JSON surfaces as an {@link IOException} from Jackson.
 */
public final class SchemaLoader {
    private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SchemaLoader() {
        // Utility class
    }

    public static SchemaModel load(Path path) throws IOException {
        log.debug("Loading schema {}", path);
        SchemaDocument document = JSON.readValue(Files.readAllBytes(path), SchemaDocument.class);
        if (document == null) {
            throw new SchemaFormatException(path.toString(), List.of("document is empty"));
        }
        return toModel(document, path.toString()).toBuilder().sourcePath(path).build();
    }

    public static SchemaModel parse(String json, String sourceName) throws IOException {
        SchemaDocument document = JSON.readValue(json, SchemaDocument.class);
        if (document == null) {
            throw new SchemaFormatException(sourceName, List.of("document is empty"));
        }
        return toModel(document, sourceName);
    }

    static SchemaModel toModel(SchemaDocument document, String sourceName) {
        List<String> errors = new ArrayList<>();

        if (isBlank(document.packageName)) {
            errors.add("package is required");
        } else if (!IDENTIFIER.matcher(document.packageName).matches()) {
            errors.add("package '" + document.packageName + "' is not a valid identifier");
        }
        String packageName = isBlank(document.packageName) ? "main" : document.packageName.trim();

        SchemaModel.SchemaModelBuilder model = SchemaModel.builder().packageName(packageName);

        if (document.imports != null) {
            for (Map.Entry<String, String> entry : document.imports.entrySet()) {
                if (isBlank(entry.getValue())) {
                    errors.add("import '" + entry.getKey() + "': path is required");
                } else {
                    model.importPath(entry.getKey(), entry.getValue().trim());
                }
            }
        }

        if (document.timeTypes != null) {
            for (int i = 0; i < document.timeTypes.size(); i++) {
                SchemaDocument.TimeType timeType = document.timeTypes.get(i);
                if (timeType == null || isBlank(timeType.name)) {
                    errors.add("timeTypes[" + i + "]: name is required");
                    continue;
                }
                model.timePattern(new TimePattern(timeType.name.trim(),
                        timeType.orderable == null || timeType.orderable));
            }
        }

        List<TypeDeclaration> declarations = readDeclarations(document.types, errors);
        TypeExpressionParser typeParser = new TypeExpressionParser(packageName, declarations);

        if (document.records == null || document.records.isEmpty()) {
            errors.add("records: at least one record is required");
        } else {
            Set<String> recordNames = new HashSet<>();
            for (int i = 0; i < document.records.size(); i++) {
                SchemaDocument.Record record = document.records.get(i);
                if (record == null || isBlank(record.name)) {
                    errors.add("records[" + i + "]: name is required");
                    continue;
                }
                if (!recordNames.add(record.name)) {
                    errors.add("record " + record.name + ": declared more than once");
                    continue;
                }
                RecordDescriptor descriptor = readRecord(record, typeParser, errors);
                if (descriptor != null) {
                    model.record(descriptor);
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new SchemaFormatException(sourceName, errors);
        }

        SchemaModel result = model.build();
        log.debug("Loaded {} record(s) from {}", result.getRecords().size(), sourceName);
        return result;
    }

    private static List<TypeDeclaration> readDeclarations(List<SchemaDocument.TypeDecl> types, List<String> errors) {
        List<TypeDeclaration> declarations = new ArrayList<>();
        if (types == null) {
            return declarations;
        }
        for (int i = 0; i < types.size(); i++) {
            SchemaDocument.TypeDecl type = types.get(i);
            if (type == null || isBlank(type.name)) {
                errors.add("types[" + i + "]: name is required");
                continue;
            }
            if (isBlank(type.underlying)) {
                errors.add("type " + type.name + ": underlying is required");
                continue;
            }
            declarations.add(TypeDeclaration.builder()
                    .name(type.name.trim())
                    .typeParameters(type.typeParameters == null ? List.of() : type.typeParameters)
                    .underlying(type.underlying)
                    .build());
        }
        return declarations;
    }

    private static RecordDescriptor readRecord(SchemaDocument.Record record, TypeExpressionParser typeParser,
                                               List<String> errors) {
        RecordDescriptor.RecordDescriptorBuilder descriptor = RecordDescriptor.builder().name(record.name.trim());
        if (record.comments != null) {
            descriptor.comments(record.comments);
        }

        Set<String> typeParameters = record.typeParameters == null
                ? Set.of() : new LinkedHashSet<>(record.typeParameters);
        int errorsBefore = errors.size();
        Set<String> fieldNames = new HashSet<>();

        List<SchemaDocument.Field> fields = record.fields == null ? List.of() : record.fields;
        for (int i = 0; i < fields.size(); i++) {
            SchemaDocument.Field field = fields.get(i);
            if (field == null || isBlank(field.name)) {
                errors.add("record " + record.name + ", fields[" + i + "]: name is required");
                continue;
            }
            String where = "record " + record.name + ", field " + field.name;
            if (!fieldNames.add(field.name)) {
                errors.add(where + ": declared more than once");
                continue;
            }
            if (isBlank(field.type)) {
                errors.add(where + ": type is required");
                continue;
            }
            try {
                descriptor.field(FieldDescriptor.builder()
                        .name(field.name.trim())
                        .shape(typeParser.parse(field.type, typeParameters))
                        .metadata(TagSettingsParser.parse(field.tags))
                        .build());
            } catch (TypeParseException e) {
                errors.add(where + ": " + e.getMessage());
            }
        }

        return errors.size() == errorsBefore ? descriptor.build() : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
