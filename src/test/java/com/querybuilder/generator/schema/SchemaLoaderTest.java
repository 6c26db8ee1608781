package com.querybuilder.generator.schema;

import com.querybuilder.generator.codegen.exception.SchemaFormatException;
import com.querybuilder.generator.model.FieldDescriptor;
import com.querybuilder.generator.model.RecordDescriptor;
import com.querybuilder.generator.model.SchemaModel;
import com.querybuilder.generator.model.shape.NamedShape;
import com.querybuilder.generator.model.shape.ShapeKind;
import com.querybuilder.generator.model.shape.UnsupportedShape;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class SchemaLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadSampleSchema() throws IOException, URISyntaxException {
        Path path = Path.of(getClass().getResource("/schemas/models.json").toURI());

        SchemaModel schema = SchemaLoader.load(path);

        assertThat(schema.getPackageName()).isEqualTo("models");
        assertThat(schema.getSourcePath()).isEqualTo(path);
        assertThat(schema.getImports()).containsEntry("datatypes", "gorm.io/datatypes");
        assertThat(schema.getRecords()).extracting(RecordDescriptor::getName).containsExactly("User", "AuditLog");

        RecordDescriptor user = schema.getRecords().get(0);
        assertThat(user.getComments()).contains("// gen:querybuilder");
        assertThat(user.getFields()).extracting(FieldDescriptor::getName).containsExactly(
                "ID", "Name", "Type", "Active", "Tags", "Metadata", "CreatedAt", "UpdatedAt", "Password");
        assertThat(user.getFields().get(1).getMetadata().getColumnName()).isEqualTo("full_name");
        assertThat(user.getFields().get(4).getShape().getKind()).isEqualTo(ShapeKind.SLICE);
        assertThat(user.getFields().get(7).getShape().getKind()).isEqualTo(ShapeKind.POINTER);
        assertThat(user.getFields().get(8).getMetadata().isExcluded()).isTrue();
    }

    @Test
    void testTimeTypesAndTypeParameters() throws IOException {
        String json = """
            {
              "package": "store",
              "timeTypes": [ { "name": "civil.Date", "orderable": false }, { "name": "civil.DateTime" } ],
              "records": [
                {
                  "name": "Box",
                  "typeParameters": ["T"],
                  "comments": ["// gen:querybuilder"],
                  "fields": [ { "name": "Item", "type": "T" }, { "name": "Day", "type": "civil.Date" } ]
                }
              ]
            }
            """;

        SchemaModel schema = SchemaLoader.parse(json, "inline");

        assertThat(schema.getTimePatterns()).hasSize(2);
        assertThat(schema.getTimePatterns().get(0).isOrderable()).isFalse();
        assertThat(schema.getTimePatterns().get(1).isOrderable()).isTrue();
        RecordDescriptor box = schema.getRecords().get(0);
        assertThat(box.getFields().get(0).getShape()).isInstanceOf(UnsupportedShape.class);
        assertThat(box.getFields().get(1).getShape()).isInstanceOf(NamedShape.class);
    }

    @Test
    void testAllProblemsAreReported() {
        String json = """
            {
              "records": [
                {
                  "name": "User",
                  "fields": [
                    { "name": "ID" },
                    { "name": "Tags", "type": "map[string" },
                    { "name": "ID", "type": "int" }
                  ]
                },
                { "fields": [] }
              ]
            }
            """;

        assertThatThrownBy(() -> SchemaLoader.parse(json, "broken.json"))
                .isInstanceOf(SchemaFormatException.class)
                .satisfies(e -> assertThat(((SchemaFormatException) e).getErrors()).containsExactly(
                        "package is required",
                        "record User, field ID: type is required",
                        "record User, field Tags: Expected RBRACKET but found '' at position 10 in 'map[string'",
                        "record User, field ID: declared more than once",
                        "records[1]: name is required"))
                .hasMessageContaining("broken.json");
    }

    @Test
    void testEmptyRecordsIsAnError() {
        assertThatThrownBy(() -> SchemaLoader.parse("{\"package\": \"models\", \"records\": []}", "empty"))
                .isInstanceOf(SchemaFormatException.class)
                .hasMessageContaining("at least one record");
    }

    @Test
    void testMalformedJson() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{ \"package\": \"models\", ");

        assertThatThrownBy(() -> SchemaLoader.load(file)).isInstanceOf(IOException.class);
    }
}
