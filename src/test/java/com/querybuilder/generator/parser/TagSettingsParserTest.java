package com.querybuilder.generator.parser;

import com.querybuilder.generator.model.FieldMetadata;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TagSettingsParserTest {

    @Test
    void testColumnOverride() {
        FieldMetadata metadata = TagSettingsParser.parse(Map.of("gorm", "column:user_name;not null"));

        assertThat(metadata.getColumnName()).isEqualTo("user_name");
        assertThat(metadata.isExcluded()).isFalse();
        assertThat(metadata.getSettings()).containsEntry("COLUMN", "user_name")
                .containsEntry("NOT NULL", "NOT NULL");
    }

    @Test
    void testExclusionMarker() {
        assertThat(TagSettingsParser.parse(Map.of("gorm", "-")).isExcluded()).isTrue();
        assertThat(TagSettingsParser.parse(Map.of("sql", "-")).isExcluded()).isTrue();
    }

    @Test
    void testValuesKeepEmbeddedColons() {
        FieldMetadata metadata = TagSettingsParser.parse(Map.of("gorm", "default:12:30:00;type:time"));

        assertThat(metadata.getSettings()).containsEntry("DEFAULT", "12:30:00").containsEntry("TYPE", "time");
    }

    @Test
    void testGormOverridesSql() {
        FieldMetadata metadata = TagSettingsParser.parse(Map.of("sql", "column:a", "gorm", "column:b"));

        assertThat(metadata.getColumnName()).isEqualTo("b");
    }

    @Test
    void testOtherTagsAreIgnored() {
        FieldMetadata metadata = TagSettingsParser.parse(Map.of("json", "-", "db", "column:x"));

        assertThat(metadata.isExcluded()).isFalse();
        assertThat(metadata.getColumnName()).isNull();
    }

    @Test
    void testEmptyTags() {
        assertThat(TagSettingsParser.parse(null)).isSameAs(FieldMetadata.EMPTY);
        assertThat(TagSettingsParser.parse(Map.of())).isSameAs(FieldMetadata.EMPTY);
        assertThat(TagSettingsParser.parse(Map.of("gorm", ";;")).getSettings()).isEmpty();
    }
}
