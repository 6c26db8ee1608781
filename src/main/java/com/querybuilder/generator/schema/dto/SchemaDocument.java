package com.querybuilder.generator.schema.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON form of a schema document, bound as-is. Validation and type
 * resolution happen in {@link com.querybuilder.generator.schema.SchemaLoader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaDocument {
    @JsonProperty("package")
    public String packageName;
    /** Import alias to import path. */
    public Map<String, String> imports;
    public List<TimeType> timeTypes;
    public List<TypeDecl> types;
    public List<Record> records;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimeType {
        public String name;
        /** Defaults to orderable when absent. */
        @JsonAlias("numeric")
        public Boolean orderable;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TypeDecl {
        public String name;
        public List<String> typeParameters;
        public String underlying;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Record {
        public String name;
        public List<String> typeParameters;
        public List<String> comments;
        public List<Field> fields;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Field {
        public String name;
        public String type;
        /** Struct tags by key, e.g. {@code gorm -> "column:user_name"}. */
        public Map<String, String> tags;
    }
}
