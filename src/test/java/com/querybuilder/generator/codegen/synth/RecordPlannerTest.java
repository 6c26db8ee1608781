package com.querybuilder.generator.codegen.synth;

import com.querybuilder.generator.codegen.classify.TimePatternTable;
import com.querybuilder.generator.codegen.classify.TypeClassifier;
import com.querybuilder.generator.model.FieldDescriptor;
import com.querybuilder.generator.model.FieldMetadata;
import com.querybuilder.generator.model.RecordDescriptor;
import com.querybuilder.generator.model.shape.AggregateShape;
import com.querybuilder.generator.model.shape.NamedShape;
import com.querybuilder.generator.model.shape.PointerShape;
import com.querybuilder.generator.model.shape.PrimitiveShape;
import com.querybuilder.generator.model.shape.SliceShape;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RecordPlannerTest {

    private static final PrimitiveShape STRING = new PrimitiveShape("string", true, false);
    private static final PrimitiveShape INT64 = new PrimitiveShape("int64", false, true);
    private static final NamedShape TIME = NamedShape.builder()
            .namespace("time").name("Time").underlying(new AggregateShape("struct{}")).build();

    private RecordPlanner planner;
    private RecordDescriptor user;

    @BeforeEach
    void setUp() {
        planner = new RecordPlanner(new TypeClassifier(TimePatternTable.defaults(), "models"), new MethodSynthesizer());
        user = RecordDescriptor.builder()
                .name("User")
                .comment("// gen:querybuilder")
                .field(FieldDescriptor.builder().name("ID").shape(INT64).build())
                .field(FieldDescriptor.builder().name("Name").shape(STRING)
                        .metadata(FieldMetadata.builder().columnName("full_name").build()).build())
                .field(FieldDescriptor.builder().name("Tags").shape(new SliceShape(STRING)).build())
                .field(FieldDescriptor.builder().name("UpdatedAt").shape(new PointerShape(TIME)).build())
                .field(FieldDescriptor.builder().name("Password").shape(STRING)
                        .metadata(FieldMetadata.builder().excluded(true).build()).build())
                .build();
    }

    @Test
    void testPlanPreservesFieldOrder() {
        RecordPlan plan = planner.plan(user);

        assertThat(plan.getColumns()).extracting(ColumnMapping::getLogicalName)
                .containsExactly("ID", "Name", "Tags", "UpdatedAt");
        assertThat(plan.getColumns()).extracting(ColumnMapping::getColumnName)
                .containsExactly("id", "full_name", "tags", "updated_at");
        assertThat(plan.getSkippedFields()).containsExactly("Password");
    }

    @Test
    void testMethodCounts() {
        RecordPlan plan = planner.plan(user);

        // ID: 8 numeric, Name: 10 string, UpdatedAt: 4 pointer
        assertThat(plan.getFilterMethods()).hasSize(22);
        assertThat(plan.getUpdaterMethods()).extracting(MethodSpec::getName)
                .containsExactly("SetID", "SetName", "SetTags", "SetUpdatedAt");
        assertThat(plan.getOrderMethods()).extracting(MethodSpec::getName).containsExactly(
                "OrderByIDAsc", "OrderByIDDesc",
                "OrderByNameAsc", "OrderByNameDesc",
                "OrderByUpdatedAtAsc", "OrderByUpdatedAtDesc");
    }

    @Test
    void testSliceFieldGetsUpdaterOnly() {
        RecordPlan plan = planner.plan(user);

        assertThat(plan.getFilterMethods()).extracting(MethodSpec::getName)
                .noneMatch(name -> name.startsWith("Tags"));
        assertThat(plan.getOrderMethods()).extracting(MethodSpec::getName)
                .noneMatch(name -> name.contains("Tags"));
    }

    @Test
    void testMethodNamesAreUnique() {
        RecordPlan plan = planner.plan(user);

        assertThat(plan.getFilterMethods()).extracting(MethodSpec::getName).doesNotHaveDuplicates();
        assertThat(plan.getFilterMethods()).extracting(MethodSpec::getName)
                .startsWith("IDEq", "IDNe", "IDLt", "IDGt", "IDLte", "IDGte", "IDIn", "IDNotIn", "NameEq");
    }

    @Test
    void testGeneratedTypeNames() {
        RecordPlan plan = planner.plan(user.withName("UserRecord"));

        assertThat(plan.getFiltersType()).isEqualTo("UserRecordFilters");
        assertThat(plan.getUpdaterType()).isEqualTo("UserRecordUpdater");
        assertThat(plan.getOptionsType()).isEqualTo("UserRecordOptions");
        assertThat(plan.getSchemaFieldType()).isEqualTo("UserRecordDBSchemaField");
        assertThat(plan.getSchemaVariable()).isEqualTo("UserRecordDBSchema");
    }
}
