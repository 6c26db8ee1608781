package com.querybuilder.generator.codegen.render;

import com.querybuilder.generator.codegen.classify.TimePatternTable;
import com.querybuilder.generator.codegen.classify.TypeClassifier;
import com.querybuilder.generator.codegen.synth.MethodSynthesizer;
import com.querybuilder.generator.codegen.synth.RecordPlan;
import com.querybuilder.generator.codegen.synth.RecordPlanner;
import com.querybuilder.generator.model.FieldDescriptor;
import com.querybuilder.generator.model.RecordDescriptor;
import com.querybuilder.generator.model.shape.AggregateShape;
import com.querybuilder.generator.model.shape.NamedShape;
import com.querybuilder.generator.model.shape.PointerShape;
import com.querybuilder.generator.model.shape.PrimitiveShape;
import com.querybuilder.generator.model.shape.SliceShape;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class QueryBuilderRendererTest {

    private static final PrimitiveShape STRING = new PrimitiveShape("string", true, false);
    private static final NamedShape TIME = NamedShape.builder()
            .namespace("time").name("Time").underlying(new AggregateShape("struct{}")).build();

    private static final Map<String, String> IMPORTS = Map.of(
            "time", "time",
            "datatypes", "gorm.io/datatypes");

    private RecordPlan userPlan;

    @BeforeEach
    void setUp() {
        RecordPlanner planner = new RecordPlanner(
                new TypeClassifier(TimePatternTable.defaults(), "models"), new MethodSynthesizer());
        userPlan = planner.plan(RecordDescriptor.builder()
                .name("User")
                .field(FieldDescriptor.builder().name("ID").shape(new PrimitiveShape("int64", false, true)).build())
                .field(FieldDescriptor.builder().name("Name").shape(STRING).build())
                .field(FieldDescriptor.builder().name("Tags").shape(new SliceShape(STRING)).build())
                .field(FieldDescriptor.builder().name("UpdatedAt").shape(new PointerShape(TIME)).build())
                .build());
    }

    @Test
    void testHeaderPackageAndImports() {
        String source = new QueryBuilderRenderer().render("models", IMPORTS, List.of(userPlan), "models.json");

        assertThat(source).startsWith("// Code generated by querybuilder. DO NOT EDIT.\n// source: models.json\n");
        assertThat(source).contains("\npackage models\n");
        assertThat(source).contains("import (\n\t\"github.com/dchlong/querybuilder/repository\"\n\t\"time\"\n)\n");
        assertThat(source).doesNotContain("gorm.io/datatypes");
    }

    @Test
    void testCustomRuntimeImportIsAliased() {
        String source = new QueryBuilderRenderer("example.com/app/runtime")
                .render("models", Map.of(), List.of(userPlan), null);

        assertThat(source).contains("\trepository \"example.com/app/runtime\"\n");
        assertThat(source).doesNotContain("// source:");
    }

    @Test
    void testBuilderTypes() {
        String source = new QueryBuilderRenderer().render("models", IMPORTS, List.of(userPlan), null);

        assertThat(source).contains("type UserFilters struct {\n\tfilters map[UserDBSchemaField][]*repository.Filter\n}");
        assertThat(source).contains("func NewUserFilters() *UserFilters {");
        assertThat(source).contains("func (f *UserFilters) ListFilters() []*repository.Filter {");
        assertThat(source).contains("func NewUserUpdater() *UserUpdater {");
        assertThat(source).contains("func (u *UserUpdater) GetChangeSet() map[string]interface{} {");
        assertThat(source).contains("func (o *UserOptions) Apply(repoOpts *repository.Options) {");
        assertThat(source).contains("type UserDBSchemaField string");
    }

    @Test
    void testFilterMethodBodies() {
        String source = new QueryBuilderRenderer().render("models", IMPORTS, List.of(userPlan), null);

        assertThat(source).contains("""
                // NameLike filters by Name like
                func (u *UserFilters) NameLike(name string) *UserFilters {
                	u.filters[UserDBSchema.Name] = append(u.filters[UserDBSchema.Name],
                		&repository.Filter{
                			Field:    string(UserDBSchema.Name),
                			Operator: repository.OperatorLike,
                			Value:    name,
                		})
                	return u
                }
                """);
        assertThat(source).contains("func (u *UserFilters) IDIn(ids ...int64) *UserFilters {");
        assertThat(source).contains("func (u *UserFilters) UpdatedAtIsNull() *UserFilters {");
        assertThat(source).contains("\t\t\tValue:    nil,\n");
        assertThat(source).doesNotContain("TagsEq");
    }

    @Test
    void testUpdaterAndOrderBodies() {
        String source = new QueryBuilderRenderer().render("models", IMPORTS, List.of(userPlan), null);

        assertThat(source).contains("""
                func (u *UserUpdater) SetTags(tags []string) *UserUpdater {
                	u.fields[string(UserDBSchema.Tags)] = tags
                	return u
                }
                """);
        assertThat(source).contains("""
                func (u *UserOptions) OrderByNameDesc() *UserOptions {
                	u.options = append(u.options, func(options *repository.Options) {
                		options.SortFields = append(options.SortFields, &repository.SortField{
                			Field:     string(UserDBSchema.Name),
                			Direction: "desc",
                		})
                	})
                	return u
                }
                """);
        assertThat(source).doesNotContain("OrderByTags");
    }

    @Test
    void testSchemaVariableIsAligned() {
        String source = new QueryBuilderRenderer().render("models", IMPORTS, List.of(userPlan), null);

        assertThat(source).contains("""
                var UserDBSchema = struct {
                	ID        UserDBSchemaField
                	Name      UserDBSchemaField
                	Tags      UserDBSchemaField
                	UpdatedAt UserDBSchemaField
                }{
                	ID:        UserDBSchemaField("id"),
                	Name:      UserDBSchemaField("name"),
                	Tags:      UserDBSchemaField("tags"),
                	UpdatedAt: UserDBSchemaField("updated_at"),
                }
                """);
    }

    @Test
    void testMultipleRecordsInOneFile() {
        RecordPlan order = RecordPlan.builder().recordName("Order").build();

        String source = new QueryBuilderRenderer().render("models", IMPORTS, List.of(userPlan, order), null);

        assertThat(source).contains("type UserFilters struct");
        assertThat(source).contains("type OrderFilters struct");
        assertThat(source.indexOf("type UserFilters")).isLessThan(source.indexOf("type OrderFilters"));
    }
}
