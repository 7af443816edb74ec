package com.redash.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redash.config.CodecConfig;
import com.redash.exception.EmptySingleSelectionException;
import com.redash.exception.MalformedParameterException;
import com.redash.exception.QueryCodecException;
import com.redash.exception.SelectionShapeMismatchException;
import com.redash.exception.UnknownParameterKindException;
import com.redash.model.QueryOptions;
import com.redash.model.parameter.DateParameter;
import com.redash.model.parameter.DateRangeParameter;
import com.redash.model.parameter.DateTimeParameter;
import com.redash.model.parameter.DateTimeRangeParameter;
import com.redash.model.parameter.DateTimeWithSecondsParameter;
import com.redash.model.parameter.DateTimeWithSecondsRangeParameter;
import com.redash.model.parameter.EnumParameter;
import com.redash.model.parameter.MultiValuesOptions;
import com.redash.model.parameter.NumberParameter;
import com.redash.model.parameter.QueryBasedParameter;
import com.redash.model.parameter.QueryParameter;
import com.redash.model.parameter.TextParameter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryOptionsCodecImplTest {

    private ObjectMapper objectMapper;
    private QueryOptionsCodecImpl codec;

    @BeforeEach
    void setUp() {
        objectMapper = new CodecConfig().objectMapper();
        codec = new QueryOptionsCodecImpl(objectMapper);
    }

    @Test
    void roundTrip_shouldPreserveEveryKindAndOrder() {
        List<QueryParameter> parameters = List.of(
                new TextParameter("search", "Search", "foo"),
                new NumberParameter("limit", null, 12.5),
                new DateParameter("day", "Day", "2020-01-31"),
                new DateTimeParameter("at", null, "2020-01-31 10:15"),
                new DateTimeWithSecondsParameter("exact", null, "2020-01-31 10:15:30"),
                new DateRangeParameter("period", "Period", "2020-01-01|2020-01-31"),
                new DateTimeRangeParameter("window", null, "2020-01-01 00:00|2020-01-02 00:00"),
                new DateTimeWithSecondsRangeParameter("span", null, "d_last_7_days"),
                new EnumParameter("region", "Region", List.of("eu"), "eu\nus", null),
                new EnumParameter("regions", null, List.of("us", "eu", "us"), "eu\nus",
                        new MultiValuesOptions("'", "'", ",")),
                new QueryBasedParameter("owner", null, List.of("alice"), "13", null),
                new QueryBasedParameter("owners", null, List.of(), "13", new MultiValuesOptions("", "", ",")),
                new TextParameter("search", null, "duplicate names are allowed"),
                new TextParameter("untitled", "", "x"));

        QueryOptions decoded = codec.decode(codec.encode(parameters, "analyst"));

        assertThat(decoded.getParameters()).containsExactlyElementsOf(parameters);
        assertThat(decoded.getRunAsRole()).isEqualTo("analyst");
    }

    @Test
    void encode_shouldTagEachParameterWithItsType() throws Exception {
        byte[] json = codec.encode(List.of(new NumberParameter("limit", null, 5)), null);

        JsonNode parameter = objectMapper.readTree(json).get("parameters").get(0);
        assertThat(parameter.get("type").textValue()).isEqualTo("number");
        assertThat(parameter.get("value").doubleValue()).isEqualTo(5.0);
        assertThat(parameter.has("title")).isFalse();
        assertThat(parameter.has("kind")).isFalse();
    }

    @Test
    void encode_shouldWriteRangeAsStartAndEnd() throws Exception {
        byte[] json = codec.encode(List.of(
                new DateRangeParameter("period", null, "2020-01-01|2020-01-31"),
                new DateRangeParameter("day", null, "2020-01-01")), null);

        JsonNode parameters = objectMapper.readTree(json).get("parameters");
        assertThat(parameters.get(0).get("value"))
                .isEqualTo(objectMapper.readTree("{\"start\":\"2020-01-01\",\"end\":\"2020-01-31\"}"));
        assertThat(parameters.get(1).get("value").textValue()).isEqualTo("2020-01-01");
    }

    @Test
    void encode_shouldWriteSingleSelectionAsStringAndMultiSelectionAsArray() throws Exception {
        byte[] json = codec.encode(List.of(
                new EnumParameter("one", null, List.of("a", "b"), "a\nb", null),
                new EnumParameter("many", null, List.of("a", "b"), "a\nb", new MultiValuesOptions("'", "'", ","))), null);

        JsonNode parameters = objectMapper.readTree(json).get("parameters");
        assertThat(parameters.get(0).get("value").textValue()).isEqualTo("a");
        assertThat(parameters.get(0).has("multiValuesOptions")).isFalse();
        assertThat(parameters.get(1).get("value")).isEqualTo(objectMapper.readTree("[\"a\",\"b\"]"));
        assertThat(parameters.get(1).get("multiValuesOptions").get("separator").textValue()).isEqualTo(",");
    }

    @Test
    void encode_shouldFailForEmptySingleSelection() {
        List<QueryParameter> parameters = List.of(
                new TextParameter("search", null, "x"),
                new QueryBasedParameter("owner", null, new ArrayList<>(), "13", null));

        assertThatThrownBy(() -> codec.encode(parameters, null))
                .isInstanceOf(EmptySingleSelectionException.class)
                .satisfies(e -> assertThat(((EmptySingleSelectionException) e).getIndex()).isEqualTo(1));
    }

    @Test
    void encode_shouldOmitEmptyParametersAndRole() throws Exception {
        JsonNode options = objectMapper.readTree(codec.encode(new QueryOptions()));

        assertThat(options.size()).isZero();
    }

    @Test
    void decode_shouldReadSingleSelectEnumAsOneElementList() {
        String json = "{\"parameters\":[{\"name\":\"p\",\"type\":\"enum\",\"value\":\"a\",\"enumOptions\":\"a,b,c\"}]}";

        QueryOptions options = codec.decode(json.getBytes(StandardCharsets.UTF_8));

        EnumParameter parameter = (EnumParameter) options.getParameters().get(0);
        assertThat(parameter.getValues()).containsExactly("a");
        assertThat(parameter.getEnumOptions()).isEqualTo("a,b,c");
        assertThat(parameter.getMultiValuesOptions()).isNull();
    }

    @Test
    void decode_shouldReadMultiSelectEnumAsList() {
        String json = "{\"parameters\":[{\"name\":\"p\",\"type\":\"enum\",\"value\":[\"a\",\"b\"],\"enumOptions\":\"a,b,c\","
                + "\"multiValuesOptions\":{\"prefix\":\"\",\"suffix\":\"\",\"separator\":\",\"}}]}";

        QueryOptions options = codec.decode(json.getBytes(StandardCharsets.UTF_8));

        EnumParameter parameter = (EnumParameter) options.getParameters().get(0);
        assertThat(parameter.getValues()).containsExactly("a", "b");
        assertThat(parameter.getMultiValuesOptions().getSeparator()).isEqualTo(",");
    }

    @Test
    void decode_shouldFailWhenSelectionShapeDoesNotMatchOptions() {
        String json = "{\"parameters\":[{\"name\":\"p\",\"type\":\"enum\",\"value\":[\"a\"],\"enumOptions\":\"a\"}]}";

        assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(SelectionShapeMismatchException.class)
                .satisfies(e -> assertThat(((SelectionShapeMismatchException) e).getIndex()).isZero());
    }

    @Test
    void decode_shouldReadRangeObjectAndBareString() {
        String json = "{\"parameters\":["
                + "{\"name\":\"a\",\"type\":\"date-range\",\"value\":{\"start\":\"2020-01-01\",\"end\":\"2020-01-31\"}},"
                + "{\"name\":\"b\",\"type\":\"datetime-range\",\"value\":\"d_this_week\"}]}";

        List<QueryParameter> parameters = codec.decode(json.getBytes(StandardCharsets.UTF_8)).getParameters();

        assertThat(((DateRangeParameter) parameters.get(0)).getValue()).isEqualTo("2020-01-01|2020-01-31");
        assertThat(((DateTimeRangeParameter) parameters.get(1)).getValue()).isEqualTo("d_this_week");
    }

    @Test
    void decode_shouldRejectUnknownKind() {
        String json = "{\"parameters\":[{\"name\":\"p\",\"type\":\"bogus\",\"value\":\"x\"}]}";

        assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(UnknownParameterKindException.class)
                .satisfies(e -> assertThat(((UnknownParameterKindException) e).getTag()).isEqualTo("bogus"));
    }

    @Test
    void decode_shouldFailWholeCollectionAndReportIndexOfMalformedParameter() {
        String json = "{\"parameters\":["
                + "{\"name\":\"first\",\"type\":\"text\",\"value\":\"ok\"},"
                + "{\"name\":\"second\",\"type\":\"number\",\"value\":\"not a number\"},"
                + "{\"name\":\"third\",\"type\":\"text\",\"value\":\"ok\"}],"
                + "\"run_as_role\":\"analyst\"}";

        assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedParameterException.class)
                .satisfies(e -> {
                    MalformedParameterException malformed = (MalformedParameterException) e;
                    assertThat(malformed.getIndex()).isEqualTo(1);
                    assertThat(malformed.getTag()).isEqualTo("number");
                    assertThat(malformed.getCause()).isNotNull();
                });
    }

    @Test
    void decode_shouldRejectStringWhereNumberIsExpected() {
        String json = "{\"parameters\":[{\"name\":\"n\",\"type\":\"number\",\"value\":\"42\"}]}";

        assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedParameterException.class)
                .satisfies(e -> {
                    MalformedParameterException malformed = (MalformedParameterException) e;
                    assertThat(malformed.getIndex()).isZero();
                    assertThat(malformed.getTag()).isEqualTo("number");
                });
    }

    @Test
    void decode_shouldRejectNumberWhereTextIsExpected() {
        String json = "{\"parameters\":[{\"name\":\"t\",\"type\":\"text\",\"value\":5}]}";

        assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedParameterException.class)
                .satisfies(e -> assertThat(((MalformedParameterException) e).getTag()).isEqualTo("text"));
    }

    @Test
    void decode_shouldAcceptWholeNumberForNumberParameter() {
        String json = "{\"parameters\":[{\"name\":\"n\",\"type\":\"number\",\"value\":42}]}";

        QueryParameter parameter = codec.decode(json.getBytes(StandardCharsets.UTF_8)).getParameters().get(0);

        assertThat(parameter).isEqualTo(new NumberParameter("n", null, 42));
    }

    @Test
    void decode_shouldRejectNonStringType() {
        String json = "{\"parameters\":[{\"name\":\"t\",\"type\":5}]}";

        assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedParameterException.class)
                .satisfies(e -> {
                    MalformedParameterException malformed = (MalformedParameterException) e;
                    assertThat(malformed.getIndex()).isZero();
                    assertThat(malformed.getTag()).isNull();
                });
    }

    @Test
    void decode_shouldRejectNonStringName() {
        String json = "{\"parameters\":[{\"name\":\"ok\",\"type\":\"text\",\"value\":\"x\"},"
                + "{\"name\":7,\"type\":\"text\",\"value\":\"x\"}]}";

        assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedParameterException.class)
                .satisfies(e -> assertThat(((MalformedParameterException) e).getIndex()).isEqualTo(1));
    }

    @Test
    void encode_shouldKeepEmptyTitle() throws Exception {
        byte[] json = codec.encode(List.of(new TextParameter("t", "", "x")), null);

        JsonNode parameter = objectMapper.readTree(json).get("parameters").get(0);
        assertThat(parameter.get("title").textValue()).isEmpty();
    }

    @Test
    void decode_shouldRejectParameterWithoutType() {
        String json = "{\"parameters\":[{\"name\":\"p\",\"value\":\"x\"}]}";

        assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedParameterException.class)
                .hasMessageContaining("missing 'type'");
    }

    @Test
    void decode_shouldRejectParameterThatIsNotAnObject() {
        String json = "{\"parameters\":[\"text\"]}";

        assertThatThrownBy(() -> codec.decode(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(MalformedParameterException.class)
                .satisfies(e -> assertThat(((MalformedParameterException) e).getTag()).isNull());
    }

    @Test
    void decode_shouldIgnoreUnknownParameterFields() {
        String json = "{\"parameters\":[{\"name\":\"p\",\"type\":\"text\",\"value\":\"x\",\"global\":false,\"locals\":[]}]}";

        QueryParameter parameter = codec.decode(json.getBytes(StandardCharsets.UTF_8)).getParameters().get(0);

        assertThat(parameter).isEqualTo(new TextParameter("p", null, "x"));
    }

    @Test
    void decode_shouldKeepOpaqueDateTimeValue() {
        String json = "{\"parameters\":[{\"name\":\"at\",\"type\":\"datetime-local\",\"value\":null}]}";

        DateTimeParameter parameter = (DateTimeParameter) codec.decode(json.getBytes(StandardCharsets.UTF_8))
                .getParameters().get(0);

        assertThat(parameter.getValue()).isNull();
        assertThat(parameter.getKind().getTag()).isEqualTo("datetime-local");
    }

    @Test
    void decode_shouldTreatMissingParametersAsEmpty() {
        QueryOptions options = codec.decode("{\"run_as_role\":\"reader\"}".getBytes(StandardCharsets.UTF_8));

        assertThat(options.getParameters()).isEmpty();
        assertThat(options.getRunAsRole()).isEqualTo("reader");
    }

    @Test
    void decode_shouldRejectInvalidJson() {
        assertThatThrownBy(() -> codec.decode("{\"parameters\":".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(QueryCodecException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void decode_shouldRejectParametersThatAreNotAnArray() {
        assertThatThrownBy(() -> codec.decode("{\"parameters\":{}}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(QueryCodecException.class)
                .hasMessageContaining("must be a JSON array");
    }
}
