package com.redash.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.redash.dto.response.CommandResponse;
import com.redash.exception.QueryCodecException;
import com.redash.model.Query;
import com.redash.model.QueryOptions;
import com.redash.model.parameter.DateParameter;
import com.redash.model.parameter.DateTimeParameter;
import com.redash.model.parameter.DateTimeWithSecondsParameter;
import com.redash.model.parameter.MultiValuesOptions;
import com.redash.model.parameter.NumberParameter;
import com.redash.model.parameter.QueryParameter;
import com.redash.model.parameter.RangeParameter;
import com.redash.model.parameter.SelectionParameter;
import com.redash.model.parameter.TextParameter;
import com.redash.service.api.QueryCodec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component for inspecting query definition files: listing their parameters
 * and rewriting them in canonical form.
 */
@ShellComponent
public class ParameterCommand {

    // ANSI escape codes for coloring the output
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";

    private final QueryCodec queryCodec;
    private final ObjectMapper objectMapper;
    private final boolean prettyPrint;

    public ParameterCommand(QueryCodec queryCodec, ObjectMapper objectMapper,
                            @Value("${redash.codec.pretty-print:true}") boolean prettyPrint) {
        this.queryCodec = queryCodec;
        this.objectMapper = objectMapper;
        this.prettyPrint = prettyPrint;
    }

    /**
     * Lists the parameters of a query definition in declaration order, one per line as
     * {@code [index] name (type): value}.
     *
     * @param file Path to a JSON file holding one query.
     * @return The listing, or a red error line if the file can't be read or decoded.
     */
    @ShellMethod(key = "parameters", value = "List the parameters of a query definition file.")
    public String parameters(
            @ShellOption(value = {"--file", "-f"}, help = "Path to the query JSON file.") String file
    ) {
        Query query;
        try {
            query = readQuery(file);
        } catch (IOException e) {
            return CommandResponse.failure("Could not read '" + file + "': " + e.getMessage()).toAnsiString();
        } catch (QueryCodecException e) {
            return CommandResponse.failure("Invalid query definition: " + e.getMessage()).toAnsiString();
        }

        QueryOptions options = query.getOptions();
        List<QueryParameter> parameters = options == null ? List.of() : options.getParameters();
        if (parameters.isEmpty()) {
            return CommandResponse.ok("Query '" + query.getName() + "' has no parameters.").toAnsiString();
        }

        StringBuilder out = new StringBuilder();
        out.append(ANSI_CYAN).append("Parameters of query: ").append(ANSI_YELLOW).append(query.getName()).append(ANSI_RESET);
        for (int i = 0; i < parameters.size(); i++) {
            QueryParameter parameter = parameters.get(i);
            out.append(System.lineSeparator())
                    .append("  [").append(i).append("] ")
                    .append(parameter.getName())
                    .append(" (").append(parameter.getKind().getTag()).append("): ")
                    .append(renderValue(parameter));
        }
        if (options.getRunAsRole() != null && !options.getRunAsRole().isEmpty()) {
            out.append(System.lineSeparator()).append("  Runs as role: ").append(options.getRunAsRole());
        }
        return out.toString();
    }

    /**
     * Decodes a query definition and writes it back in canonical form, e.g. with range values
     * as {@code start}/{@code end} objects and unknown fields dropped.
     *
     * @param file Path to a JSON file holding one query.
     * @return The canonical JSON, or a red error line.
     */
    @ShellMethod(key = "normalize", value = "Rewrite a query definition file in canonical form.")
    public String normalize(
            @ShellOption(value = {"--file", "-f"}, help = "Path to the query JSON file.") String file
    ) {
        try {
            byte[] encoded = queryCodec.encode(readQuery(file));
            if (!prettyPrint) {
                return new String(encoded, StandardCharsets.UTF_8);
            }
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(objectMapper.readTree(encoded));
        } catch (IOException e) {
            return CommandResponse.failure("Could not read '" + file + "': " + e.getMessage()).toAnsiString();
        } catch (QueryCodecException e) {
            return CommandResponse.failure("Invalid query definition: " + e.getMessage()).toAnsiString();
        }
    }

    private Query readQuery(String file) throws IOException {
        return queryCodec.decode(Files.readAllBytes(Path.of(file)));
    }

    /**
     * Renders a parameter's current value the way it would be substituted into the query text.
     */
    static String renderValue(QueryParameter parameter) {
        return switch (parameter.getKind()) {
            case TEXT -> Objects.toString(((TextParameter) parameter).getValue(), "");
            case NUMBER -> String.valueOf(((NumberParameter) parameter).getValue());
            case DATE -> Objects.toString(((DateParameter) parameter).getValue(), "");
            case DATETIME_LOCAL -> Objects.toString(((DateTimeParameter) parameter).getValue(), "");
            case DATETIME_WITH_SECONDS -> Objects.toString(((DateTimeWithSecondsParameter) parameter).getValue(), "");
            case DATE_RANGE, DATETIME_RANGE, DATETIME_WITH_SECONDS_RANGE -> renderRange((RangeParameter) parameter);
            case ENUM, QUERY -> renderSelection((SelectionParameter) parameter);
        };
    }

    private static String renderRange(RangeParameter parameter) {
        String value = parameter.getValue();
        if (value == null) {
            return "";
        }
        String[] parts = value.split("\\|", -1);
        return parts.length == 2 ? parts[0] + " to " + parts[1] : value;
    }

    private static String renderSelection(SelectionParameter parameter) {
        List<String> values = parameter.getValues() == null ? List.of() : parameter.getValues();
        MultiValuesOptions multi = parameter.getMultiValuesOptions();
        if (multi == null) {
            return values.isEmpty() ? "" : values.get(0);
        }
        String prefix = Objects.toString(multi.getPrefix(), "");
        String suffix = Objects.toString(multi.getSuffix(), "");
        return values.stream()
                .map(v -> prefix + v + suffix)
                .collect(Collectors.joining(Objects.toString(multi.getSeparator(), "")));
    }
}
