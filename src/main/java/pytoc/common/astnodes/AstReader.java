package pytoc.common.astnodes;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/** Interface between the external parser and the translator.  Trees
 *  travel as JSON, one object per node, tagged with its "kind". */
public final class AstReader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new ParameterNamesModule(JsonCreator.Mode.PROPERTIES))
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.INDENT_OUTPUT, true);

    private AstReader() {
    }

    /** Return the Program AST described by the JSON text INPUT. */
    public static Program read(String input) throws JsonProcessingException {
        return MAPPER.readValue(input, Program.class);
    }

    /** Return the JSON text describing NODE, readable by read() when
     *  NODE is a Program. */
    public static String toJSON(Node node) throws JsonProcessingException {
        return MAPPER.writeValueAsString(node);
    }
}
