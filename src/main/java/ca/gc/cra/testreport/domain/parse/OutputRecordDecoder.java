package ca.gc.cra.testreport.domain.parse;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.Locale;
import java.util.Optional;

/**
 * Decodes a whole line as a {@code {"Suite":..,"Test":..,"Msg":..}} output record.
 *
 * <p>Field names match case-insensitively and unknown fields are skipped. Absent or {@code null}
 * fields read as empty strings. The line is not a record when its root is not an object, when one of
 * the three fields holds a non-string value, or when anything follows the object.</p>
 *
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the underlying {@link JsonFactory} is
 * immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class OutputRecordDecoder {
  private static final String SUITE = "suite";
  private static final String TEST = "test";
  private static final String MSG = "msg";

  private final JsonFactory factory = new JsonFactory();

  /**
   * Attempts to decode {@code line}.
   *
   * @param line raw line without terminator; never {@code null}
   * @return decoded record, or empty when the line is not a well-formed record
   */
  public Optional<OutputRecord> decode(String line) {
    if (line.isBlank()) {
      return Optional.empty();
    }
    try (JsonParser parser = factory.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        return Optional.empty();
      }
      String suite = "";
      String test = "";
      String msg = "";
      JsonToken token;
      while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName().toLowerCase(Locale.ROOT);
        JsonToken value = parser.nextToken();
        if (!SUITE.equals(field) && !TEST.equals(field) && !MSG.equals(field)) {
          parser.skipChildren();
          continue;
        }
        if (value == JsonToken.VALUE_NULL) {
          continue;
        }
        if (value != JsonToken.VALUE_STRING) {
          return Optional.empty();
        }
        switch (field) {
          case SUITE -> suite = parser.getText();
          case TEST -> test = parser.getText();
          default -> msg = parser.getText();
        }
      }
      if (token != JsonToken.END_OBJECT || parser.nextToken() != null) {
        return Optional.empty();
      }
      return Optional.of(new OutputRecord(suite, test, msg));
    } catch (IOException ex) {
      // Malformed JSON is ordinary runner output, not an error.
      return Optional.empty();
    }
  }
}
