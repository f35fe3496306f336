package io.jsontable.shell;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads JSON data from a file or from inline text.
 *
 * <p>Data is decoded into plain Java objects: objects become insertion-ordered {@link Map}s, arrays
 * become {@link List}s. Files are resolved against a base directory and must stay inside it.
 */
public final class JsonDataLoader {
  private static final Logger log = LoggerFactory.getLogger(JsonDataLoader.class);

  private final ObjectMapper mapper =
      new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  private final Charset charset;

  /** Creates a loader reading files as UTF-8. */
  public JsonDataLoader() {
    this.charset = StandardCharsets.UTF_8;
  }

  /**
   * Creates a loader reading files in the given encoding. Unknown encodings fall back to UTF-8.
   *
   * @param encoding charset name
   */
  public JsonDataLoader(String encoding) {
    this.charset = resolveCharset(encoding);
  }

  public Charset charset() {
    return charset;
  }

  /**
   * Loads from {@code filePath} if given, otherwise from {@code content}.
   *
   * @param filePath file relative to {@code baseDir}, may be null
   * @param content inline JSON, may be null
   * @param baseDir directory files must stay within
   * @return decoded object or array
   * @throws JsonLoadException if neither source is given or loading fails
   */
  public Object load(String filePath, String content, Path baseDir) {
    if (filePath != null && !filePath.isEmpty()) {
      return loadFromFile(filePath, baseDir);
    }
    if (content != null && !content.isEmpty()) {
      return loadFromContent(content);
    }
    throw new JsonLoadException("No JSON data source provided");
  }

  /**
   * Loads a JSON file.
   *
   * @param filePath file relative to {@code baseDir}
   * @param baseDir directory the file must stay within
   * @return decoded object or array
   * @throws JsonLoadException if the file is missing, escapes {@code baseDir}, or cannot be parsed
   */
  public Object loadFromFile(String filePath, Path baseDir) {
    Path jsonPath = baseDir.resolve(filePath);
    if (!Files.exists(jsonPath)) {
      throw new JsonLoadException("JSON file not found: " + jsonPath);
    }
    ensureWithin(jsonPath, baseDir);

    log.debug("Loading JSON from {} ({})", jsonPath, charset);
    try (Reader reader = Files.newBufferedReader(jsonPath, charset)) {
      return requireTable(mapper.readValue(reader, Object.class));
    } catch (IOException e) {
      throw new JsonLoadException("Failed to load JSON file: " + e.getMessage(), e);
    }
  }

  /**
   * Parses inline JSON text.
   *
   * @param content JSON text
   * @return decoded object or array
   * @throws JsonLoadException if the text is blank or cannot be parsed
   */
  public Object loadFromContent(String content) {
    if (content == null || content.isBlank()) {
      throw new JsonLoadException("No inline JSON content provided");
    }
    try {
      return requireTable(mapper.readValue(content, Object.class));
    } catch (JsonProcessingException e) {
      throw new JsonLoadException("Failed to parse inline JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static Object requireTable(Object data) {
    if (!(data instanceof Map<?, ?>) && !(data instanceof List<?>)) {
      throw new JsonLoadException("JSON data must be an array or object");
    }
    return data;
  }

  private static void ensureWithin(Path jsonPath, Path baseDir) {
    boolean safe;
    try {
      safe = jsonPath.toRealPath().startsWith(baseDir.toRealPath());
    } catch (IOException e) {
      throw new JsonLoadException("Cannot resolve path '" + jsonPath + "'", e);
    }
    if (!safe) {
      throw new JsonLoadException(
          "Path '" + jsonPath + "' is not safe (directory traversal detected)");
    }
  }

  private static Charset resolveCharset(String encoding) {
    if (encoding == null || encoding.isBlank()) {
      return StandardCharsets.UTF_8;
    }
    try {
      return Charset.forName(encoding.trim());
    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
      log.warn("Invalid encoding '{}', falling back to UTF-8", encoding);
      return StandardCharsets.UTF_8;
    }
  }
}
