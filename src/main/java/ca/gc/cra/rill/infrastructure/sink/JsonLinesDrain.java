package ca.gc.cra.rill.infrastructure.sink;

import ca.gc.cra.rill.application.port.Drain;
import ca.gc.cra.rill.application.port.DrainException;
import ca.gc.cra.rill.domain.kv.Fields;
import ca.gc.cra.rill.domain.kv.Serializer;
import ca.gc.cra.rill.domain.record.LogRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes each record as one JSON object per line.
 * <p><strong>Why:</strong> Gives the pipeline a machine-readable sink that keeps the field order and duplicate
 * keys exactly as the logger produced them.</p>
 * <p><strong>Role:</strong> Terminal drain, usually placed behind {@code AsyncDrain}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe on its own; {@link #log} is synchronized so a shared
 * instance still produces whole lines.</p>
 * <p><strong>Performance:</strong> One generator per record over a shared writer; the writer is flushed after
 * every line.</p>
 *
 * @implNote Object layout is {@code ts}, {@code level}, {@code msg}, {@code file}, {@code line}, an optional
 * {@code tag}, then the fields. Values the JSON model cannot represent are written via {@code toString()}.
 * @since 0.1.0
 */
public final class JsonLinesDrain implements Drain, Closeable {
  private static final Logger log = LoggerFactory.getLogger(JsonLinesDrain.class);

  private final JsonFactory factory;
  private final Writer writer;
  private final String description;
  private boolean closed;

  /**
   * Creates a drain writing to {@code writer}. Closing the drain closes the writer.
   *
   * @param writer destination
   */
  public JsonLinesDrain(Writer writer) {
    this(writer, "writer");
  }

  private JsonLinesDrain(Writer writer, String description) {
    this.factory = JsonFactory.builder().build();
    this.writer = Objects.requireNonNull(writer, "writer");
    this.description = description;
  }

  /**
   * Opens {@code path} for appending, creating parent directories as needed.
   *
   * @param path JSON lines file
   * @return drain appending to {@code path}
   * @throws IOException when the file cannot be opened
   */
  public static JsonLinesDrain open(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Writer writer = Files.newBufferedWriter(
        path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    log.debug("Opened JSON lines sink {}", path);
    return new JsonLinesDrain(writer, path.toString());
  }

  @Override
  public synchronized void log(LogRecord record, Fields fields) throws DrainException {
    if (closed) {
      throw new DrainException("JSON lines sink " + description + " is closed");
    }
    try {
      JsonGenerator json = factory.createGenerator(writer);
      json.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      json.writeStartObject();
      json.writeStringField("ts", record.timestamp().toString());
      json.writeStringField("level", record.level().asShortString());
      json.writeStringField("msg", record.message());
      json.writeStringField("file", record.location().file());
      json.writeNumberField("line", record.location().line());
      if (!record.tag().isEmpty()) {
        json.writeStringField("tag", record.tag());
      }
      fields.serialize(new JsonFieldWriter(json));
      json.writeEndObject();
      json.close();
      writer.write('\n');
      writer.flush();
    } catch (IOException ex) {
      throw new DrainException("Failed to write JSON line to " + description, ex);
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    writer.close();
  }

  private static final class JsonFieldWriter implements Serializer {
    private final JsonGenerator json;

    JsonFieldWriter(JsonGenerator json) {
      this.json = json;
    }

    @Override
    public void emitString(String key, String value) throws IOException {
      json.writeStringField(key, value);
    }

    @Override
    public void emitLong(String key, long value) throws IOException {
      json.writeNumberField(key, value);
    }

    @Override
    public void emitDouble(String key, double value) throws IOException {
      json.writeNumberField(key, value);
    }

    @Override
    public void emitBoolean(String key, boolean value) throws IOException {
      json.writeBooleanField(key, value);
    }

    @Override
    public void emitNull(String key) throws IOException {
      json.writeNullField(key);
    }
  }
}
