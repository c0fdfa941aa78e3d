package fieldgrid.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fieldgrid.domain.extraction.IExtractionResult;
import fieldgrid.domain.grid.PointCloud;
import fieldgrid.domain.source.IDataSource;
import fieldgrid.source.InMemoryDataSource;
import fieldgrid.source.TimeSeriesDataSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Intercambio JSON con las capas externas.
 * <p>
 * - Salida: serializa resultados de extracción para el graficador/exportador.
 * - Entrada: construye una {@link TimeSeriesDataSource} a partir de una descripción de frames:
 * <pre>
 * { "frames": [ { "time": 0.0,
 *                 "points": [[x, y, z], ...],
 *                 "scalars": { "rho": [...] },
 *                 "vectors": { "E": [[ex, ey, ez], ...] } } ] }
 * </pre>
 * Trabaja sobre cadenas y flujos que proporciona el llamador; no gestiona ficheros.
 */
@Slf4j
public class ExtractionJsonCodec {

    // El ObjectMapper es costoso de crear y thread-safe: se reutiliza.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un resultado de extracción a JSON.
     */
    public String toJson(IExtractionResult result) throws IOException {
        Objects.requireNonNull(result, "El resultado no puede ser nulo.");
        log.debug("Serializando resultado de tipo {} a JSON.", result.getClass().getSimpleName());
        return objectMapper.writeValueAsString(result);
    }

    public void write(IExtractionResult result, Writer writer) throws IOException {
        Objects.requireNonNull(result, "El resultado no puede ser nulo.");
        Objects.requireNonNull(writer, "El destino no puede ser nulo.");
        objectMapper.writeValue(writer, result);
    }

    /**
     * Construye una fuente de datos temporal desde una descripción JSON de frames.
     *
     * @throws IOException si el JSON está mal formado o no contiene frames.
     */
    public TimeSeriesDataSource readFrames(String json) throws IOException {
        Objects.requireNonNull(json, "El JSON no puede ser nulo.");
        return toDataSource(parse(json, null));
    }

    public TimeSeriesDataSource readFrames(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "El origen no puede ser nulo.");
        return toDataSource(parse(null, reader));
    }

    private FramesDocument parse(String json, Reader reader) throws IOException {
        try {
            return json != null
                    ? objectMapper.readValue(json, FramesDocument.class)
                    : objectMapper.readValue(reader, FramesDocument.class);
        } catch (IOException e) {
            log.error("Error al parsear la descripción JSON de frames.", e);
            throw e;
        }
    }

    private static TimeSeriesDataSource toDataSource(FramesDocument document) throws IOException {
        if (document == null || document.frames() == null || document.frames().isEmpty()) {
            throw new IOException("La descripción JSON no contiene ningún frame.");
        }
        Map<Double, IDataSource> frames = new LinkedHashMap<>();
        for (FrameDocument frame : document.frames()) {
            if (frame.points() == null) {
                throw new IOException("El frame t=" + frame.time() + " no declara puntos.");
            }
            if (frames.containsKey(frame.time())) {
                throw new IOException("Instante duplicado en la descripción JSON: t=" + frame.time());
            }
            frames.put(frame.time(), InMemoryDataSource.builder()
                    .points(PointCloud.of(frame.points()))
                    .scalars(frame.scalars() == null ? Map.of() : frame.scalars())
                    .vectors(frame.vectors() == null ? Map.of() : frame.vectors())
                    .build());
        }
        log.debug("Leídos {} frames desde JSON.", frames.size());
        return TimeSeriesDataSource.of(frames);
    }

    record FramesDocument(List<FrameDocument> frames) {}

    record FrameDocument(double time,
                         double[][] points,
                         Map<String, double[]> scalars,
                         Map<String, double[][]> vectors) {}
}
