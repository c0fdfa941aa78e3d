package fieldgrid.extractor;

import fieldgrid.config.ExtractionConfig;
import fieldgrid.domain.extraction.GridExtraction;
import fieldgrid.domain.extraction.GridSeriesExtraction;
import fieldgrid.domain.extraction.LineExtraction;
import fieldgrid.domain.extraction.LineSeriesExtraction;
import fieldgrid.domain.field.FieldRef;
import fieldgrid.domain.grid.GridShape;
import fieldgrid.domain.source.IDataSource;
import fieldgrid.pipeline.FramePipeline;
import fieldgrid.pipeline.SortedFrame;
import fieldgrid.timeseries.TimeSeriesCollector;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Punto de entrada de la extracción de arrays.
 * <p>
 * Responsabilidades:
 * 1. Traducir los nombres de canal a {@link FieldRef} en la frontera de la API.
 * 2. Componer Ordenador -> Lector -> (Inferencia de forma) -> Remodelado para una instantánea.
 * 3. Delegar las variantes temporales en el {@link TimeSeriesCollector}.
 * <p>
 * Cada llamada es independiente y sin estado; todos los arrays devueltos son nuevos y
 * pertenecen al llamador.
 */
@Slf4j
public class GridExtractor {

    @Getter
    private final ExtractionConfig config;
    private final FramePipeline pipeline;
    private final TimeSeriesCollector collector;

    public GridExtractor() {
        this(ExtractionConfig.defaults());
    }

    public GridExtractor(ExtractionConfig config) {
        this(new FramePipeline(config));
    }

    public GridExtractor(FramePipeline pipeline) {
        this(pipeline, new TimeSeriesCollector(pipeline));
    }

    public GridExtractor(FramePipeline pipeline, TimeSeriesCollector collector) {
        this.pipeline = Objects.requireNonNull(pipeline, "El pipeline no puede ser nulo.");
        this.collector = Objects.requireNonNull(collector, "El recolector no puede ser nulo.");
        this.config = pipeline.getConfig();
    }

    // --- 1. LÍNEA (1D) ---

    public LineExtraction extractLine(IDataSource source, List<String> fields) {
        return extractLineFields(source, parse(fields));
    }

    public LineExtraction extractLineFields(IDataSource source, List<FieldRef> fields) {
        List<String> channels = channelNames(fields);
        SortedFrame frame = pipeline.sortAndRead(source, fields);
        LineExtraction line = pipeline.toLine(frame, channels);
        log.info("Extracción 1D: {} muestras, {} canales.", line.getSampleCount(), channels.size());
        return line;
    }

    // --- 2. REJILLAS (2D / 3D) ---

    public GridExtraction extractGrid2d(IDataSource source, List<String> fields) {
        return extractGridFields(source, parse(fields), 2);
    }

    public GridExtraction extractGrid3d(IDataSource source, List<String> fields) {
        return extractGridFields(source, parse(fields), 3);
    }

    public GridExtraction extractGridFields(IDataSource source, List<FieldRef> fields, int rank) {
        if (rank < 2 || rank > 3) {
            throw new IllegalArgumentException("La extracción de rejilla solo admite rango 2 o 3, recibido: " + rank);
        }
        List<String> channels = channelNames(fields);
        SortedFrame frame = pipeline.sortAndRead(source, fields);
        GridShape shape = pipeline.inferShape(frame, rank);
        GridExtraction grid = pipeline.toGrid(frame, shape, channels);
        log.info("Extracción {}D: forma {}, {} canales.", rank, shape, channels.size());
        return grid;
    }

    /**
     * Extracción con una forma impuesta por el llamador en lugar de la inferida.
     * Falla si el producto de la forma no coincide con el número de muestras.
     */
    public GridExtraction extractGrid(IDataSource source, List<String> fields, GridShape shape) {
        Objects.requireNonNull(shape, "La forma no puede ser nula.");
        List<FieldRef> refs = parse(fields);
        List<String> channels = channelNames(refs);
        SortedFrame frame = pipeline.sortAndRead(source, refs);
        return pipeline.toGrid(frame, shape, channels);
    }

    // --- 3. SERIES TEMPORALES ---

    public LineSeriesExtraction extractLineSeries(IDataSource source, List<String> fields) {
        return extractLineSeries(source, fields, null);
    }

    /**
     * @param times Instantes explícitos; {@code null} para usar los declarados por la fuente.
     */
    public LineSeriesExtraction extractLineSeries(IDataSource source, List<String> fields, List<Double> times) {
        return collector.collectLines(source, parse(fields), times);
    }

    public GridSeriesExtraction extractGrid2dSeries(IDataSource source, List<String> fields) {
        return extractGrid2dSeries(source, fields, null);
    }

    public GridSeriesExtraction extractGrid2dSeries(IDataSource source, List<String> fields, List<Double> times) {
        return collector.collectGrids(source, parse(fields), 2, times);
    }

    public GridSeriesExtraction extractGrid3dSeries(IDataSource source, List<String> fields) {
        return extractGrid3dSeries(source, fields, null);
    }

    public GridSeriesExtraction extractGrid3dSeries(IDataSource source, List<String> fields, List<Double> times) {
        return collector.collectGrids(source, parse(fields), 3, times);
    }

    public GridSeriesExtraction extractGridSeriesFields(IDataSource source, List<FieldRef> fields, int rank, List<Double> times) {
        return collector.collectGrids(source, fields, rank, times);
    }

    // --- Helpers ---

    private static List<FieldRef> parse(List<String> fields) {
        Objects.requireNonNull(fields, "La lista de campos no puede ser nula.");
        return fields.stream().map(FieldRef::parse).toList();
    }

    private static List<String> channelNames(List<FieldRef> fields) {
        Objects.requireNonNull(fields, "La lista de campos no puede ser nula.");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Hay que solicitar al menos un campo.");
        }
        return fields.stream().map(FieldRef::channelName).toList();
    }
}
