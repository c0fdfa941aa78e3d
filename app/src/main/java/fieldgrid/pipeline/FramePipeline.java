package fieldgrid.pipeline;

import fieldgrid.config.ExtractionConfig;
import fieldgrid.domain.extraction.GridExtraction;
import fieldgrid.domain.extraction.LineExtraction;
import fieldgrid.domain.field.Axis;
import fieldgrid.domain.field.FieldRef;
import fieldgrid.domain.grid.GridShape;
import fieldgrid.domain.grid.NdArray;
import fieldgrid.domain.grid.PointCloud;
import fieldgrid.domain.grid.SamplePermutation;
import fieldgrid.domain.grid.SortedPoints;
import fieldgrid.domain.source.IDataSource;
import fieldgrid.field.FieldArrayReader;
import fieldgrid.grid.GridShapeInference;
import fieldgrid.grid.Reshaper;
import fieldgrid.sort.CoordinateSorter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Cadena de pasos aplicada a UNA instantánea:
 * Ordenador de coordenadas -> Lector de campos -> (Inferencia de forma) -> Remodelado.
 * <p>
 * No guarda estado entre llamadas: solo la configuración y los componentes (sin estado).
 */
@Slf4j
public class FramePipeline {

    @Getter
    private final ExtractionConfig config;
    private final CoordinateSorter sorter;
    private final FieldArrayReader reader;
    private final GridShapeInference shapeInference;
    private final Reshaper reshaper;

    public FramePipeline(ExtractionConfig config) {
        this(config, new CoordinateSorter(), new FieldArrayReader(),
                new GridShapeInference(config.getGridValidation()), new Reshaper());
    }

    public FramePipeline(ExtractionConfig config,
                         CoordinateSorter sorter,
                         FieldArrayReader reader,
                         GridShapeInference shapeInference,
                         Reshaper reshaper) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.sorter = Objects.requireNonNull(sorter);
        this.reader = Objects.requireNonNull(reader);
        this.shapeInference = Objects.requireNonNull(shapeInference);
        this.reshaper = Objects.requireNonNull(reshaper);
    }

    /**
     * Ordena los puntos de la instantánea y lee cada canal reordenándolo con la misma permutación.
     */
    public SortedFrame sortAndRead(IDataSource source, List<FieldRef> fields) {
        Objects.requireNonNull(source, "La fuente de datos no puede ser nula.");
        SortedPoints sorted = sorter.sort(source.getPoints());
        double[][] raw = reader.readAll(source, fields);

        SamplePermutation permutation = sorted.permutation();
        double[][] channels = new double[raw.length][];
        for (int c = 0; c < raw.length; c++) {
            channels[c] = permutation.apply(raw[c]);
        }
        return new SortedFrame(sorted, channels);
    }

    public GridShape inferShape(SortedFrame frame, int rank) {
        return shapeInference.infer(frame.sorted().points(), rank);
    }

    /**
     * Extracción 1D: coordenadas del eje de la línea y datos (canales, muestras), con el
     * filtro de rango opcional de la configuración aplicado por igual a puntos y canales.
     */
    public LineExtraction toLine(SortedFrame frame, List<String> channelNames) {
        Axis axis = config.getLineAxis();
        Double min = config.getLineMin();
        Double max = config.getLineMax();
        PointCloud points = frame.sorted().points();

        int n = points.size();
        int[] kept = new int[n];
        int m = 0;
        for (int i = 0; i < n; i++) {
            double v = points.coordinate(i, axis);
            if ((min == null || v >= min) && (max == null || v <= max)) {
                kept[m++] = i;
            }
        }

        double[] coordinates = new double[m];
        double[] packedPoints = new double[m * PointCloud.DIMENSIONS];
        double[] data = new double[frame.channels().length * m];
        for (int k = 0; k < m; k++) {
            int i = kept[k];
            coordinates[k] = points.coordinate(i, axis);
            packedPoints[k * 3] = points.x(i);
            packedPoints[k * 3 + 1] = points.y(i);
            packedPoints[k * 3 + 2] = points.z(i);
            for (int c = 0; c < frame.channels().length; c++) {
                data[c * m + k] = frame.channels()[c][i];
            }
        }
        if (m < n) {
            log.debug("Filtro de rango [{}, {}] sobre {}: {} de {} muestras conservadas.", min, max, axis, m, n);
        }

        return LineExtraction.builder()
                .coordinates(coordinates)
                .points(PointCloud.ofPacked(packedPoints))
                .data(NdArray.adopt(data, frame.channels().length, m))
                .channels(channelNames)
                .build();
    }

    public GridExtraction toGrid(SortedFrame frame, GridShape shape, List<String> channelNames) {
        return GridExtraction.builder()
                .shape(shape)
                .points(reshaper.reshapePoints(frame.sorted().points(), shape))
                .data(reshaper.reshape(frame.channels(), shape))
                .channels(channelNames)
                .build();
    }

    public Reshaper reshaper() {
        return reshaper;
    }
}
