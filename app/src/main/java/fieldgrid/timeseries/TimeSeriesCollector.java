package fieldgrid.timeseries;

import fieldgrid.domain.exception.ShapeMismatchException;
import fieldgrid.domain.extraction.GridExtraction;
import fieldgrid.domain.extraction.GridSeriesExtraction;
import fieldgrid.domain.extraction.LineExtraction;
import fieldgrid.domain.extraction.LineSeriesExtraction;
import fieldgrid.domain.field.FieldRef;
import fieldgrid.domain.grid.GridShape;
import fieldgrid.domain.grid.NdArray;
import fieldgrid.domain.source.IDataSource;
import fieldgrid.pipeline.FramePipeline;
import fieldgrid.pipeline.SortedFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recolector de series temporales.
 * <p>
 * Para cada instante t: reevalúa la fuente en t, ordena, lee los canales y acumula el frame.
 * El bucle es secuencial y conserva el orden de los instantes.
 * <p>
 * Variantes de rejilla fija (2D/3D en el tiempo): la forma se infiere UNA vez con los puntos
 * del primer frame y todos los frames se remodelan contra ella. Se asume una malla invariante
 * en el tiempo (no adaptativa); un frame con distinto número de muestras provoca un
 * {@link ShapeMismatchException} que identifica su índice temporal.
 */
@Slf4j
public class TimeSeriesCollector {

    private final FramePipeline pipeline;

    public TimeSeriesCollector(FramePipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "El pipeline no puede ser nulo.");
    }

    /**
     * Serie de extracciones 1D. No asume rejilla: los frames pueden tener longitudes distintas.
     *
     * @param times Instantes a evaluar; si es {@code null} se usan los declarados por la fuente.
     */
    public LineSeriesExtraction collectLines(IDataSource source, List<FieldRef> fields, List<Double> times) {
        List<Double> timeValues = resolveTimes(source, times);
        List<String> channels = channelNames(fields);

        List<LineExtraction> frames = new ArrayList<>(timeValues.size());
        for (int t = 0; t < timeValues.size(); t++) {
            SortedFrame frame = readFrame(source, fields, timeValues.get(t), t);
            frames.add(pipeline.toLine(frame, channels));
        }
        log.info("Serie 1D recolectada: {} instantes, {} canales.", frames.size(), channels.size());

        return LineSeriesExtraction.builder()
                .times(timeValues)
                .frames(frames)
                .channels(channels)
                .build();
    }

    /**
     * Serie temporal sobre rejilla fija de rango 2 o 3.
     *
     * @param times Instantes a evaluar; si es {@code null} se usan los declarados por la fuente.
     */
    public GridSeriesExtraction collectGrids(IDataSource source, List<FieldRef> fields, int rank, List<Double> times) {
        if (rank < 2 || rank > 3) {
            throw new IllegalArgumentException("Las series de rejilla solo admiten rango 2 o 3, recibido: " + rank);
        }
        List<Double> timeValues = resolveTimes(source, times);
        List<String> channels = channelNames(fields);

        List<SortedFrame> frames = new ArrayList<>(timeValues.size());
        for (int t = 0; t < timeValues.size(); t++) {
            frames.add(readFrame(source, fields, timeValues.get(t), t));
        }

        // Geometría fija: se resuelve con el primer frame antes de remodelar ninguno.
        GridShape shape;
        try {
            shape = pipeline.inferShape(frames.get(0), rank);
        } catch (ShapeMismatchException e) {
            throw ShapeMismatchException.atTimeIndex(e, 0, timeValues.get(0));
        }

        List<NdArray> points = new ArrayList<>(frames.size());
        List<NdArray> data = new ArrayList<>(frames.size());
        for (int t = 0; t < frames.size(); t++) {
            SortedFrame frame = frames.get(t);
            GridExtraction grid;
            try {
                if (frame.size() != shape.elementCount()) {
                    throw new ShapeMismatchException("El frame tiene " + frame.size() + " muestras pero la rejilla del primer frame "
                            + shape + " tiene " + shape.elementCount() + ".", shape.elementCount(), frame.size());
                }
                grid = pipeline.toGrid(frame, shape, channels);
            } catch (ShapeMismatchException e) {
                throw ShapeMismatchException.atTimeIndex(e, t, timeValues.get(t));
            }
            points.add(grid.getPoints());
            data.add(grid.getData());
        }
        log.info("Serie {}D recolectada: {} instantes, forma {}, {} canales.", rank, frames.size(), shape, channels.size());

        return GridSeriesExtraction.builder()
                .times(timeValues)
                .shape(shape)
                .points(points)
                .data(pipeline.reshaper().stack(data))
                .channels(channels)
                .build();
    }

    private SortedFrame readFrame(IDataSource source, List<FieldRef> fields, double time, int timeIndex) {
        log.debug("Evaluando frame {} (t={}).", timeIndex, time);
        IDataSource snapshot = source.atTime(time);
        try {
            return pipeline.sortAndRead(snapshot, fields);
        } catch (ShapeMismatchException e) {
            throw ShapeMismatchException.atTimeIndex(e, timeIndex, time);
        }
    }

    private static List<Double> resolveTimes(IDataSource source, List<Double> times) {
        Objects.requireNonNull(source, "La fuente de datos no puede ser nula.");
        List<Double> resolved = times != null ? List.copyOf(times) : source.getTimeValues();
        if (resolved == null || resolved.isEmpty()) {
            throw new IllegalArgumentException("No hay instantes de tiempo que evaluar: la fuente no declara ninguno y no se indicó una lista.");
        }
        return resolved;
    }

    private static List<String> channelNames(List<FieldRef> fields) {
        Objects.requireNonNull(fields, "La lista de campos no puede ser nula.");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Hay que solicitar al menos un campo.");
        }
        return fields.stream().map(FieldRef::channelName).toList();
    }
}
