package fieldgrid.domain.extraction;

import fieldgrid.domain.grid.GridShape;
import fieldgrid.domain.grid.NdArray;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Serie temporal sobre una rejilla fija (no adaptativa).
 * <p>
 * La forma se infiere una sola vez con el primer frame. Los datos de todos los frames se
 * apilan en un único array con forma (tiempo, canales, size_x[, size_y[, size_z]]).
 */
@Value
public class GridSeriesExtraction implements IExtractionResult {

    List<Double> times;

    GridShape shape;

    /**
     * Coordenadas de la rejilla de cada frame, forma (size_x[, size_y[, size_z]], 3).
     */
    List<NdArray> points;

    /**
     * Datos apilados con forma (tiempo, canales, size_x[, size_y[, size_z]]).
     */
    NdArray data;

    List<String> channels;

    @Builder
    public GridSeriesExtraction(List<Double> times, GridShape shape, List<NdArray> points,
                                NdArray data, List<String> channels) {
        Objects.requireNonNull(times, "Los instantes no pueden ser nulos.");
        Objects.requireNonNull(shape, "La forma no puede ser nula.");
        Objects.requireNonNull(points, "Los puntos no pueden ser nulos.");
        Objects.requireNonNull(data, "Los datos no pueden ser nulos.");
        Objects.requireNonNull(channels, "Los canales no pueden ser nulos.");
        if (points.size() != times.size() || data.dim(0) != times.size()
                || data.rank() != shape.rank() + 2 || data.dim(1) != channels.size()) {
            throw new IllegalArgumentException("Dimensiones inconsistentes en la serie: datos " + data
                    + ", instantes " + times.size() + ", canales " + channels.size() + ", " + shape);
        }
        this.times = List.copyOf(times);
        this.shape = shape;
        this.points = List.copyOf(points);
        this.data = data;
        this.channels = List.copyOf(channels);
    }

    public int getFrameCount() {
        return times.size();
    }

    /**
     * Vista de un único frame como extracción de rejilla.
     */
    public GridExtraction frameAt(int timeIndex) {
        return GridExtraction.builder()
                .shape(shape)
                .points(points.get(timeIndex))
                .data(data.slice(timeIndex))
                .channels(channels)
                .build();
    }
}
