package fieldgrid.domain.extraction;

import fieldgrid.domain.grid.NdArray;
import fieldgrid.domain.grid.PointCloud;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Resultado de una extracción 1D (p.ej. datos de un "plot over line").
 * <p>
 * No asume rejilla: conserva el orden plano de los puntos ordenados.
 */
@Value
public class LineExtraction implements IExtractionResult {

    /**
     * Coordenadas a lo largo del eje de la línea, una por muestra.
     */
    double[] coordinates;

    /**
     * Puntos completos (ordenados y filtrados) de los que salen las coordenadas.
     */
    PointCloud points;

    /**
     * Datos con forma (canales, muestras).
     */
    NdArray data;

    List<String> channels;

    @Builder
    public LineExtraction(double[] coordinates, PointCloud points, NdArray data, List<String> channels) {
        Objects.requireNonNull(coordinates, "Las coordenadas no pueden ser nulas.");
        Objects.requireNonNull(points, "Los puntos no pueden ser nulos.");
        Objects.requireNonNull(data, "Los datos no pueden ser nulos.");
        Objects.requireNonNull(channels, "Los canales no pueden ser nulos.");
        if (data.rank() != 2 || data.dim(0) != channels.size() || data.dim(1) != coordinates.length
                || points.size() != coordinates.length) {
            throw new IllegalArgumentException("Dimensiones inconsistentes en la extracción 1D: datos " + data
                    + ", canales " + channels.size() + ", muestras " + coordinates.length);
        }
        this.coordinates = coordinates.clone();
        this.points = points;
        this.data = data;
        this.channels = List.copyOf(channels);
    }

    public double[] getCoordinates() {
        return coordinates.clone();
    }

    public int getSampleCount() {
        return coordinates.length;
    }

    /**
     * Valores de un canal en el orden de {@link #getCoordinates()}.
     */
    public double[] getChannel(String channel) {
        return data.slice(channelIndex(channel)).flatten();
    }
}
