package fieldgrid.domain.extraction;

import fieldgrid.domain.grid.GridShape;
import fieldgrid.domain.grid.NdArray;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Resultado de una extracción 2D/3D sobre una rejilla estructurada.
 */
@Value
public class GridExtraction implements IExtractionResult {

    GridShape shape;

    /**
     * Coordenadas de la rejilla con forma (size_x[, size_y[, size_z]], 3).
     */
    NdArray points;

    /**
     * Datos con forma (canales, size_x[, size_y[, size_z]]).
     */
    NdArray data;

    List<String> channels;

    @Builder
    public GridExtraction(GridShape shape, NdArray points, NdArray data, List<String> channels) {
        Objects.requireNonNull(shape, "La forma no puede ser nula.");
        Objects.requireNonNull(points, "Los puntos no pueden ser nulos.");
        Objects.requireNonNull(data, "Los datos no pueden ser nulos.");
        Objects.requireNonNull(channels, "Los canales no pueden ser nulos.");
        if (data.rank() != shape.rank() + 1 || data.dim(0) != channels.size()) {
            throw new IllegalArgumentException("Los datos " + data + " no encajan con " + shape
                    + " y " + channels.size() + " canales.");
        }
        this.shape = shape;
        this.points = points;
        this.data = data;
        this.channels = List.copyOf(channels);
    }

    /**
     * Rejilla de un único canal con forma (size_x[, size_y[, size_z]]).
     */
    public NdArray getChannel(String channel) {
        return data.slice(channelIndex(channel));
    }
}
