package fieldgrid.domain.grid;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Extensión por eje de una rejilla estructurada separable: (size_x[, size_y[, size_z]]).
 * <p>
 * El eje X es el de variación más lenta y el último eje declarado el de variación más
 * rápida, igual que el orden de claves del ordenador de coordenadas.
 */
public final class GridShape {

    private static final int MAX_RANK = 3;

    private final int[] dims;

    private GridShape(int[] dims) {
        if (dims == null || dims.length == 0 || dims.length > MAX_RANK) {
            throw new IllegalArgumentException("Una forma de rejilla debe tener entre 1 y 3 ejes.");
        }
        for (int d : dims) {
            if (d <= 0) {
                throw new IllegalArgumentException("Todas las extensiones deben ser positivas: " + Arrays.toString(dims));
            }
        }
        this.dims = dims.clone();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static GridShape of(int... dims) {
        return new GridShape(dims);
    }

    public int rank() {
        return dims.length;
    }

    public int sizeX() {
        return dims[0];
    }

    public int sizeY() {
        return rank() > 1 ? dims[1] : 1;
    }

    public int sizeZ() {
        return rank() > 2 ? dims[2] : 1;
    }

    public int size(int axis) {
        return dims[axis];
    }

    /**
     * Número total de celdas. Se devuelve como {@code long} para detectar desbordamientos
     * antes de comparar con el número de muestras.
     */
    public long elementCount() {
        long count = 1L;
        for (int d : dims) {
            count *= d;
        }
        return count;
    }

    @JsonValue
    public int[] dims() {
        return dims.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(dims, ((GridShape) o).dims);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        return "GridShape" + Arrays.toString(dims);
    }
}
